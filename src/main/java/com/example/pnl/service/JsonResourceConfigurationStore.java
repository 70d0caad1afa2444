package com.example.pnl.service;

import java.io.IOException;
import java.io.InputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads configuration documents from a Spring resource location such as {@code
 * classpath:dimension-config/} or {@code file:/etc/pnl/}. Documents are read on every call, so
 * edits are picked up by the next report request.
 */
@Service
public class JsonResourceConfigurationStore implements ConfigurationStore {

  private static final Logger log = LoggerFactory.getLogger(JsonResourceConfigurationStore.class);

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;
  private final String location;

  public JsonResourceConfigurationStore(
      ResourceLoader resourceLoader,
      ObjectMapper objectMapper,
      @Value("${pnl.config.location:classpath:dimension-config/}") String location) {
    this.resourceLoader = resourceLoader;
    this.objectMapper = objectMapper;
    this.location = location.endsWith("/") ? location : location + "/";
  }

  @Override
  public JsonNode readDocument(String documentName) {
    Resource resource = resourceLoader.getResource(location + documentName);
    if (!resource.exists()) {
      throw new InvalidConfigurationException(documentName, "not found at " + location);
    }
    try (InputStream in = resource.getInputStream()) {
      JsonNode document = objectMapper.readTree(in);
      if (document == null || !document.isObject()) {
        throw new InvalidConfigurationException(documentName, "expected a JSON object keyed by id");
      }
      log.debug("Read {} with {} entries", documentName, document.size());
      return document;
    } catch (IOException e) {
      throw new InvalidConfigurationException(documentName, "could not be read: " + e.getMessage(), e);
    }
  }
}
