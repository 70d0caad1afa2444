package com.example.pnl.service;

import com.fasterxml.jackson.databind.JsonNode;

/** Read-only source of the JSON dimension configuration documents. */
public interface ConfigurationStore {

  /**
   * Reads one configuration document.
   *
   * @param documentName file name, e.g. {@code customer_config.json}
   * @return the parsed document
   * @throws InvalidConfigurationException if the document is missing or not valid JSON
   */
  JsonNode readDocument(String documentName);
}
