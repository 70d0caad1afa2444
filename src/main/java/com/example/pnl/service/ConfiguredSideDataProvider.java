package com.example.pnl.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.example.pnl.domain.CensusFigures;
import com.example.pnl.domain.Facility;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Supplies the configured start date and, when a census document is configured, the census
 * figures filed under the facility's census code for the report month.
 *
 * <p>The census document is keyed by census code, then by month ({@code 2025-12}), each month
 * holding {@code actual} and {@code budget} figures.
 */
@Service
public class ConfiguredSideDataProvider implements FacilitySideDataProvider {

  private static final Logger log = LoggerFactory.getLogger(ConfiguredSideDataProvider.class);

  private final ConfigurationStore configurationStore;
  private final String censusDocument;

  public ConfiguredSideDataProvider(
      ConfigurationStore configurationStore,
      @Value("${pnl.census.document:}") String censusDocument) {
    this.configurationStore = configurationStore;
    this.censusDocument = censusDocument == null ? "" : censusDocument.trim();
  }

  @Override
  public CensusFigures sideDataFor(Facility facility, LocalDate period) {
    if (facility == null) {
      return CensusFigures.none();
    }
    String startDate =
        facility.startDate() == null || facility.startDate().isBlank() ? null : facility.startDate();

    BigDecimal actual = null;
    BigDecimal budget = null;
    if (facility.censusCode() != null && period != null && !censusDocument.isEmpty()) {
      String month = YearMonth.from(period).toString();
      JsonNode figures =
          configurationStore.readDocument(censusDocument).path(facility.censusCode()).path(month);
      actual = decimal(figures, "actual", facility.censusCode());
      budget = decimal(figures, "budget", facility.censusCode());
      if (actual == null && budget == null) {
        log.debug("No census figures for {} in {}", facility.censusCode(), month);
      }
    }

    if (actual == null && budget == null && startDate == null) {
      return CensusFigures.none();
    }
    return new CensusFigures(actual, budget, startDate);
  }

  private static BigDecimal decimal(JsonNode figures, String field, String censusCode) {
    JsonNode value = figures.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isNumber()) {
      return value.decimalValue();
    }
    try {
      return new BigDecimal(value.asText().trim());
    } catch (NumberFormatException e) {
      log.warn("Census {} for {} is not a number: '{}'", field, censusCode, value.asText());
      return null;
    }
  }
}
