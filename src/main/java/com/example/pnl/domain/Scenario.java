package com.example.pnl.domain;

/**
 * Fact-table dimension distinguishing recorded values from planned values. The warehouse stores
 * the scenario as its display label.
 */
public enum Scenario {
  ACTUALS("Actuals"),
  BUDGET("Budget");

  private final String label;

  Scenario(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Resolves a warehouse scenario label.
   *
   * @param label the stored label, e.g. "Actuals"
   * @return the scenario, or null when the label is not recognised
   */
  public static Scenario fromLabel(String label) {
    if (label == null) {
      return null;
    }
    String trimmed = label.trim();
    for (Scenario scenario : values()) {
      if (scenario.label.equalsIgnoreCase(trimmed)) {
        return scenario;
      }
    }
    return null;
  }
}
