package com.example.pnl.domain;

/** Levels of the organisational hierarchy, outermost first. */
public enum HierarchyLevel {
  SUBSIDIARY("Subsidiary"),
  REGION("Region"),
  DISTRICT("District"),
  FACILITY("Facility");

  private final String typeLabel;

  HierarchyLevel(String typeLabel) {
    this.typeLabel = typeLabel;
  }

  public String getTypeLabel() {
    return typeLabel;
  }
}
