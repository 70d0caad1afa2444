package com.example.pnl.service;

import java.time.LocalDate;

import com.example.pnl.domain.HierarchyLevel;
import com.example.pnl.domain.PlType;

/**
 * A report request.
 *
 * @param level DISTRICT, REGION or SUBSIDIARY
 * @param selector picker value, see {@link ReportSelector}
 * @param period any date in the reporting month
 * @param crossFilter for a region report a department id, for a subsidiary report a region id;
 *     null, blank or {@code all} for no filter
 * @param plType flavour of the P&L, null for the configured default
 */
public record PnlReportRequest(
    HierarchyLevel level, String selector, LocalDate period, String crossFilter, PlType plType) {

  public static final String NO_FILTER = "all";

  public PnlReportRequest {
    if (level == null) {
      throw new IllegalArgumentException("Hierarchy level is required");
    }
    if (level == HierarchyLevel.FACILITY) {
      throw new IllegalArgumentException("Facility reports are produced as part of a district");
    }
    if (selector == null || selector.isBlank()) {
      throw new IllegalArgumentException("Selector is required");
    }
    if (period == null) {
      throw new IllegalArgumentException("Period date is required");
    }
  }

  public static PnlReportRequest of(HierarchyLevel level, String selector, LocalDate period) {
    return new PnlReportRequest(level, selector, period, null, null);
  }

  public boolean hasCrossFilter() {
    return crossFilter != null && !crossFilter.isBlank() && !NO_FILTER.equalsIgnoreCase(crossFilter.trim());
  }
}
