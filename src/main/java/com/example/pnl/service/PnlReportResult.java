package com.example.pnl.service;

import java.time.LocalDate;

import com.example.pnl.domain.HierarchyLevel;
import com.example.pnl.domain.ReportNode;

/** Outcome of a report request. Only {@link Status#OK} results carry a report. */
public record PnlReportResult(
    Status status,
    String message,
    HierarchyLevel level,
    String selectedLabel,
    LocalDate period,
    ReportNode report,
    String html,
    boolean noRevenue) {

  public enum Status {
    OK,
    NOT_FOUND,
    EXCLUDED
  }

  public static PnlReportResult ok(
      HierarchyLevel level,
      String selectedLabel,
      LocalDate period,
      ReportNode report,
      String html,
      boolean noRevenue) {
    return new PnlReportResult(
        Status.OK,
        "Generated " + report.pageCount() + " pages",
        level,
        selectedLabel,
        period,
        report,
        html,
        noRevenue);
  }

  public static PnlReportResult notFound(HierarchyLevel level, String message) {
    return new PnlReportResult(Status.NOT_FOUND, message, level, null, null, null, null, false);
  }

  public static PnlReportResult excluded(HierarchyLevel level, String selectedLabel) {
    return new PnlReportResult(
        Status.EXCLUDED,
        "Reporting is disabled for " + selectedLabel,
        level,
        selectedLabel,
        null,
        null,
        null,
        false);
  }

  public boolean isOk() {
    return status == Status.OK;
  }

  public Integer regionCount() {
    return report == null ? null : report.header().regionCount();
  }

  public Integer districtCount() {
    return report == null ? null : report.header().districtCount();
  }

  public Integer facilityCount() {
    return report == null ? null : report.header().facilityCount();
  }
}
