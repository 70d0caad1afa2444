package com.example.pnl.domain;

import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/** Inclusive date range of a fact fetch. */
public record ReportPeriod(LocalDate startDate, LocalDate endDate) {

  /** The calendar month containing the date. */
  public static ReportPeriod month(LocalDate date) {
    return new ReportPeriod(date.withDayOfMonth(1), date.with(TemporalAdjusters.lastDayOfMonth()));
  }

  /** January 1 of the date's year through the end of its month. */
  public static ReportPeriod yearToDate(LocalDate date) {
    return new ReportPeriod(date.withDayOfYear(1), date.with(TemporalAdjusters.lastDayOfMonth()));
  }

  public static ReportPeriod of(LocalDate date, boolean ytd) {
    return ytd ? yearToDate(date) : month(date);
  }
}
