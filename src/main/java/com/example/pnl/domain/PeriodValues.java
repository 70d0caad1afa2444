package com.example.pnl.domain;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Rolled-up account values for one report node: actual and budget for the month and for the year
 * to date. Each map is keyed by account label.
 */
public record PeriodValues(
    Map<String, BigDecimal> monthActual,
    Map<String, BigDecimal> monthBudget,
    Map<String, BigDecimal> ytdActual,
    Map<String, BigDecimal> ytdBudget) {

  public static final String INCOME_ACCOUNT = "Income";

  public PeriodValues {
    monthActual = Map.copyOf(monthActual);
    monthBudget = Map.copyOf(monthBudget);
    ytdActual = Map.copyOf(ytdActual);
    ytdBudget = Map.copyOf(ytdBudget);
  }

  public BigDecimal incomeMonthActual() {
    return monthActual.getOrDefault(INCOME_ACCOUNT, BigDecimal.ZERO);
  }

  public BigDecimal incomeMonthBudget() {
    return monthBudget.getOrDefault(INCOME_ACCOUNT, BigDecimal.ZERO);
  }

  public BigDecimal incomeYtdActual() {
    return ytdActual.getOrDefault(INCOME_ACCOUNT, BigDecimal.ZERO);
  }

  public BigDecimal incomeYtdBudget() {
    return ytdBudget.getOrDefault(INCOME_ACCOUNT, BigDecimal.ZERO);
  }
}
