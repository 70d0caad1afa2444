package com.example.pnl.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Number, percentage and period formatting for P&L pages. Negative amounts are shown in
 * parentheses and anything closer to zero than {@link #EPSILON} is shown as a dash.
 */
public final class PnlFormatter {

  public static final BigDecimal EPSILON = new BigDecimal("0.0001");
  public static final String DASH = "-";

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private PnlFormatter() {}

  public static boolean isNegligible(BigDecimal value) {
    return value == null || value.abs().compareTo(EPSILON) < 0;
  }

  /** Rounds to a whole number with thousands separators, e.g. {@code (1,234)} for -1234.4. */
  public static String formatNumber(BigDecimal value) {
    if (isNegligible(value)) {
      return DASH;
    }
    BigDecimal rounded = value.abs().setScale(0, RoundingMode.HALF_UP);
    String digits = String.format(Locale.US, "%,d", rounded.toBigInteger());
    return value.signum() < 0 ? "(" + digits + ")" : digits;
  }

  /** One decimal place and a percent sign; a dash when there is no percentage. */
  public static String formatPercent(BigDecimal percent) {
    if (isNegligible(percent)) {
      return DASH;
    }
    return String.format(Locale.US, "%.1f%%", percent.setScale(1, RoundingMode.HALF_UP));
  }

  /**
   * Share of the income total in percent.
   *
   * @return null when the income total is zero or missing
   */
  public static BigDecimal percent(BigDecimal value, BigDecimal income) {
    if (income == null || income.signum() == 0) {
      return null;
    }
    BigDecimal amount = value == null ? BigDecimal.ZERO : value;
    return amount.multiply(HUNDRED).divide(income, 6, RoundingMode.HALF_UP);
  }

  /** {@code 2025-12-01} becomes {@code Dec - 2025}. */
  public static String formatMonthLabel(LocalDate date) {
    if (date == null) {
      return "";
    }
    return date.getMonth().getDisplayName(TextStyle.SHORT, Locale.US) + " - " + date.getYear();
  }
}
