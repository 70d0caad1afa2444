package com.example.pnl.domain;

import java.util.List;

/** A P&L section: an underlined heading followed by the rows of its top-level accounts. */
public record ReportSection(String header, List<String> accounts) {

  public ReportSection {
    accounts = List.copyOf(accounts);
  }

  /** Sections of the standard P&L layout, in display order. */
  public static List<ReportSection> defaults() {
    return List.of(
        new ReportSection("REVENUE", List.of("Income")),
        new ReportSection("COST OF GOODS SOLD", List.of("Cost of Sales", "Gross Profit")),
        new ReportSection(
            "EXPENSES",
            List.of("Expense", "Net Ordinary Income", "Net Income", "Other Income and Expenses")));
  }
}
