package com.example.pnl.domain;

import java.math.BigDecimal;

/** Display-only side data for a facility header. Any field may be null. */
public record CensusFigures(BigDecimal actualCensus, BigDecimal budgetCensus, String startDate) {

  public static CensusFigures none() {
    return new CensusFigures(null, null, null);
  }
}
