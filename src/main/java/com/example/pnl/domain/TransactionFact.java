package com.example.pnl.domain;

import java.math.BigDecimal;

/**
 * A warehouse fact aggregated per account, customer, region, subsidiary and scenario for one
 * reporting period (month or year-to-date). The account label is resolved through the account
 * hierarchy.
 */
public record TransactionFact(
    Long accountInternalId,
    Long customerId,
    Long regionId,
    Long subsidiaryId,
    Scenario scenario,
    BigDecimal value) {

  public TransactionFact {
    if (value == null) {
      value = BigDecimal.ZERO;
    }
  }
}
