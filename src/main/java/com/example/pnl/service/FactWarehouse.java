package com.example.pnl.service;

import java.time.LocalDate;
import java.util.List;

import com.example.pnl.domain.CustomerPlacement;
import com.example.pnl.domain.FactFilter;
import com.example.pnl.domain.TransactionFact;

/**
 * Read-only access to the analytics warehouse. Report assembly calls {@link #fetchFacts} a fixed
 * number of times per report and filters the results in memory.
 */
public interface FactWarehouse {

  /**
   * Fetches facts aggregated per account, customer, region, subsidiary and scenario.
   *
   * @param filter customers, region or subsidiary to restrict to
   * @param period any date in the reporting month
   * @param ytd false for the month alone, true for January 1 through the end of the month
   */
  List<TransactionFact> fetchFacts(FactFilter filter, LocalDate period, boolean ytd);

  /** Customers placed in the region, optionally restricted to one subsidiary. */
  List<CustomerPlacement> fetchEntitiesInRegion(Long regionId, Long subsidiaryId);

  /** Customers placed in the subsidiary, optionally restricted to one region. */
  List<CustomerPlacement> fetchEntitiesInSubsidiary(Long subsidiaryId, Long regionId);

  /** Distinct period dates strictly before the given date, newest first. */
  List<LocalDate> availablePeriods(LocalDate before);
}
