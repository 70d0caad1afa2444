package com.example.pnl.service;

import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.pnl.domain.CustomerDimension;
import com.example.pnl.domain.CustomerPlacement;
import com.example.pnl.domain.FactFilter;
import com.example.pnl.domain.ReportPeriod;
import com.example.pnl.domain.TransactionFact;
import com.example.pnl.repository.CustomerDimensionRepository;
import com.example.pnl.repository.TransactionSummaryRepository;

/** Warehouse access through the relational mirror of the summary fact and customer tables. */
@Service
@Transactional(readOnly = true)
public class JpaFactWarehouse implements FactWarehouse {

  private static final Logger log = LoggerFactory.getLogger(JpaFactWarehouse.class);

  private final TransactionSummaryRepository transactionSummaryRepository;
  private final CustomerDimensionRepository customerDimensionRepository;

  public JpaFactWarehouse(
      TransactionSummaryRepository transactionSummaryRepository,
      CustomerDimensionRepository customerDimensionRepository) {
    this.transactionSummaryRepository = transactionSummaryRepository;
    this.customerDimensionRepository = customerDimensionRepository;
  }

  @Override
  public List<TransactionFact> fetchFacts(FactFilter filter, LocalDate period, boolean ytd) {
    if (period == null) {
      throw new IllegalArgumentException("Period date is required");
    }
    ReportPeriod range = ReportPeriod.of(period, ytd);
    List<TransactionFact> facts =
        switch (filter.level()) {
          case REGION -> transactionSummaryRepository.sumByRegion(
              filter.regionId(), filter.subsidiaryId(), range.startDate(), range.endDate());
          case SUBSIDIARY -> transactionSummaryRepository.sumBySubsidiary(
              filter.subsidiaryId(), filter.regionId(), range.startDate(), range.endDate());
          default -> filter.customerIds().isEmpty()
              ? List.of()
              : transactionSummaryRepository.sumByCustomers(
                  filter.customerIds(), range.startDate(), range.endDate());
        };
    log.debug(
        "Fetched {} {} facts for {} between {} and {}",
        facts.size(),
        ytd ? "YTD" : "month",
        filter.level(),
        range.startDate(),
        range.endDate());
    return facts;
  }

  @Override
  public List<CustomerPlacement> fetchEntitiesInRegion(Long regionId, Long subsidiaryId) {
    return customerDimensionRepository.findInRegion(regionId, subsidiaryId).stream()
        .map(JpaFactWarehouse::toPlacement)
        .toList();
  }

  @Override
  public List<CustomerPlacement> fetchEntitiesInSubsidiary(Long subsidiaryId, Long regionId) {
    return customerDimensionRepository.findInSubsidiary(subsidiaryId, regionId).stream()
        .map(JpaFactWarehouse::toPlacement)
        .toList();
  }

  @Override
  public List<LocalDate> availablePeriods(LocalDate before) {
    return transactionSummaryRepository.findDistinctTimeDatesBefore(before);
  }

  private static CustomerPlacement toPlacement(CustomerDimension customer) {
    return new CustomerPlacement(
        customer.getCustomerInternalId(),
        customer.getDisplayName(),
        customer.getRegionInternalId(),
        customer.getSubsidiaryInternalId());
  }
}
