package com.example.pnl.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/**
 * A row of the warehouse transaction summary table. Rows are loaded by the warehouse sync and are
 * read-only for reporting; the reporting queries aggregate them into {@link TransactionFact}s.
 */
@Entity
@Table(
    name = "fct_transactions_summary",
    indexes = {
      @Index(name = "idx_fct_time_customer", columnList = "time_date, customer_internal_id"),
      @Index(name = "idx_fct_time_region", columnList = "time_date, region_internal_id"),
      @Index(name = "idx_fct_time_subsidiary", columnList = "time_date, subsidiary_internal_id")
    })
public class TransactionSummary {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "time_date", nullable = false)
  private LocalDate timeDate;

  @Column(name = "account_internal_id")
  private Long accountInternalId;

  @Column(name = "customer_internal_id")
  private Long customerInternalId;

  @Column(name = "region_internal_id")
  private Long regionInternalId;

  @Column(name = "subsidiary_internal_id")
  private Long subsidiaryInternalId;

  @Column(name = "scenario", length = 20)
  private Scenario scenario;

  @NotNull
  @Column(name = "value", nullable = false, precision = 19, scale = 4)
  private BigDecimal value = BigDecimal.ZERO;

  public TransactionSummary() {}

  public TransactionSummary(
      LocalDate timeDate,
      Long accountInternalId,
      Long customerInternalId,
      Scenario scenario,
      BigDecimal value) {
    this.timeDate = timeDate;
    this.accountInternalId = accountInternalId;
    this.customerInternalId = customerInternalId;
    this.scenario = scenario;
    this.value = value;
  }

  public Long getId() {
    return id;
  }

  public LocalDate getTimeDate() {
    return timeDate;
  }

  public Long getAccountInternalId() {
    return accountInternalId;
  }

  public Long getCustomerInternalId() {
    return customerInternalId;
  }

  public Long getRegionInternalId() {
    return regionInternalId;
  }

  public void setRegionInternalId(Long regionInternalId) {
    this.regionInternalId = regionInternalId;
  }

  public Long getSubsidiaryInternalId() {
    return subsidiaryInternalId;
  }

  public void setSubsidiaryInternalId(Long subsidiaryInternalId) {
    this.subsidiaryInternalId = subsidiaryInternalId;
  }

  public Scenario getScenario() {
    return scenario;
  }

  public BigDecimal getValue() {
    return value;
  }
}
