package com.example.pnl.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.Size;

/** Warehouse customer dimension: which region and subsidiary a customer currently belongs to. */
@Entity
@Table(
    name = "dim_customers",
    indexes = {
      @Index(name = "idx_dim_customers_region", columnList = "region_internal_id"),
      @Index(name = "idx_dim_customers_subsidiary", columnList = "subsidiary_internal_id")
    })
public class CustomerDimension {

  @Id
  @Column(name = "customer_internal_id")
  private Long customerInternalId;

  @Size(max = 255)
  @Column(name = "display_name", length = 255)
  private String displayName;

  @Column(name = "region_internal_id")
  private Long regionInternalId;

  @Column(name = "subsidiary_internal_id")
  private Long subsidiaryInternalId;

  public CustomerDimension() {}

  public CustomerDimension(
      Long customerInternalId,
      String displayName,
      Long regionInternalId,
      Long subsidiaryInternalId) {
    this.customerInternalId = customerInternalId;
    this.displayName = displayName;
    this.regionInternalId = regionInternalId;
    this.subsidiaryInternalId = subsidiaryInternalId;
  }

  public Long getCustomerInternalId() {
    return customerInternalId;
  }

  public String getDisplayName() {
    return displayName;
  }

  public Long getRegionInternalId() {
    return regionInternalId;
  }

  public Long getSubsidiaryInternalId() {
    return subsidiaryInternalId;
  }
}
