package com.example.pnl.domain;

import java.util.List;

/**
 * Restriction applied to a fact fetch. District-level fetches name the customers; region and
 * subsidiary fetches name the unit and optionally cross-filter on the other dimension.
 */
public record FactFilter(
    HierarchyLevel level, List<Long> customerIds, Long regionId, Long subsidiaryId) {

  public FactFilter {
    customerIds = customerIds == null ? List.of() : List.copyOf(customerIds);
  }

  public static FactFilter forCustomers(List<Long> customerIds) {
    return new FactFilter(HierarchyLevel.DISTRICT, customerIds, null, null);
  }

  public static FactFilter forRegion(Long regionId, Long subsidiaryId) {
    if (regionId == null) {
      throw new IllegalArgumentException("Region id is required");
    }
    return new FactFilter(HierarchyLevel.REGION, List.of(), regionId, subsidiaryId);
  }

  public static FactFilter forSubsidiary(Long subsidiaryId, Long regionId) {
    if (subsidiaryId == null) {
      throw new IllegalArgumentException("Subsidiary id is required");
    }
    return new FactFilter(HierarchyLevel.SUBSIDIARY, List.of(), regionId, subsidiaryId);
  }
}
