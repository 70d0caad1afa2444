package com.example.pnl.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.example.pnl.domain.Facility;
import com.example.pnl.domain.HierarchyLevel;

/**
 * What a report covers, resolved from configuration before any fact is fetched: the selected node
 * and the groups below it down to single facilities.
 *
 * @param level level of this node
 * @param name page title
 * @param tagSelection district pages only, true when the node stands for a tag group
 * @param facility the facility of a leaf node, null otherwise
 * @param parentName parent district label of a leaf node
 * @param children nodes one level down
 */
public record ReportScope(
    HierarchyLevel level,
    String name,
    boolean tagSelection,
    Facility facility,
    String parentName,
    List<ReportScope> children) {

  public ReportScope {
    children = children == null ? List.of() : List.copyOf(children);
  }

  public static ReportScope facility(Facility facility, String parentName) {
    return new ReportScope(
        HierarchyLevel.FACILITY, facility.label(), false, facility, parentName, List.of());
  }

  public static ReportScope district(String name, boolean tagSelection, List<ReportScope> facilities) {
    return new ReportScope(HierarchyLevel.DISTRICT, name, tagSelection, null, null, facilities);
  }

  public static ReportScope region(String name, List<ReportScope> districts) {
    return new ReportScope(HierarchyLevel.REGION, name, false, null, null, districts);
  }

  public static ReportScope subsidiary(String name, List<ReportScope> regions) {
    return new ReportScope(HierarchyLevel.SUBSIDIARY, name, false, null, null, regions);
  }

  /** Every customer id below this node, each once, in tree order. */
  public List<Long> customerIds() {
    Set<Long> ids = new LinkedHashSet<>();
    collectCustomerIds(ids);
    return new ArrayList<>(ids);
  }

  private void collectCustomerIds(Set<Long> ids) {
    if (facility != null && facility.customerId() != null) {
      ids.add(facility.customerId());
    }
    for (ReportScope child : children) {
      child.collectCustomerIds(ids);
    }
  }
}
