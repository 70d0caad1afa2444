package com.example.pnl.domain;

import java.util.List;

/**
 * A region or subsidiary (department) node from the region/department configuration.
 *
 * @param configId node id in the configuration document
 * @param label display label
 * @param parentId parent node id, null for the root
 * @param internalId warehouse region or subsidiary internal id
 * @param tags configured tags
 * @param displayExcluded hidden from listings
 * @param operationalExcluded hidden from listings
 */
public record HierarchyUnit(
    String configId,
    String label,
    String parentId,
    Long internalId,
    List<String> tags,
    boolean displayExcluded,
    boolean operationalExcluded) {

  /** Leaf units hang directly below the "All ..." node, whose id is "2". */
  public static final String LEAF_PARENT_ID = "2";

  public HierarchyUnit {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public boolean isSelectableLeaf() {
    return LEAF_PARENT_ID.equals(parentId) && !displayExcluded && !operationalExcluded;
  }
}
