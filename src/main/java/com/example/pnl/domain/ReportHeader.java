package com.example.pnl.domain;

/**
 * Header data of one report page. Counts are null where they do not apply to the level.
 *
 * @param level hierarchy level of the node
 * @param entityName title of the page
 * @param tagSelection whether a district page stands for a tag rather than a single district
 * @param parentName parent district label, facilities only
 * @param regionCount kept regions below the node
 * @param districtCount kept districts below the node
 * @param facilityCount kept facilities below the node
 * @param census census and start date, facilities and districts only
 */
public record ReportHeader(
    HierarchyLevel level,
    String entityName,
    boolean tagSelection,
    String parentName,
    Integer regionCount,
    Integer districtCount,
    Integer facilityCount,
    CensusFigures census) {

  public String typeLabel() {
    if (level == HierarchyLevel.DISTRICT && tagSelection) {
      return "District Tag";
    }
    return level.getTypeLabel();
  }
}
