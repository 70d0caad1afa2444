package com.example.pnl.domain;

/**
 * One node of the configured account tree. Nodes are keyed by their label; the parent is
 * referenced by label as well (null for a root section).
 *
 * @param label unique account label
 * @param parentLabel parent label, or null for roots
 * @param accountInternalId warehouse account id mapped to this label, may be null for pure
 *     grouping nodes
 * @param displayExcluded left out of every rollup and rendering
 * @param operationalExcluded additionally left out of operational P&Ls
 * @param doubleLines presentation only, draws rules above and below the row
 */
public record AccountNode(
    String label,
    String parentLabel,
    Long accountInternalId,
    boolean displayExcluded,
    boolean operationalExcluded,
    boolean doubleLines) {

  public static AccountNode of(String label, String parentLabel) {
    return new AccountNode(label, parentLabel, null, false, false, false);
  }
}
