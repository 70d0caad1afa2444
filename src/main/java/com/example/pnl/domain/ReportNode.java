package com.example.pnl.domain;

import java.util.List;

/**
 * One assembled page of a multi-level P&L together with the pages below it. Headers are composed
 * after the children are known, so the counts always reflect the kept children.
 */
public record ReportNode(ReportHeader header, PeriodValues values, List<ReportNode> children) {

  public ReportNode {
    children = List.copyOf(children);
  }

  public HierarchyLevel level() {
    return header.level();
  }

  public String entityName() {
    return header.entityName();
  }

  /** Number of pages in this subtree including this one. */
  public int pageCount() {
    int count = 1;
    for (ReportNode child : children) {
      count += child.pageCount();
    }
    return count;
  }
}
