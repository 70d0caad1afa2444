package com.example.pnl.service;

import com.example.pnl.domain.ReportNode;

/** Outcome of assembling one node: kept with its page tree, or pruned for lack of revenue. */
public record AssembledReport(boolean kept, ReportNode node) {

  private static final AssembledReport PRUNED = new AssembledReport(false, null);

  public static AssembledReport kept(ReportNode node) {
    return new AssembledReport(true, node);
  }

  public static AssembledReport pruned() {
    return PRUNED;
  }
}
