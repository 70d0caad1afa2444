package com.example.pnl.domain;

/** P&L flavour requested by the caller. */
public enum PlType {
  STANDARD(RollupMode.DISPLAY),
  OPERATIONAL(RollupMode.OPERATIONAL);

  private final RollupMode rollupMode;

  PlType(RollupMode rollupMode) {
    this.rollupMode = rollupMode;
  }

  public RollupMode getRollupMode() {
    return rollupMode;
  }
}
