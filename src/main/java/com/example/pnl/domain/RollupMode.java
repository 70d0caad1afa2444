package com.example.pnl.domain;

/**
 * Exclusion mode applied when rolling child accounts into their parents. Standard reports use
 * {@link #DISPLAY}; operational reports additionally drop operationally excluded accounts.
 */
public enum RollupMode {
  DISPLAY,
  OPERATIONAL;

  /**
   * Whether the given account is left out of its parent's total (and out of the rendered rows)
   * under this mode.
   */
  public boolean excludes(AccountNode node) {
    if (node == null) {
      return false;
    }
    if (this == OPERATIONAL) {
      return node.operationalExcluded() || node.displayExcluded();
    }
    return node.displayExcluded();
  }
}
