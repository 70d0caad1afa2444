package com.example.pnl.service;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.pnl.domain.AccountNode;
import com.example.pnl.domain.FactSet;
import com.example.pnl.domain.PeriodValues;
import com.example.pnl.domain.RollupMode;
import com.example.pnl.domain.Scenario;
import com.example.pnl.domain.TransactionFact;

/**
 * Rolls raw per-account totals up the account tree. Pure and stateless: every call builds its own
 * memo table, so results do not depend on visiting order or on other calls.
 */
@Service
public class RollupEngine {

  private static final Logger log = LoggerFactory.getLogger(RollupEngine.class);

  /**
   * Sums fact values per account label for one scenario. Facts whose scenario is not recognised
   * are ignored; account ids missing from the hierarchy are reported under a synthetic label.
   */
  public Map<String, BigDecimal> buildAccountTotals(
      Collection<TransactionFact> facts, Scenario scenario, AccountHierarchy hierarchy) {
    Map<String, BigDecimal> totals = new LinkedHashMap<>();
    Set<Long> unknownIds = new HashSet<>();
    for (TransactionFact fact : facts) {
      if (fact.scenario() != scenario) {
        continue;
      }
      String label = hierarchy.labelFor(fact.accountInternalId());
      if (!hierarchy.isConfigured(label) && unknownIds.add(fact.accountInternalId())) {
        log.warn("Account id {} is not in the account configuration", fact.accountInternalId());
      }
      totals.merge(label, fact.value(), BigDecimal::add);
    }
    return totals;
  }

  /**
   * Computes the rolled-up value of every configured account.
   *
   * <p>{@code rollup(L) = raw(L) + sum(rollup(C))} over the children C of L that the mode does not
   * exclude. Excluded children are still computed so that their own subtree is available. Children
   * that are not configured contribute nothing. Raw totals for labels that are not configured are
   * carried over unchanged.
   *
   * @param rawTotals raw totals by label, missing labels count as zero
   * @param accounts configured accounts by label
   * @param childrenMap parent label to child labels
   * @param mode exclusion mode
   * @return rolled-up value per label
   */
  public Map<String, BigDecimal> computeRollups(
      Map<String, BigDecimal> rawTotals,
      Map<String, AccountNode> accounts,
      Map<String, List<String>> childrenMap,
      RollupMode mode) {
    Map<String, BigDecimal> memo = new HashMap<>();
    Set<String> inProgress = new HashSet<>();
    for (String label : accounts.keySet()) {
      compute(label, rawTotals, accounts, childrenMap, mode, memo, inProgress);
    }

    Map<String, BigDecimal> result = new LinkedHashMap<>();
    for (String label : accounts.keySet()) {
      result.put(label, memo.get(label));
    }
    rawTotals.forEach(
        (label, value) -> {
          if (!accounts.containsKey(label)) {
            result.put(label, value);
          }
        });
    return result;
  }

  public Map<String, BigDecimal> computeRollups(
      Map<String, BigDecimal> rawTotals, AccountHierarchy hierarchy, RollupMode mode) {
    return computeRollups(rawTotals, hierarchy.accounts(), hierarchy.childrenMap(), mode);
  }

  /** Runs the four independent rollups (actual/budget for month and YTD) of one report node. */
  public PeriodValues rollupPeriods(
      FactSet month, FactSet ytd, AccountHierarchy hierarchy, RollupMode mode) {
    return new PeriodValues(
        rollup(month, Scenario.ACTUALS, hierarchy, mode),
        rollup(month, Scenario.BUDGET, hierarchy, mode),
        rollup(ytd, Scenario.ACTUALS, hierarchy, mode),
        rollup(ytd, Scenario.BUDGET, hierarchy, mode));
  }

  private Map<String, BigDecimal> rollup(
      FactSet facts, Scenario scenario, AccountHierarchy hierarchy, RollupMode mode) {
    return computeRollups(buildAccountTotals(facts.facts(), scenario, hierarchy), hierarchy, mode);
  }

  private BigDecimal compute(
      String label,
      Map<String, BigDecimal> rawTotals,
      Map<String, AccountNode> accounts,
      Map<String, List<String>> childrenMap,
      RollupMode mode,
      Map<String, BigDecimal> memo,
      Set<String> inProgress) {
    BigDecimal cached = memo.get(label);
    if (cached != null) {
      return cached;
    }
    if (!inProgress.add(label)) {
      throw new InvalidConfigurationException(
          AccountHierarchy.ACCOUNT_CONFIG_DOCUMENT, "account parent cycle detected at '" + label + "'");
    }

    BigDecimal total = rawTotals.getOrDefault(label, BigDecimal.ZERO);
    for (String child : childrenMap.getOrDefault(label, List.of())) {
      AccountNode childNode = accounts.get(child);
      if (childNode == null) {
        continue;
      }
      BigDecimal childTotal =
          compute(child, rawTotals, accounts, childrenMap, mode, memo, inProgress);
      if (!mode.excludes(childNode)) {
        total = total.add(childTotal);
      }
    }

    inProgress.remove(label);
    memo.put(label, total);
    return total;
  }
}
