package com.example.pnl.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.pnl.domain.AccountNode;

/**
 * Immutable account tree for one report request. Accounts are keyed by label; children keep the
 * order in which the nodes were configured so that rendering is reproducible.
 */
public final class AccountHierarchy {

  private static final Logger log = LoggerFactory.getLogger(AccountHierarchy.class);

  public static final String ACCOUNT_CONFIG_DOCUMENT = "account_config.json";
  public static final String UNKNOWN_ACCOUNT_PREFIX = "Unknown Account ";

  private final Map<String, AccountNode> accounts;
  private final Map<String, List<String>> childrenMap;
  private final Map<Long, String> labelsByAccountId;

  private AccountHierarchy(
      Map<String, AccountNode> accounts,
      Map<String, List<String>> childrenMap,
      Map<Long, String> labelsByAccountId) {
    this.accounts = Collections.unmodifiableMap(accounts);
    this.childrenMap = Collections.unmodifiableMap(childrenMap);
    this.labelsByAccountId = Collections.unmodifiableMap(labelsByAccountId);
  }

  /**
   * Builds the hierarchy and verifies that the parent graph is acyclic.
   *
   * @param nodes configured nodes; nodes without a label are skipped, a repeated label replaces the
   *     earlier node
   * @return the hierarchy
   * @throws InvalidConfigurationException if following parent links ever revisits a label
   */
  public static AccountHierarchy of(Collection<AccountNode> nodes) {
    Map<String, AccountNode> accounts = new LinkedHashMap<>();
    Map<Long, String> labelsByAccountId = new LinkedHashMap<>();
    for (AccountNode node : nodes) {
      if (node == null || node.label() == null || node.label().isBlank()) {
        continue;
      }
      if (accounts.put(node.label(), node) != null) {
        log.warn("Account label '{}' is configured more than once, using the last entry", node.label());
      }
      if (node.accountInternalId() != null) {
        labelsByAccountId.put(node.accountInternalId(), node.label());
      }
    }

    checkForCycles(accounts);

    Map<String, List<String>> childrenMap = buildChildrenMap(accounts.values());
    Map<String, List<String>> frozen = new LinkedHashMap<>();
    childrenMap.forEach((parent, children) -> frozen.put(parent, List.copyOf(children)));
    return new AccountHierarchy(accounts, frozen, labelsByAccountId);
  }

  /**
   * Maps each parent label to its child labels, in the order the children are encountered. Every
   * node with a non-null parent appears exactly once.
   */
  public static Map<String, List<String>> buildChildrenMap(Collection<AccountNode> nodes) {
    Map<String, List<String>> childrenMap = new LinkedHashMap<>();
    for (AccountNode node : nodes) {
      if (node == null || node.label() == null) {
        continue;
      }
      String parent = node.parentLabel();
      if (parent != null) {
        childrenMap.computeIfAbsent(parent, key -> new ArrayList<>()).add(node.label());
      }
    }
    return childrenMap;
  }

  private static void checkForCycles(Map<String, AccountNode> accounts) {
    Set<String> verified = new HashSet<>();
    for (String start : accounts.keySet()) {
      Set<String> path = new HashSet<>();
      String current = start;
      while (current != null && !verified.contains(current)) {
        if (!path.add(current)) {
          throw new InvalidConfigurationException(
              ACCOUNT_CONFIG_DOCUMENT, "account parent cycle detected at '" + current + "'");
        }
        AccountNode node = accounts.get(current);
        current = node != null ? node.parentLabel() : null;
      }
      verified.addAll(path);
    }
  }

  public Map<String, AccountNode> accounts() {
    return accounts;
  }

  public Map<String, List<String>> childrenMap() {
    return childrenMap;
  }

  public AccountNode node(String label) {
    return accounts.get(label);
  }

  public List<String> childrenOf(String label) {
    return childrenMap.getOrDefault(label, List.of());
  }

  public boolean hasChildren(String label) {
    return !childrenOf(label).isEmpty();
  }

  /**
   * Resolves a warehouse account id to its configured label. Unmapped ids get a synthetic label so
   * that their values stay visible instead of failing the report.
   */
  public String labelFor(Long accountInternalId) {
    String label = labelsByAccountId.get(accountInternalId);
    return label != null ? label : UNKNOWN_ACCOUNT_PREFIX + accountInternalId;
  }

  public boolean isConfigured(String label) {
    return accounts.containsKey(label);
  }

  public int size() {
    return accounts.size();
  }
}
