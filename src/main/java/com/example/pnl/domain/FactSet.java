package com.example.pnl.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Facts of one period already held in memory. Sub-groups of customers are carved out of a fetched
 * set by filtering, never by another warehouse call.
 */
public final class FactSet {

  private static final FactSet EMPTY = new FactSet(List.of());

  private final List<TransactionFact> facts;
  private final Map<Long, List<TransactionFact>> byCustomer;

  private FactSet(List<TransactionFact> facts) {
    this.facts = List.copyOf(facts);
    Map<Long, List<TransactionFact>> index = new LinkedHashMap<>();
    for (TransactionFact fact : this.facts) {
      if (fact.customerId() != null) {
        index.computeIfAbsent(fact.customerId(), key -> new ArrayList<>()).add(fact);
      }
    }
    this.byCustomer = Collections.unmodifiableMap(index);
  }

  public static FactSet of(Collection<TransactionFact> facts) {
    return facts == null || facts.isEmpty() ? EMPTY : new FactSet(List.copyOf(facts));
  }

  public static FactSet empty() {
    return EMPTY;
  }

  /**
   * Returns the facts of the given customers, in the order the customers are listed. Facts without
   * a customer id are never part of a customer subset.
   */
  public FactSet forCustomers(Collection<Long> customerIds) {
    List<TransactionFact> subset = new ArrayList<>();
    for (Long customerId : customerIds) {
      subset.addAll(byCustomer.getOrDefault(customerId, List.of()));
    }
    return of(subset);
  }

  public List<TransactionFact> facts() {
    return facts;
  }

  public int size() {
    return facts.size();
  }

  public boolean isEmpty() {
    return facts.isEmpty();
  }
}
