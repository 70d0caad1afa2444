package com.example.pnl.service;

import java.util.List;

import com.example.pnl.domain.FactSet;
import com.example.pnl.domain.TransactionFact;

/**
 * The four fact sets behind one report: the selected node's own month and YTD facts, and the
 * month and YTD facts of every member customer, from which all lower levels are filtered.
 */
public record ReportFacts(
    FactSet summaryMonth, FactSet summaryYtd, FactSet membersMonth, FactSet membersYtd) {

  public static ReportFacts of(
      List<TransactionFact> summaryMonth,
      List<TransactionFact> summaryYtd,
      List<TransactionFact> membersMonth,
      List<TransactionFact> membersYtd) {
    return new ReportFacts(
        FactSet.of(summaryMonth),
        FactSet.of(summaryYtd),
        FactSet.of(membersMonth),
        FactSet.of(membersYtd));
  }
}
