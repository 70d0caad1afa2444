package com.example.pnl.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.pnl.domain.CensusFigures;
import com.example.pnl.domain.FactSet;
import com.example.pnl.domain.HierarchyLevel;
import com.example.pnl.domain.PeriodValues;
import com.example.pnl.domain.ReportHeader;
import com.example.pnl.domain.ReportNode;
import com.example.pnl.domain.RollupMode;

/**
 * Builds the page tree of a multi-level report from facts that were already fetched.
 *
 * <p>The selected node is rolled up from its own summary facts. Every node below it is rolled up
 * from the member facts, filtered in memory to the node's customers. Facilities without month
 * income are pruned; districts, regions and subsidiaries are always kept. Header counts are taken
 * from the kept children, so each header is composed exactly once.
 */
@Service
public class ReportAssembler {

  private static final Logger log = LoggerFactory.getLogger(ReportAssembler.class);

  private final RollupEngine rollupEngine;
  private final FacilitySideDataProvider sideDataProvider;

  public ReportAssembler(RollupEngine rollupEngine, FacilitySideDataProvider sideDataProvider) {
    this.rollupEngine = rollupEngine;
    this.sideDataProvider = sideDataProvider;
  }

  public AssembledReport assembleReport(
      ReportScope scope,
      ReportFacts facts,
      AccountHierarchy hierarchy,
      RollupMode mode,
      LocalDate period) {
    Context context = new Context(facts, hierarchy, mode, period);
    AssembledReport report = assemble(scope, facts.summaryMonth(), facts.summaryYtd(), context);
    if (report.kept()) {
      log.info(
          "Assembled {} report '{}' with {} pages",
          scope.level(),
          scope.name(),
          report.node().pageCount());
    }
    return report;
  }

  private AssembledReport assemble(
      ReportScope scope, FactSet month, FactSet ytd, Context context) {
    PeriodValues values =
        rollupEngine.rollupPeriods(month, ytd, context.hierarchy(), context.mode());

    if (scope.level() == HierarchyLevel.FACILITY) {
      return assembleFacility(scope, values, context);
    }

    List<ReportNode> children = new ArrayList<>();
    for (ReportScope childScope : scope.children()) {
      List<Long> customerIds = childScope.customerIds();
      AssembledReport child =
          assemble(
              childScope,
              context.facts().membersMonth().forCustomers(customerIds),
              context.facts().membersYtd().forCustomers(customerIds),
              context);
      if (child.kept()) {
        children.add(child.node());
      }
    }
    return AssembledReport.kept(new ReportNode(composeHeader(scope, children), values, children));
  }

  private AssembledReport assembleFacility(ReportScope scope, PeriodValues values, Context context) {
    if (PnlFormatter.isNegligible(values.incomeMonthActual())) {
      log.debug(
          "Pruning facility '{}': month income {}", scope.name(), values.incomeMonthActual());
      return AssembledReport.pruned();
    }
    CensusFigures census = sideDataProvider.sideDataFor(scope.facility(), context.period());
    ReportHeader header =
        new ReportHeader(
            HierarchyLevel.FACILITY,
            scope.name(),
            false,
            scope.parentName(),
            null,
            null,
            null,
            census == null ? CensusFigures.none() : census);
    return AssembledReport.kept(new ReportNode(header, values, List.of()));
  }

  /** Header of a container node, with counts taken from its kept children. */
  static ReportHeader composeHeader(ReportScope scope, List<ReportNode> children) {
    int facilities = 0;
    int districts = 0;
    for (ReportNode child : children) {
      ReportHeader header = child.header();
      switch (child.level()) {
        case FACILITY -> facilities++;
        case DISTRICT -> {
          districts++;
          facilities += valueOf(header.facilityCount());
        }
        default -> {
          districts += valueOf(header.districtCount());
          facilities += valueOf(header.facilityCount());
        }
      }
    }

    return switch (scope.level()) {
      case SUBSIDIARY -> new ReportHeader(
          scope.level(), scope.name(), false, null, children.size(), districts, facilities, null);
      case REGION -> new ReportHeader(
          scope.level(), scope.name(), false, null, null, districts, facilities, null);
      default -> new ReportHeader(
          scope.level(), scope.name(), scope.tagSelection(), null, null, null, facilities, null);
    };
  }

  private static int valueOf(Integer count) {
    return count == null ? 0 : count;
  }

  private record Context(
      ReportFacts facts, AccountHierarchy hierarchy, RollupMode mode, LocalDate period) {}
}
