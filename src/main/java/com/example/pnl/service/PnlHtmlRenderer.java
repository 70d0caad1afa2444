package com.example.pnl.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import com.example.pnl.domain.AccountNode;
import com.example.pnl.domain.CensusFigures;
import com.example.pnl.domain.PeriodValues;
import com.example.pnl.domain.ReportHeader;
import com.example.pnl.domain.ReportNode;
import com.example.pnl.domain.ReportSection;
import com.example.pnl.domain.RollupMode;

/**
 * Renders an assembled page tree as one HTML document, one page per node in pre-order.
 *
 * <p>Rows follow the account tree: children are listed before their parent's total row, excluded
 * accounts are skipped but their children are still listed, and rows without month or YTD actuals
 * are left out.
 */
@Service
public class PnlHtmlRenderer {

  static final String UNMAPPED_SECTION = "UNMAPPED ACCOUNTS";

  private static final int INDENT_PX = 8;
  private static final String RULES = "border-top: 1px solid black; border-bottom: 1px solid black;";

  private static final String STYLE =
      "body { font-family: Arial, sans-serif; font-size: 11px; }\n"
          + ".page-break { page-break-after: always; }\n"
          + ".pnl-title { font-size: 16px; font-weight: 700; }\n"
          + ".pnl-subtitle { font-size: 13px; }\n"
          + ".pnl-report-table { width: 100%; border-collapse: collapse; }\n"
          + ".pnl-report-table th { text-align: right; border-bottom: 1px solid black; }\n";

  private final String companyName;
  private final List<ReportSection> sections;

  public PnlHtmlRenderer(@Value("${pnl.report.company-name:Yona Solutions}") String companyName) {
    this(companyName, ReportSection.defaults());
  }

  PnlHtmlRenderer(String companyName, List<ReportSection> sections) {
    this.companyName = companyName;
    this.sections = List.copyOf(sections);
  }

  public String render(
      ReportNode root, AccountHierarchy hierarchy, RollupMode mode, LocalDate period) {
    StringBuilder html = new StringBuilder();
    html.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n<title>")
        .append(escape(root.entityName()))
        .append("</title>\n<style>\n")
        .append(STYLE)
        .append("</style>\n</head>\n<body>\n");
    renderTree(html, root, hierarchy, mode, period);
    html.append("</body>\n</html>\n");
    return html.toString();
  }

  private void renderTree(
      StringBuilder html,
      ReportNode node,
      AccountHierarchy hierarchy,
      RollupMode mode,
      LocalDate period) {
    renderPage(html, node, hierarchy, mode, period);
    for (ReportNode child : node.children()) {
      renderTree(html, child, hierarchy, mode, period);
    }
  }

  /** One page: header, divider and the account table. */
  private void renderPage(
      StringBuilder html,
      ReportNode node,
      AccountHierarchy hierarchy,
      RollupMode mode,
      LocalDate period) {
    html.append("<div class=\"pnl-report-container page-break\">\n");
    renderHeader(html, node.header(), period);
    html.append("<hr class=\"pnl-divider\">\n<table class=\"pnl-report-table\">\n<thead><tr>")
        .append("<th></th><th>Actual</th><th>%</th><th>Budget</th><th>%</th><th>Act v Bud</th>")
        .append("<th></th><th>Actual</th><th>%</th><th>Budget</th><th>%</th><th>Act v Bud</th>")
        .append("</tr></thead>\n<tbody>\n");

    Rows rows = new Rows(node.values(), hierarchy, mode, sectionAccounts());
    for (ReportSection section : sections) {
      sectionHeading(html, section.header());
      for (String account : section.accounts()) {
        rows.render(html, account, 1);
      }
    }

    List<String> unmapped = unmappedAccounts(node.values(), hierarchy);
    if (!unmapped.isEmpty()) {
      sectionHeading(html, UNMAPPED_SECTION);
      for (String account : unmapped) {
        rows.render(html, account, 1);
      }
    }

    html.append("</tbody>\n</table>\n</div>\n");
  }

  private void renderHeader(StringBuilder html, ReportHeader header, LocalDate period) {
    String month = PnlFormatter.formatMonthLabel(period);
    html.append("<div class=\"pnl-report-header\">\n");
    div(html, "pnl-title", header.entityName());
    switch (header.level()) {
      case SUBSIDIARY -> {
        div(html, "pnl-subtitle", "Actual vs Budget");
        div(html, "pnl-meta", month);
        div(html, "pnl-meta", "Regions: " + count(header.regionCount()));
        div(html, "pnl-meta", "Districts: " + count(header.districtCount()));
        div(html, "pnl-meta", "Facilities: " + count(header.facilityCount()));
      }
      case REGION -> {
        div(html, "pnl-subtitle", companyName);
        div(html, "pnl-meta", month);
        div(html, "pnl-meta", "Districts: " + count(header.districtCount()));
        div(html, "pnl-meta", "Facilities: " + count(header.facilityCount()));
      }
      case DISTRICT -> {
        div(html, "pnl-subtitle", companyName);
        div(html, "pnl-meta", month);
        div(html, "pnl-meta", "Facilities: " + count(header.facilityCount()));
        div(html, "pnl-meta", "Type: " + header.typeLabel());
        census(html, header.census());
      }
      case FACILITY -> {
        div(html, "pnl-meta", month);
        div(html, "pnl-meta", "Type: Facility");
        div(html, "pnl-meta", header.parentName() == null ? "" : header.parentName());
        census(html, header.census());
        if (header.census() != null && header.census().startDate() != null) {
          div(html, "meta", "Start Date: " + header.census().startDate());
        }
      }
    }
    html.append("</div>\n");
  }

  private static void census(StringBuilder html, CensusFigures census) {
    if (census == null) {
      return;
    }
    if (census.actualCensus() != null) {
      div(html, "meta", "Census Actual: " + census.actualCensus().setScale(0, RoundingMode.HALF_UP));
    }
    if (census.budgetCensus() != null) {
      div(html, "meta", "Census Budget: " + census.budgetCensus().setScale(0, RoundingMode.HALF_UP));
    }
  }

  private static void sectionHeading(StringBuilder html, String title) {
    html.append("<tr><td colspan=\"12\" style=\"font-weight:700; text-decoration:underline; ")
        .append("text-transform:uppercase; padding-top: 12px;\">")
        .append(escape(title))
        .append("</td></tr>\n");
  }

  private static void div(StringBuilder html, String cssClass, String text) {
    html.append("<div class=\"")
        .append(cssClass)
        .append("\">")
        .append(escape(text))
        .append("</div>\n");
  }

  private static String count(Integer count) {
    return count == null ? PnlFormatter.DASH : String.valueOf(count);
  }

  private static String escape(String text) {
    return text == null ? "" : HtmlUtils.htmlEscape(text);
  }

  private Set<String> sectionAccounts() {
    Set<String> accounts = new HashSet<>();
    for (ReportSection section : sections) {
      accounts.addAll(section.accounts());
    }
    return accounts;
  }

  /** Labels with values that have no configured account, sorted. */
  private static List<String> unmappedAccounts(PeriodValues values, AccountHierarchy hierarchy) {
    Set<String> labels = new TreeSet<>();
    for (Map<String, BigDecimal> column :
        List.of(values.monthActual(), values.monthBudget(), values.ytdActual(), values.ytdBudget())) {
      for (String label : column.keySet()) {
        if (!hierarchy.isConfigured(label)) {
          labels.add(label);
        }
      }
    }
    return new ArrayList<>(labels);
  }

  /** Row renderer bound to one page's values. */
  private static final class Rows {

    private final PeriodValues values;
    private final AccountHierarchy hierarchy;
    private final RollupMode mode;
    private final Set<String> sectionAccounts;

    Rows(
        PeriodValues values,
        AccountHierarchy hierarchy,
        RollupMode mode,
        Set<String> sectionAccounts) {
      this.values = values;
      this.hierarchy = hierarchy;
      this.mode = mode;
      this.sectionAccounts = sectionAccounts;
    }

    void render(StringBuilder html, String label, int level) {
      AccountNode node = hierarchy.node(label);
      List<String> children = hierarchy.childrenOf(label);

      if (mode.excludes(node)) {
        for (String child : children) {
          render(html, child, level);
        }
        return;
      }

      for (String child : children) {
        render(html, child, level + 1);
      }

      BigDecimal act = value(values.monthActual(), label);
      BigDecimal bud = value(values.monthBudget(), label);
      BigDecimal ytdAct = value(values.ytdActual(), label);
      BigDecimal ytdBud = value(values.ytdBudget(), label);
      if (PnlFormatter.isNegligible(act.add(ytdAct))) {
        return;
      }

      boolean bold = !children.isEmpty() || sectionAccounts.contains(label);
      String rules = node != null && node.doubleLines() ? RULES : "";

      html.append("<tr style=\"font-weight:")
          .append(bold ? 600 : 400)
          .append("\"><td style=\"padding-left:")
          .append(INDENT_PX * level)
          .append("px\">")
          .append(escape(label))
          .append("</td>");
      cell(html, rules, PnlFormatter.formatNumber(act));
      cell(html, rules, PnlFormatter.formatPercent(PnlFormatter.percent(act, values.incomeMonthActual())));
      cell(html, rules, PnlFormatter.formatNumber(bud));
      cell(html, rules, PnlFormatter.formatPercent(PnlFormatter.percent(bud, values.incomeMonthBudget())));
      cell(html, rules, PnlFormatter.formatNumber(act.subtract(bud)));
      html.append("<td></td>");
      cell(html, rules, PnlFormatter.formatNumber(ytdAct));
      cell(html, rules, PnlFormatter.formatPercent(PnlFormatter.percent(ytdAct, values.incomeYtdActual())));
      cell(html, rules, PnlFormatter.formatNumber(ytdBud));
      cell(html, rules, PnlFormatter.formatPercent(PnlFormatter.percent(ytdBud, values.incomeYtdBudget())));
      cell(html, rules, PnlFormatter.formatNumber(ytdAct.subtract(ytdBud)));
      html.append("</tr>\n");
    }

    private static BigDecimal value(Map<String, BigDecimal> column, String label) {
      return column.getOrDefault(label, BigDecimal.ZERO);
    }

    private static void cell(StringBuilder html, String rules, String text) {
      html.append("<td style=\"text-align:right; ")
          .append(rules)
          .append("\">")
          .append(escape(text))
          .append("</td>");
    }
  }
}
