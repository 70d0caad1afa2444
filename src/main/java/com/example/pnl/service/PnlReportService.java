package com.example.pnl.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.pnl.domain.CustomerPlacement;
import com.example.pnl.domain.District;
import com.example.pnl.domain.Facility;
import com.example.pnl.domain.FactFilter;
import com.example.pnl.domain.HierarchyLevel;
import com.example.pnl.domain.HierarchyUnit;
import com.example.pnl.domain.PlType;
import com.example.pnl.domain.ReportNode;
import com.example.pnl.domain.RollupMode;
import com.example.pnl.domain.SelectableItem;
import com.example.pnl.domain.TagGroup;

/**
 * Entry point for report generation.
 *
 * <p>Resolves the selected district, region or subsidiary into a {@link ReportScope} from the
 * configuration documents, fetches the four fact sets the report needs, assembles the page tree
 * and renders it. The number of warehouse fact fetches never depends on the size of the tree.
 */
@Service
@Transactional(readOnly = true)
public class PnlReportService {

  private static final Logger log = LoggerFactory.getLogger(PnlReportService.class);

  private final DimensionConfigService configService;
  private final EntityGroupingEngine groupingEngine;
  private final FactWarehouse factWarehouse;
  private final ReportAssembler reportAssembler;
  private final PnlHtmlRenderer htmlRenderer;
  private final PlType defaultPlType;
  private final Clock clock;

  @Autowired
  public PnlReportService(
      DimensionConfigService configService,
      EntityGroupingEngine groupingEngine,
      FactWarehouse factWarehouse,
      ReportAssembler reportAssembler,
      PnlHtmlRenderer htmlRenderer,
      @Value("${pnl.report.default-type:STANDARD}") PlType defaultPlType) {
    this(
        configService,
        groupingEngine,
        factWarehouse,
        reportAssembler,
        htmlRenderer,
        defaultPlType,
        Clock.systemDefaultZone());
  }

  PnlReportService(
      DimensionConfigService configService,
      EntityGroupingEngine groupingEngine,
      FactWarehouse factWarehouse,
      ReportAssembler reportAssembler,
      PnlHtmlRenderer htmlRenderer,
      PlType defaultPlType,
      Clock clock) {
    this.configService = configService;
    this.groupingEngine = groupingEngine;
    this.factWarehouse = factWarehouse;
    this.reportAssembler = reportAssembler;
    this.htmlRenderer = htmlRenderer;
    this.defaultPlType = defaultPlType == null ? PlType.STANDARD : defaultPlType;
    this.clock = clock;
  }

  /** Selected scope plus the filter of its own summary fetch, or the reason there is none. */
  private record Resolution(ReportScope scope, FactFilter summaryFilter, PnlReportResult failure) {

    static Resolution of(ReportScope scope, FactFilter summaryFilter) {
      return new Resolution(scope, summaryFilter, null);
    }

    static Resolution failed(PnlReportResult failure) {
      return new Resolution(null, null, failure);
    }
  }

  public PnlReportResult generateReport(PnlReportRequest request) {
    ReportSelector selector = ReportSelector.parse(request.selector());
    PlType plType = request.plType() != null ? request.plType() : defaultPlType;
    RollupMode mode = plType.getRollupMode();
    log.info(
        "Generating {} {} report for '{}' ({})",
        plType,
        request.level(),
        request.selector(),
        request.period());

    AccountHierarchy hierarchy = configService.loadAccountHierarchy();
    CustomerDirectory directory = configService.loadCustomerDirectory();

    Resolution resolution =
        switch (request.level()) {
          case DISTRICT -> resolveDistrict(selector, directory);
          case REGION -> resolveRegion(selector, request, directory);
          case SUBSIDIARY -> resolveSubsidiary(selector, request, directory);
          default -> throw new IllegalArgumentException("Unsupported level " + request.level());
        };
    if (resolution.failure() != null) {
      log.info("No report for '{}': {}", request.selector(), resolution.failure().message());
      return resolution.failure();
    }

    ReportScope scope = resolution.scope();
    List<Long> customerIds = scope.customerIds();
    if (customerIds.isEmpty()) {
      return PnlReportResult.notFound(
          request.level(), "No customers found for " + scope.name());
    }

    FactFilter membersFilter = FactFilter.forCustomers(customerIds);
    ReportFacts facts =
        ReportFacts.of(
            factWarehouse.fetchFacts(resolution.summaryFilter(), request.period(), false),
            factWarehouse.fetchFacts(resolution.summaryFilter(), request.period(), true),
            factWarehouse.fetchFacts(membersFilter, request.period(), false),
            factWarehouse.fetchFacts(membersFilter, request.period(), true));
    log.info(
        "Fetched {} summary and {} member facts for {} customers",
        facts.summaryMonth().size() + facts.summaryYtd().size(),
        facts.membersMonth().size() + facts.membersYtd().size(),
        customerIds.size());

    AssembledReport assembled =
        reportAssembler.assembleReport(scope, facts, hierarchy, mode, request.period());
    ReportNode root = assembled.node();
    String html = htmlRenderer.render(root, hierarchy, mode, request.period());
    boolean noRevenue = PnlFormatter.isNegligible(root.values().incomeMonthActual());
    return PnlReportResult.ok(request.level(), scope.name(), request.period(), root, html, noRevenue);
  }

  /** Reporting months that are complete, newest first. */
  public List<LocalDate> availableDates() {
    return factWarehouse.availablePeriods(LocalDate.now(clock).withDayOfMonth(1));
  }

  public List<SelectableItem> listDistricts() {
    return configService.listDistricts();
  }

  public List<SelectableItem> listRegions() {
    return configService.listRegions();
  }

  public List<SelectableItem> listSubsidiaries() {
    return configService.listSubsidiaries();
  }

  private Resolution resolveDistrict(ReportSelector selector, CustomerDirectory directory) {
    if (selector.isTag()) {
      List<Facility> members = groupingEngine.membersOfTag(selector.tag(), directory);
      ReportScope scope =
          ReportScope.district(selector.tag(), true, facilityScopes(members, directory));
      return Resolution.of(scope, FactFilter.forCustomers(scope.customerIds()));
    }

    District district = directory.district(selector.id());
    if (district == null) {
      return Resolution.failed(
          PnlReportResult.notFound(HierarchyLevel.DISTRICT, "District not found: " + selector.id()));
    }
    if (district.reportingExcluded()) {
      return Resolution.failed(PnlReportResult.excluded(HierarchyLevel.DISTRICT, district.label()));
    }
    List<Facility> members = groupingEngine.membersOfDistrict(district.id(), directory);
    ReportScope scope =
        ReportScope.district(district.label(), false, facilityScopes(members, directory));
    return Resolution.of(scope, FactFilter.forCustomers(scope.customerIds()));
  }

  private Resolution resolveRegion(
      ReportSelector selector, PnlReportRequest request, CustomerDirectory directory) {
    HierarchyUnit region = selector.isTag() ? null : findUnit(configService.loadRegions(), selector.id());
    if (region == null || region.internalId() == null) {
      return Resolution.failed(
          PnlReportResult.notFound(HierarchyLevel.REGION, "Region not found: " + request.selector()));
    }

    Long subsidiaryId = null;
    if (request.hasCrossFilter()) {
      HierarchyUnit subsidiary =
          findUnit(configService.loadSubsidiaries(), request.crossFilter().trim());
      if (subsidiary == null || subsidiary.internalId() == null) {
        return Resolution.failed(
            PnlReportResult.notFound(
                HierarchyLevel.REGION, "Subsidiary not found: " + request.crossFilter()));
      }
      subsidiaryId = subsidiary.internalId();
    }

    List<CustomerPlacement> placements =
        factWarehouse.fetchEntitiesInRegion(region.internalId(), subsidiaryId);
    List<ReportScope> districts = districtScopes(configuredFacilities(placements, directory), directory);
    log.info(
        "Region '{}' has {} customers in {} district groups",
        region.label(),
        placements.size(),
        districts.size());
    return Resolution.of(
        ReportScope.region(region.label(), districts),
        FactFilter.forRegion(region.internalId(), subsidiaryId));
  }

  private Resolution resolveSubsidiary(
      ReportSelector selector, PnlReportRequest request, CustomerDirectory directory) {
    HierarchyUnit subsidiary =
        selector.isTag() ? null : findUnit(configService.loadSubsidiaries(), selector.id());
    if (subsidiary == null || subsidiary.internalId() == null) {
      return Resolution.failed(
          PnlReportResult.notFound(
              HierarchyLevel.SUBSIDIARY, "Subsidiary not found: " + request.selector()));
    }

    List<HierarchyUnit> regions = configService.loadRegions();
    Long regionId = null;
    if (request.hasCrossFilter()) {
      HierarchyUnit region = findUnit(regions, request.crossFilter().trim());
      if (region == null || region.internalId() == null) {
        return Resolution.failed(
            PnlReportResult.notFound(
                HierarchyLevel.SUBSIDIARY, "Region not found: " + request.crossFilter()));
      }
      regionId = region.internalId();
    }

    List<CustomerPlacement> placements =
        factWarehouse.fetchEntitiesInSubsidiary(subsidiary.internalId(), regionId);

    Map<Long, HierarchyUnit> regionsByInternalId = new LinkedHashMap<>();
    for (HierarchyUnit region : regions) {
      if (region.internalId() != null) {
        regionsByInternalId.putIfAbsent(region.internalId(), region);
      }
    }
    Map<Long, List<CustomerPlacement>> placementsByRegion = new LinkedHashMap<>();
    for (CustomerPlacement placement : placements) {
      if (placement.regionId() == null) {
        log.warn("Customer {} has no region, skipping", placement.customerId());
      } else if (!regionsByInternalId.containsKey(placement.regionId())) {
        log.warn(
            "Region {} of customer {} is not configured, skipping",
            placement.regionId(),
            placement.customerId());
      } else {
        placementsByRegion
            .computeIfAbsent(placement.regionId(), key -> new ArrayList<>())
            .add(placement);
      }
    }

    List<ReportScope> regionScopes = new ArrayList<>();
    regionsByInternalId.forEach(
        (internalId, region) -> {
          List<CustomerPlacement> members = placementsByRegion.get(internalId);
          if (members == null) {
            return;
          }
          List<ReportScope> districts =
              districtScopes(configuredFacilities(members, directory), directory);
          if (!districts.isEmpty()) {
            regionScopes.add(ReportScope.region(region.label(), districts));
          }
        });
    log.info(
        "Subsidiary '{}' has {} customers in {} regions",
        subsidiary.label(),
        placements.size(),
        regionScopes.size());
    return Resolution.of(
        ReportScope.subsidiary(subsidiary.label(), regionScopes),
        FactFilter.forSubsidiary(subsidiary.internalId(), regionId));
  }

  /** Joins warehouse customers to the configuration, dropping those that cannot be placed. */
  private static List<Facility> configuredFacilities(
      List<CustomerPlacement> placements, CustomerDirectory directory) {
    List<Facility> facilities = new ArrayList<>();
    for (CustomerPlacement placement : placements) {
      Facility facility = directory.facility(placement.customerId());
      if (facility == null) {
        log.warn(
            "Customer {} ({}) is not in the customer configuration",
            placement.customerId(),
            placement.label());
      } else if (directory.parentDistrictOf(facility) == null) {
        log.warn(
            "Customer {} parent {} is not a district",
            placement.customerId(),
            facility.parentDistrictId());
      } else {
        facilities.add(facility);
      }
    }
    return facilities;
  }

  private List<ReportScope> districtScopes(List<Facility> facilities, CustomerDirectory directory) {
    List<ReportScope> districts = new ArrayList<>();
    for (TagGroup group : groupingEngine.groupCustomersByDistrictTags(facilities, directory)) {
      districts.add(ReportScope.district(group.label(), false, facilityScopes(group.members(), directory)));
    }
    return districts;
  }

  private static List<ReportScope> facilityScopes(
      List<Facility> facilities, CustomerDirectory directory) {
    List<ReportScope> scopes = new ArrayList<>();
    for (Facility facility : facilities) {
      District parent = directory.parentDistrictOf(facility);
      scopes.add(ReportScope.facility(facility, parent == null ? null : parent.label()));
    }
    return scopes;
  }

  private static HierarchyUnit findUnit(List<HierarchyUnit> units, String configId) {
    for (HierarchyUnit unit : units) {
      if (unit.configId().equals(configId)) {
        return unit;
      }
    }
    return null;
  }
}
