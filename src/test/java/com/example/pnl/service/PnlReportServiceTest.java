package com.example.pnl.service;

import com.example.pnl.domain.CustomerPlacement;
import com.example.pnl.domain.FactFilter;
import com.example.pnl.domain.HierarchyLevel;
import com.example.pnl.domain.PlType;
import com.example.pnl.domain.ReportNode;
import com.example.pnl.domain.Scenario;
import com.example.pnl.domain.TransactionFact;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PnlReportService request orchestration.
 * Uses the real configuration, grouping, rollup and assembly services with a mocked warehouse.
 */
@ExtendWith(MockitoExtension.class)
class PnlReportServiceTest {

    private static final LocalDate PERIOD = LocalDate.of(2025, 11, 1);

    private static final String ACCOUNT_CONFIG = """
        {
          "1": { "label": "Income", "parent": null, "account_internal_id": 4000 },
          "2": { "label": "Expense", "parent": null, "account_internal_id": 6000 }
        }
        """;

    private static final String CUSTOMER_CONFIG = """
        {
          "1": { "label": "All Customers", "parent": null },
          "10": { "label": "North District", "parent": "1", "isDistrict": true, "tags": ["North"] },
          "11": { "label": "North Annex", "parent": "1", "isDistrict": true, "tags": ["North"],
                  "districtReportingExcluded": true },
          "12": { "label": "Coastal District", "parent": "1", "isDistrict": true },
          "13": { "label": "Empty District", "parent": "1", "isDistrict": true },
          "100": { "label": "Northbrook", "parent": "10", "customer_internal_id": 2001 },
          "101": { "label": "Annex Clinic", "parent": "11", "customer_internal_id": 2002 },
          "102": { "label": "Bayside", "parent": "12", "customer_internal_id": 2003 },
          "103": { "label": "Harbor", "parent": "12", "customer_internal_id": 2004 }
        }
        """;

    private static final String REGION_CONFIG = """
        {
          "1": { "label": "Region", "parent": null },
          "2": { "label": "All Regions", "parent": "1" },
          "20": { "label": "Northern Region", "parent": "2", "region_internal_id": 31, "tags": ["Growth"] },
          "21": { "label": "Western Region", "parent": "2", "region_internal_id": 32 }
        }
        """;

    private static final String DEPARTMENT_CONFIG = """
        {
          "1": { "label": "Department", "parent": null },
          "2": { "label": "All Departments", "parent": "1" },
          "30": { "label": "Yona Health", "parent": "2", "subsidiary_internal_id": 5 }
        }
        """;

    private static final List<TransactionFact> FACTS = List.of(
        fact(4000L, 2001L, 31L, Scenario.ACTUALS, "100"),
        fact(4000L, 2001L, 31L, Scenario.BUDGET, "90"),
        fact(4000L, 2002L, 31L, Scenario.ACTUALS, "50"),
        fact(4000L, 2003L, 32L, Scenario.ACTUALS, "80"),
        fact(6000L, 2004L, 32L, Scenario.ACTUALS, "15"));

    @Mock
    private FactWarehouse factWarehouse;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, JsonNode> documents = new HashMap<>();

    private PnlReportService reportService;

    @BeforeEach
    void setUp() throws IOException {
        documents.put(AccountHierarchy.ACCOUNT_CONFIG_DOCUMENT, mapper.readTree(ACCOUNT_CONFIG));
        documents.put(CustomerDirectory.CUSTOMER_CONFIG_DOCUMENT, mapper.readTree(CUSTOMER_CONFIG));
        documents.put(DimensionConfigService.REGION_CONFIG_DOCUMENT, mapper.readTree(REGION_CONFIG));
        documents.put(DimensionConfigService.DEPARTMENT_CONFIG_DOCUMENT, mapper.readTree(DEPARTMENT_CONFIG));

        RollupEngine rollupEngine = new RollupEngine();
        reportService = new PnlReportService(
            new DimensionConfigService(documents::get),
            new EntityGroupingEngine(),
            factWarehouse,
            new ReportAssembler(rollupEngine, new ConfiguredSideDataProvider(documents::get, "")),
            new PnlHtmlRenderer("Yona Solutions"),
            PlType.STANDARD,
            Clock.fixed(Instant.parse("2025-12-15T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void generateReport_Subsidiary_IssuesExactlyFourFactFetches() {
        // Given
        when(factWarehouse.fetchEntitiesInSubsidiary(5L, null)).thenReturn(List.of(
            placement(2001L, 31L),
            placement(2002L, 31L),
            placement(2003L, 32L),
            placement(2004L, 32L),
            placement(2999L, 31L),
            placement(3000L, 77L)));
        stubFacts();

        // When
        PnlReportResult result = reportService.generateReport(
            PnlReportRequest.of(HierarchyLevel.SUBSIDIARY, "30 - Yona Health", PERIOD));

        // Then
        assertTrue(result.isOk());
        assertEquals("Yona Health", result.selectedLabel());
        assertEquals(Integer.valueOf(2), result.regionCount());
        assertEquals(Integer.valueOf(2), result.districtCount());
        assertEquals(Integer.valueOf(3), result.facilityCount());
        assertFalse(result.noRevenue());

        ReportNode northern = result.report().children().get(0);
        assertEquals("Northern Region", northern.entityName());
        assertEquals("North", northern.children().get(0).entityName());
        assertEquals(Integer.valueOf(2), northern.header().facilityCount());

        ReportNode western = result.report().children().get(1);
        assertEquals("Coastal District", western.children().get(0).entityName());
        assertEquals(Integer.valueOf(1), western.header().facilityCount());

        ArgumentCaptor<FactFilter> filters = ArgumentCaptor.forClass(FactFilter.class);
        verify(factWarehouse, times(4)).fetchFacts(filters.capture(), eq(PERIOD), anyBoolean());
        assertEquals(HierarchyLevel.SUBSIDIARY, filters.getAllValues().get(0).level());
        assertEquals(Long.valueOf(5L), filters.getAllValues().get(0).subsidiaryId());
        assertEquals(List.of(2001L, 2002L, 2003L, 2004L), filters.getAllValues().get(2).customerIds());
        assertTrue(result.html().contains("Regions: 2"));
    }

    @Test
    void generateReport_DistrictTag_MergesReportingExcludedDistrict() {
        // Given
        stubFacts();

        // When
        PnlReportResult result = reportService.generateReport(
            PnlReportRequest.of(HierarchyLevel.DISTRICT, "tag_North", PERIOD));

        // Then
        assertTrue(result.isOk());
        assertEquals("North", result.selectedLabel());
        assertEquals("District Tag", result.report().header().typeLabel());
        assertEquals(Integer.valueOf(2), result.facilityCount());
        assertEquals(0, new BigDecimal("150").compareTo(result.report().values().incomeMonthActual()));
        verify(factWarehouse, times(4)).fetchFacts(any(), eq(PERIOD), anyBoolean());
    }

    @Test
    void generateReport_District_PrunesFacilityWithoutRevenue() {
        stubFacts();

        PnlReportResult result = reportService.generateReport(
            PnlReportRequest.of(HierarchyLevel.DISTRICT, "12 - Coastal District", PERIOD));

        assertTrue(result.isOk());
        assertEquals("Coastal District", result.selectedLabel());
        assertEquals(Integer.valueOf(1), result.facilityCount());
        assertEquals("Bayside", result.report().children().get(0).entityName());
        assertEquals("North District", reportService.generateReport(
            PnlReportRequest.of(HierarchyLevel.DISTRICT, "10", PERIOD)).selectedLabel());
    }

    @Test
    void generateReport_DistrictWithRepeatedCustomer_ReportsCustomerOnce() throws IOException {
        // Given - node 104 repeats customer 2001 under the same district
        replaceCustomerConfig(CUSTOMER_CONFIG.replace(
            "\"103\": {",
            "\"104\": { \"label\": \"Northbrook (copy)\", \"parent\": \"10\", \"customer_internal_id\": 2001 },\n"
                + "          \"103\": {"));
        stubFacts();

        // When
        PnlReportResult result = reportService.generateReport(
            PnlReportRequest.of(HierarchyLevel.DISTRICT, "10", PERIOD));

        // Then
        assertTrue(result.isOk());
        assertEquals(Integer.valueOf(1), result.facilityCount());
        assertEquals(1, result.report().children().size());
        assertEquals("Northbrook", result.report().children().get(0).entityName());
        verify(factWarehouse, times(2)).fetchFacts(FactFilter.forCustomers(List.of(2001L)), PERIOD, false);
    }

    @Test
    void generateReport_RegionWithUnlabelledDistrict_FallsBackToDistrictId() throws IOException {
        // Given - district 14 has neither a label nor tags
        replaceCustomerConfig(CUSTOMER_CONFIG.replace(
            "\"100\": {",
            "\"14\": { \"parent\": \"1\", \"isDistrict\": true },\n"
                + "          \"105\": { \"label\": \"Hilltop\", \"parent\": \"14\", \"customer_internal_id\": 2005 },\n"
                + "          \"100\": {"));
        when(factWarehouse.fetchEntitiesInRegion(31L, null)).thenReturn(List.of(
            placement(2001L, 31L), placement(2005L, 31L)));
        stubFacts();

        // When
        PnlReportResult result = reportService.generateReport(
            PnlReportRequest.of(HierarchyLevel.REGION, "20", PERIOD));

        // Then
        assertTrue(result.isOk());
        assertEquals(Integer.valueOf(2), result.districtCount());
        assertEquals("North", result.report().children().get(0).entityName());
        assertEquals("14", result.report().children().get(1).entityName());
    }

    @Test
    void generateReport_Region_OrdersGroupsByDistrictConfigOrder() {
        // Given - the warehouse lists the Coastal customer first
        when(factWarehouse.fetchEntitiesInRegion(31L, null)).thenReturn(List.of(
            placement(2003L, 31L), placement(2001L, 31L)));
        stubFacts();

        // When
        PnlReportResult result = reportService.generateReport(
            PnlReportRequest.of(HierarchyLevel.REGION, "20", PERIOD));

        // Then
        assertTrue(result.isOk());
        List<String> districts = result.report().children().stream().map(ReportNode::entityName).toList();
        assertEquals(List.of("North", "Coastal District"), districts);
    }

    @Test
    void generateReport_ReportingExcludedDistrict_ReturnsExcludedWithoutFetching() {
        PnlReportResult result = reportService.generateReport(
            PnlReportRequest.of(HierarchyLevel.DISTRICT, "11", PERIOD));

        assertEquals(PnlReportResult.Status.EXCLUDED, result.status());
        assertEquals("North Annex", result.selectedLabel());
        verifyNoInteractions(factWarehouse);
    }

    @Test
    void generateReport_UnknownOrEmptyDistrict_ReturnsNotFound() {
        PnlReportResult unknown = reportService.generateReport(
            PnlReportRequest.of(HierarchyLevel.DISTRICT, "99", PERIOD));
        PnlReportResult empty = reportService.generateReport(
            PnlReportRequest.of(HierarchyLevel.DISTRICT, "13", PERIOD));

        assertEquals(PnlReportResult.Status.NOT_FOUND, unknown.status());
        assertEquals(PnlReportResult.Status.NOT_FOUND, empty.status());
        assertNull(empty.report());
        verifyNoInteractions(factWarehouse);
    }

    @Test
    void generateReport_RegionWithoutCustomers_ReturnsNotFound() {
        when(factWarehouse.fetchEntitiesInRegion(31L, null)).thenReturn(List.of());

        PnlReportResult result = reportService.generateReport(
            PnlReportRequest.of(HierarchyLevel.REGION, "20", PERIOD));

        assertEquals(PnlReportResult.Status.NOT_FOUND, result.status());
        verify(factWarehouse, never()).fetchFacts(any(), any(), anyBoolean());
    }

    @Test
    void generateReport_RegionWithSubsidiaryFilter_FiltersCustomersAndSummary() {
        // Given
        when(factWarehouse.fetchEntitiesInRegion(32L, 5L)).thenReturn(List.of(
            placement(2003L, 32L), placement(2004L, 32L)));
        stubFacts();

        // When
        PnlReportResult result = reportService.generateReport(new PnlReportRequest(
            HierarchyLevel.REGION, "21", PERIOD, "30", PlType.OPERATIONAL));

        // Then
        assertTrue(result.isOk());
        assertEquals(Integer.valueOf(1), result.districtCount());
        assertEquals(Integer.valueOf(1), result.facilityCount());
        verify(factWarehouse).fetchFacts(FactFilter.forRegion(32L, 5L), PERIOD, false);
        verify(factWarehouse).fetchFacts(FactFilter.forRegion(32L, 5L), PERIOD, true);
    }

    @Test
    void generateReport_RegionCrossFilterAll_MeansNoFilter() {
        when(factWarehouse.fetchEntitiesInRegion(31L, null)).thenReturn(List.of(placement(2001L, 31L)));
        stubFacts();

        PnlReportResult result = reportService.generateReport(new PnlReportRequest(
            HierarchyLevel.REGION, "20", PERIOD, "all", null));

        assertTrue(result.isOk());
        verify(factWarehouse).fetchEntitiesInRegion(31L, null);
    }

    @Test
    void generateReport_RegionTagOrUnknownFilter_ReturnsNotFound() {
        PnlReportResult tag = reportService.generateReport(
            PnlReportRequest.of(HierarchyLevel.REGION, "tag_Growth", PERIOD));
        PnlReportResult badFilter = reportService.generateReport(new PnlReportRequest(
            HierarchyLevel.REGION, "20", PERIOD, "404", null));

        assertEquals(PnlReportResult.Status.NOT_FOUND, tag.status());
        assertEquals(PnlReportResult.Status.NOT_FOUND, badFilter.status());
        verifyNoInteractions(factWarehouse);
    }

    @Test
    void generateReportRequest_FacilityLevelOrMissingPeriod_Rejected() {
        assertThrows(IllegalArgumentException.class,
            () -> PnlReportRequest.of(HierarchyLevel.FACILITY, "100", PERIOD));
        assertThrows(IllegalArgumentException.class,
            () -> PnlReportRequest.of(HierarchyLevel.DISTRICT, "10", null));
    }

    @Test
    void availableDates_QueriesBeforeFirstOfCurrentMonth() {
        List<LocalDate> dates = List.of(LocalDate.of(2025, 11, 1), LocalDate.of(2025, 10, 1));
        when(factWarehouse.availablePeriods(LocalDate.of(2025, 12, 1))).thenReturn(dates);

        assertEquals(dates, reportService.availableDates());
    }

    @Test
    void listDistricts_DelegatesToConfiguration() {
        List<String> labels = reportService.listDistricts().stream().map(item -> item.label()).toList();

        assertEquals(List.of("Coastal District", "Empty District", "North", "North District"), labels);
    }

    private void replaceCustomerConfig(String json) throws IOException {
        documents.put(CustomerDirectory.CUSTOMER_CONFIG_DOCUMENT, mapper.readTree(json));
    }

    private void stubFacts() {
        when(factWarehouse.fetchFacts(any(FactFilter.class), any(LocalDate.class), anyBoolean()))
            .thenAnswer(invocation -> {
                FactFilter filter = invocation.getArgument(0);
                return FACTS.stream().filter(fact -> matches(filter, fact)).toList();
            });
    }

    private static boolean matches(FactFilter filter, TransactionFact fact) {
        return switch (filter.level()) {
            case REGION -> fact.regionId().equals(filter.regionId());
            case SUBSIDIARY -> fact.subsidiaryId().equals(filter.subsidiaryId());
            default -> filter.customerIds().contains(fact.customerId());
        };
    }

    private static CustomerPlacement placement(Long customerId, Long regionId) {
        return new CustomerPlacement(customerId, "Customer " + customerId, regionId, 5L);
    }

    private static TransactionFact fact(Long accountId, Long customerId, Long regionId, Scenario scenario, String value) {
        return new TransactionFact(accountId, customerId, regionId, 5L, scenario, new BigDecimal(value));
    }
}
