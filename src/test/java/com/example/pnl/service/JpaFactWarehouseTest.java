package com.example.pnl.service;

import com.example.pnl.domain.CustomerDimension;
import com.example.pnl.domain.CustomerPlacement;
import com.example.pnl.domain.FactFilter;
import com.example.pnl.domain.Scenario;
import com.example.pnl.domain.TransactionFact;
import com.example.pnl.repository.CustomerDimensionRepository;
import com.example.pnl.repository.TransactionSummaryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JpaFactWarehouse period ranges and filter dispatch.
 */
@ExtendWith(MockitoExtension.class)
class JpaFactWarehouseTest {

    @Mock
    private TransactionSummaryRepository transactionSummaryRepository;

    @Mock
    private CustomerDimensionRepository customerDimensionRepository;

    private JpaFactWarehouse warehouse;

    @BeforeEach
    void setUp() {
        warehouse = new JpaFactWarehouse(transactionSummaryRepository, customerDimensionRepository);
    }

    @Test
    void fetchFacts_CustomersForMonth_QueriesCalendarMonth() {
        // Given
        List<TransactionFact> facts = List.of(
            new TransactionFact(4000L, 1L, 31L, 5L, Scenario.ACTUALS, new BigDecimal("10")));
        when(transactionSummaryRepository.sumByCustomers(
            List.of(1L, 2L), LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29))).thenReturn(facts);

        // When
        List<TransactionFact> result = warehouse.fetchFacts(
            FactFilter.forCustomers(List.of(1L, 2L)), LocalDate.of(2024, 2, 14), false);

        // Then
        assertEquals(facts, result);
    }

    @Test
    void fetchFacts_RegionYearToDate_QueriesFromJanuaryFirstToMonthEnd() {
        when(transactionSummaryRepository.sumByRegion(
            31L, null, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 6, 30))).thenReturn(List.of());

        warehouse.fetchFacts(FactFilter.forRegion(31L, null), LocalDate.of(2025, 6, 1), true);

        verify(transactionSummaryRepository).sumByRegion(
            31L, null, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 6, 30));
    }

    @Test
    void fetchFacts_SubsidiaryWithRegionFilter_PassesBothIds() {
        when(transactionSummaryRepository.sumBySubsidiary(
            5L, 31L, LocalDate.of(2025, 12, 1), LocalDate.of(2025, 12, 31))).thenReturn(List.of());

        warehouse.fetchFacts(FactFilter.forSubsidiary(5L, 31L), LocalDate.of(2025, 12, 1), false);

        verify(transactionSummaryRepository).sumBySubsidiary(
            5L, 31L, LocalDate.of(2025, 12, 1), LocalDate.of(2025, 12, 31));
    }

    @Test
    void fetchFacts_NoCustomers_SkipsQuery() {
        List<TransactionFact> result = warehouse.fetchFacts(
            FactFilter.forCustomers(List.of()), LocalDate.of(2025, 12, 1), false);

        assertTrue(result.isEmpty());
        verifyNoInteractions(transactionSummaryRepository);
    }

    @Test
    void fetchFacts_MissingPeriod_ThrowsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class,
            () -> warehouse.fetchFacts(FactFilter.forRegion(31L, null), null, false));
    }

    @Test
    void fetchEntitiesInRegion_MapsCustomerDimensions() {
        when(customerDimensionRepository.findInRegion(31L, null)).thenReturn(List.of(
            new CustomerDimension(2001L, "Northbrook", 31L, 5L)));

        List<CustomerPlacement> placements = warehouse.fetchEntitiesInRegion(31L, null);

        assertEquals(List.of(new CustomerPlacement(2001L, "Northbrook", 31L, 5L)), placements);
    }
}
