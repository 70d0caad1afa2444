package com.example.pnl.repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.pnl.domain.TransactionFact;
import com.example.pnl.domain.TransactionSummary;

@Repository
public interface TransactionSummaryRepository extends JpaRepository<TransactionSummary, Long> {

  @Query(
      "SELECT new com.example.pnl.domain.TransactionFact(t.accountInternalId, t.customerInternalId, "
          + "t.regionInternalId, t.subsidiaryInternalId, t.scenario, SUM(t.value)) "
          + "FROM TransactionSummary t "
          + "WHERE t.timeDate BETWEEN :startDate AND :endDate "
          + "AND t.customerInternalId IN :customerIds "
          + "GROUP BY t.accountInternalId, t.customerInternalId, t.regionInternalId, "
          + "t.subsidiaryInternalId, t.scenario "
          + "ORDER BY t.accountInternalId, t.scenario")
  List<TransactionFact> sumByCustomers(
      @Param("customerIds") Collection<Long> customerIds,
      @Param("startDate") LocalDate startDate,
      @Param("endDate") LocalDate endDate);

  @Query(
      "SELECT new com.example.pnl.domain.TransactionFact(t.accountInternalId, t.customerInternalId, "
          + "t.regionInternalId, t.subsidiaryInternalId, t.scenario, SUM(t.value)) "
          + "FROM TransactionSummary t "
          + "WHERE t.timeDate BETWEEN :startDate AND :endDate "
          + "AND t.regionInternalId = :regionId "
          + "AND (:subsidiaryId IS NULL OR t.subsidiaryInternalId = :subsidiaryId) "
          + "GROUP BY t.accountInternalId, t.customerInternalId, t.regionInternalId, "
          + "t.subsidiaryInternalId, t.scenario "
          + "ORDER BY t.accountInternalId, t.scenario")
  List<TransactionFact> sumByRegion(
      @Param("regionId") Long regionId,
      @Param("subsidiaryId") Long subsidiaryId,
      @Param("startDate") LocalDate startDate,
      @Param("endDate") LocalDate endDate);

  @Query(
      "SELECT new com.example.pnl.domain.TransactionFact(t.accountInternalId, t.customerInternalId, "
          + "t.regionInternalId, t.subsidiaryInternalId, t.scenario, SUM(t.value)) "
          + "FROM TransactionSummary t "
          + "WHERE t.timeDate BETWEEN :startDate AND :endDate "
          + "AND t.subsidiaryInternalId = :subsidiaryId "
          + "AND (:regionId IS NULL OR t.regionInternalId = :regionId) "
          + "GROUP BY t.accountInternalId, t.customerInternalId, t.regionInternalId, "
          + "t.subsidiaryInternalId, t.scenario "
          + "ORDER BY t.accountInternalId, t.scenario")
  List<TransactionFact> sumBySubsidiary(
      @Param("subsidiaryId") Long subsidiaryId,
      @Param("regionId") Long regionId,
      @Param("startDate") LocalDate startDate,
      @Param("endDate") LocalDate endDate);

  @Query(
      "SELECT DISTINCT t.timeDate FROM TransactionSummary t "
          + "WHERE t.timeDate < :before ORDER BY t.timeDate DESC")
  List<LocalDate> findDistinctTimeDatesBefore(@Param("before") LocalDate before);
}
