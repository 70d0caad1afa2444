package com.example.pnl.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.pnl.domain.CustomerDimension;

@Repository
public interface CustomerDimensionRepository extends JpaRepository<CustomerDimension, Long> {

  @Query(
      "SELECT c FROM CustomerDimension c WHERE c.regionInternalId = :regionId "
          + "AND (:subsidiaryId IS NULL OR c.subsidiaryInternalId = :subsidiaryId) "
          + "ORDER BY c.displayName")
  List<CustomerDimension> findInRegion(
      @Param("regionId") Long regionId, @Param("subsidiaryId") Long subsidiaryId);

  @Query(
      "SELECT c FROM CustomerDimension c WHERE c.subsidiaryInternalId = :subsidiaryId "
          + "AND (:regionId IS NULL OR c.regionInternalId = :regionId) "
          + "ORDER BY c.displayName")
  List<CustomerDimension> findInSubsidiary(
      @Param("subsidiaryId") Long subsidiaryId, @Param("regionId") Long regionId);
}
