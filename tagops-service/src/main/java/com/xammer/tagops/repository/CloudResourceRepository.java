package com.xammer.tagops.repository;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.domain.ComplianceStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CloudResourceRepository extends JpaRepository<CloudResource, Long>, JpaSpecificationExecutor<CloudResource> {

    Optional<CloudResource> findByResourceId(String resourceId);

    boolean existsByResourceId(String resourceId);

    List<CloudResource> findAllByOrderByIdAsc();

    List<CloudResource> findAllByComplianceStatus(ComplianceStatus complianceStatus);

    long countByComplianceStatus(ComplianceStatus complianceStatus);

    // --- AGGREGATES (rows are [key, count]) ---

    @Query("SELECT r.cloudProvider, COUNT(r) FROM CloudResource r GROUP BY r.cloudProvider")
    List<Object[]> countGroupedByProvider();

    @Query("SELECT r.resourceType, COUNT(r) FROM CloudResource r GROUP BY r.resourceType")
    List<Object[]> countGroupedByResourceType();

    @Query("SELECT r.complianceStatus, COUNT(r) FROM CloudResource r GROUP BY r.complianceStatus")
    List<Object[]> countGroupedByComplianceStatus();

    // --- DISTINCT VALUES ---

    @Query("SELECT DISTINCT r.resourceType FROM CloudResource r ORDER BY r.resourceType")
    List<String> findDistinctResourceTypes();

    @Query("SELECT DISTINCT r.region FROM CloudResource r WHERE r.region IS NOT NULL ORDER BY r.region")
    List<String> findDistinctRegions();

    @Query("SELECT DISTINCT r.region FROM CloudResource r WHERE r.region IS NOT NULL AND r.cloudProvider = :provider ORDER BY r.region")
    List<String> findDistinctRegionsByProvider(@Param("provider") CloudProvider provider);
}
