package com.xammer.tagops.repository;

import com.xammer.tagops.domain.Workflow;
import com.xammer.tagops.domain.WorkflowStatus;
import com.xammer.tagops.domain.WorkflowType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface WorkflowRepository extends JpaRepository<Workflow, Long>, JpaSpecificationExecutor<Workflow> {

    List<Workflow> findByResourceIdAndStatusOrderByIdAsc(String resourceId, WorkflowStatus status);

    List<Workflow> findByResourceIdAndStatusAndWorkflowTypeOrderByIdAsc(String resourceId, WorkflowStatus status, WorkflowType workflowType);

    boolean existsByResourceIdAndStatus(String resourceId, WorkflowStatus status);

    List<Workflow> findTop5ByOrderByCreatedAtDescIdDesc();

    /**
     * Compare-and-set on the status column. Returns 1 when the row was still in {@code expected},
     * 0 when another writer moved it first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Workflow w SET w.status = :next, w.updatedAt = :now WHERE w.id = :id AND w.status = :expected")
    int transitionStatus(@Param("id") Long id,
                         @Param("expected") WorkflowStatus expected,
                         @Param("next") WorkflowStatus next,
                         @Param("now") LocalDateTime now);

    @Query("SELECT w.status, COUNT(w) FROM Workflow w GROUP BY w.status")
    List<Object[]> countGroupedByStatus();

    @Query("SELECT w.workflowType, COUNT(w) FROM Workflow w GROUP BY w.workflowType")
    List<Object[]> countGroupedByType();
}
