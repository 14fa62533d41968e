package com.xammer.tagops.domain;

import com.xammer.tagops.domain.converter.WorkflowDetailsConverter;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.time.LocalDateTime;

@Entity
@Data
@NoArgsConstructor
@Table(name = "workflows", indexes = {
        @Index(name = "idx_workflows_resource", columnList = "resource_id"),
        @Index(name = "idx_workflows_status", columnList = "status")
})
public class Workflow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", nullable = false, length = 512)
    private String resourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "workflow_type", nullable = false)
    private WorkflowType workflowType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowStatus status = WorkflowStatus.PENDING;

    @Convert(converter = WorkflowDetailsConverter.class)
    @Column(columnDefinition = "TEXT")
    private WorkflowDetails details = new WorkflowDetails();

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public Workflow(String resourceId, WorkflowType workflowType, WorkflowDetails details, String createdBy) {
        this.resourceId = resourceId;
        this.workflowType = workflowType;
        this.details = details;
        this.createdBy = createdBy;
    }

    @PrePersist
    void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
