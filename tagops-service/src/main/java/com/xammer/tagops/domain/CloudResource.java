package com.xammer.tagops.domain;

import com.xammer.tagops.domain.converter.ComplianceIssuesConverter;
import com.xammer.tagops.domain.converter.TagMapConverter;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Data
@NoArgsConstructor
@Table(name = "resources", indexes = {
        @Index(name = "idx_resources_provider", columnList = "cloud_provider"),
        @Index(name = "idx_resources_status", columnList = "compliance_status")
})
public class CloudResource {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", nullable = false, unique = true, length = 512)
    private String resourceId;

    private String name;

    @Column(name = "resource_type", nullable = false)
    private String resourceType;

    @Enumerated(EnumType.STRING)
    @Column(name = "cloud_provider", nullable = false)
    private CloudProvider cloudProvider;

    private String region;

    @Convert(converter = TagMapConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private Map<String, String> tags = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "compliance_status", nullable = false)
    private ComplianceStatus complianceStatus = ComplianceStatus.UNKNOWN;

    @Convert(converter = ComplianceIssuesConverter.class)
    @Column(name = "compliance_details", columnDefinition = "TEXT")
    private ComplianceIssues complianceDetails;

    @Column(name = "last_checked")
    private LocalDateTime lastChecked;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    public CloudResource(String resourceId, String name, String resourceType, CloudProvider cloudProvider, String region) {
        this.resourceId = resourceId;
        this.name = name;
        this.resourceType = resourceType;
        this.cloudProvider = cloudProvider;
        this.region = region;
    }

    public void setTags(Map<String, String> tags) {
        this.tags = tags == null ? new LinkedHashMap<>() : new LinkedHashMap<>(tags);
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
