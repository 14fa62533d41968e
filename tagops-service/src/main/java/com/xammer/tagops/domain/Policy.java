package com.xammer.tagops.domain;

import com.xammer.tagops.domain.converter.CloudProviderListConverter;
import com.xammer.tagops.domain.converter.StringListConverter;
import com.xammer.tagops.domain.converter.TagRuleListConverter;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Data
@NoArgsConstructor
@Table(name = "policies")
public class Policy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    private boolean active = true;

    @Convert(converter = TagRuleListConverter.class)
    @Column(name = "required_tags", columnDefinition = "TEXT", nullable = false)
    private List<TagRule> requiredTags = new ArrayList<>();

    // null or empty: applies to every resource type
    @Convert(converter = StringListConverter.class)
    @Column(name = "resource_types", columnDefinition = "TEXT")
    private List<String> resourceTypes;

    // null or empty: applies to every provider
    @Convert(converter = CloudProviderListConverter.class)
    @Column(name = "cloud_providers", columnDefinition = "TEXT")
    private List<CloudProvider> cloudProviders;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean appliesTo(CloudResource resource) {
        boolean typeMatches = resourceTypes == null || resourceTypes.isEmpty()
                || resourceTypes.contains(resource.getResourceType());
        boolean providerMatches = cloudProviders == null || cloudProviders.isEmpty()
                || cloudProviders.contains(resource.getCloudProvider());
        return typeMatches && providerMatches;
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
