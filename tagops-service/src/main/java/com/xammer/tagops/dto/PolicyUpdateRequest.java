package com.xammer.tagops.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.TagRule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial update. A null field leaves the stored value unchanged, so a scope cannot be cleared
 * to null here; send an empty list instead, which also means "applies to all".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PolicyUpdateRequest {
    private String name;
    private String description;
    private Boolean active;
    private List<TagRule> requiredTags;
    private List<String> resourceTypes;
    private List<CloudProvider> cloudProviders;
}
