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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PolicyRequest {
    private String name;
    private String description;
    private Boolean active;
    private List<TagRule> requiredTags;
    private List<String> resourceTypes;
    private List<CloudProvider> cloudProviders;
}
