package com.xammer.tagops.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResourceStatsDto {
    private long totalResources;
    private Map<String, Long> byProvider;
    private Map<String, Long> byResourceType;
    private Map<String, Long> byComplianceStatus;
    private Map<String, Long> commonMissingTags; // most frequent first
}
