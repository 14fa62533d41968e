package com.xammer.tagops.dto;

import com.xammer.tagops.domain.CloudProvider;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One resource as observed by a connector, before it is merged into the catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveredResource {
    private String resourceId;
    private String name;
    private String resourceType;
    private CloudProvider cloudProvider;
    private String region;
    private Map<String, String> tags;
}
