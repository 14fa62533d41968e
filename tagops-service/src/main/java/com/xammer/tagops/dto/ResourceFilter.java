package com.xammer.tagops.dto;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.ComplianceStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResourceFilter {
    private CloudProvider provider;
    private String resourceType;
    private ComplianceStatus complianceStatus;
    private String region;
    private String hasTag; // tag key that must be present
    private int skip = 0;
    private int limit = 100;
}
