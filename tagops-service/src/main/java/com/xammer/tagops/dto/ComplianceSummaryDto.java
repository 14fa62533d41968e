package com.xammer.tagops.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ComplianceSummaryDto {
    private long totalResources;
    private long compliant;
    private long nonCompliant;
    private long unknown;
    private long exempt;
    private double complianceRate;
}
