package com.xammer.tagops.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EvaluationSummary {
    private int total;
    private int compliant;
    private int nonCompliant;
    private int exempt;
    private double complianceRate; // percent of evaluated (non-exempt) resources
    private int workflowsProposed;
    private int workflowsCancelled;
}
