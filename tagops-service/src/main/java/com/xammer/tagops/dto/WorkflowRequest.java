package com.xammer.tagops.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.xammer.tagops.domain.ComplianceIssues;
import com.xammer.tagops.domain.WorkflowType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of a manual workflow creation: a remediation proposal or an exemption request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowRequest {
    private String resourceId;
    private WorkflowType workflowType;
    private ComplianceIssues issues;
    private Map<String, String> suggestedTags;
    private String reason;
    private String createdBy;
}
