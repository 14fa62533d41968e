package com.xammer.tagops.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Snapshot carried by a workflow. Issues are frozen at proposal time (policy id and name copied in),
 * so later policy edits or deletions do not rewrite what the approver was shown.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowDetails {
    private ComplianceIssues issues;
    private Map<String, String> suggestedTags;
    private Map<String, String> appliedTags;
    private String rejectionReason;
    private String exemptionReason;
    private String cancellationReason;
}
