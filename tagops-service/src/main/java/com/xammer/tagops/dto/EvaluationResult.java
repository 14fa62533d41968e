package com.xammer.tagops.dto;

import com.xammer.tagops.domain.ComplianceIssues;
import com.xammer.tagops.domain.ComplianceStatus;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class EvaluationResult {

    private final boolean compliant;
    private final ComplianceIssues issues;

    public EvaluationResult(ComplianceIssues issues) {
        this.issues = issues;
        this.compliant = issues.isEmpty();
    }

    public ComplianceStatus toStatus() {
        return compliant ? ComplianceStatus.COMPLIANT : ComplianceStatus.NON_COMPLIANT;
    }
}
