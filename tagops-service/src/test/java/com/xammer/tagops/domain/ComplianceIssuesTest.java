package com.xammer.tagops.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ComplianceIssuesTest {

    @Test
    void canonicalSortsByTagNameThenPolicyId() {
        ComplianceIssues issues = new ComplianceIssues();
        issues.addMissing(new MissingTagIssue("Owner", 2L, "second"));
        issues.addMissing(new MissingTagIssue("CostCenter", 1L, "first"));
        issues.addMissing(new MissingTagIssue("Owner", 1L, "first"));

        List<MissingTagIssue> ordered = issues.canonical().getMissingTags();

        assertThat(ordered).extracting(MissingTagIssue::getTagName).containsExactly("CostCenter", "Owner", "Owner");
        assertThat(ordered).extracting(MissingTagIssue::getPolicyId).containsExactly(1L, 1L, 2L);
    }

    @Test
    void sameIssuesIgnoresInsertionOrder() {
        ComplianceIssues first = new ComplianceIssues();
        first.addMissing(new MissingTagIssue("Owner", 1L, "base"));
        first.addInvalid(new InvalidTagValueIssue("Env", "qa", List.of("prod"), 1L, "base"));
        first.addMissing(new MissingTagIssue("App", 1L, "base"));

        ComplianceIssues second = new ComplianceIssues();
        second.addInvalid(new InvalidTagValueIssue("Env", "qa", List.of("prod"), 1L, "base"));
        second.addMissing(new MissingTagIssue("App", 1L, "base"));
        second.addMissing(new MissingTagIssue("Owner", 1L, "base"));

        assertThat(first.sameIssuesAs(second)).isTrue();
        assertThat(first.getIssueCount()).isEqualTo(3);
    }

    @Test
    void differentCurrentValueIsADifferentIssueSet() {
        ComplianceIssues first = new ComplianceIssues();
        first.addInvalid(new InvalidTagValueIssue("Env", "qa", List.of("prod"), 1L, "base"));
        ComplianceIssues second = new ComplianceIssues();
        second.addInvalid(new InvalidTagValueIssue("Env", "test", List.of("prod"), 1L, "base"));

        assertThat(first.sameIssuesAs(second)).isFalse();
    }

    @Test
    void emptyMatchesNull() {
        assertThat(ComplianceIssues.none().isEmpty()).isTrue();
        assertThat(ComplianceIssues.none().sameIssuesAs(null)).isTrue();
    }
}
