package com.xammer.tagops.service;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.domain.ComplianceStatus;
import com.xammer.tagops.domain.InvalidTagValueIssue;
import com.xammer.tagops.domain.MissingTagIssue;
import com.xammer.tagops.domain.Policy;
import com.xammer.tagops.domain.TagRule;
import com.xammer.tagops.dto.EvaluationResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ComplianceEvaluatorTest {

    private final ComplianceEvaluator evaluator = new ComplianceEvaluator();

    @Test
    void resourceWithAllRequiredTagsIsCompliant() {
        CloudResource resource = resource("ec2", CloudProvider.AWS, Map.of("Owner", "alice", "Environment", "prod"));
        Policy policy = policy(1L, "base", List.of(TagRule.required("Owner"),
                TagRule.withAllowedValues("Environment", List.of("prod", "dev"))));

        EvaluationResult result = evaluator.evaluate(resource, List.of(policy));

        assertThat(result.isCompliant()).isTrue();
        assertThat(result.toStatus()).isEqualTo(ComplianceStatus.COMPLIANT);
        assertThat(result.getIssues().isEmpty()).isTrue();
    }

    @Test
    void reportsMissingAndInvalidTags() {
        CloudResource resource = resource("ec2", CloudProvider.AWS, Map.of("Environment", "qa"));
        Policy policy = policy(1L, "base", List.of(TagRule.required("Owner"),
                TagRule.withAllowedValues("Environment", List.of("prod", "dev"))));

        EvaluationResult result = evaluator.evaluate(resource, List.of(policy));

        assertThat(result.toStatus()).isEqualTo(ComplianceStatus.NON_COMPLIANT);
        assertThat(result.getIssues().getMissingTags()).containsExactly(new MissingTagIssue("Owner", 1L, "base"));
        assertThat(result.getIssues().getInvalidTagValues()).containsExactly(
                new InvalidTagValueIssue("Environment", "qa", List.of("prod", "dev"), 1L, "base"));
    }

    @Test
    void optionalTagIsOnlyCheckedWhenPresent() {
        Policy policy = policy(1L, "optional", List.of(
                new TagRule("Tier", false, List.of("gold", "silver"), null)));

        assertThat(evaluator.evaluate(resource("s3", CloudProvider.AWS, Map.of()), List.of(policy)).isCompliant()).isTrue();
        assertThat(evaluator.evaluate(resource("s3", CloudProvider.AWS, Map.of("Tier", "bronze")), List.of(policy))
                .getIssues().getInvalidTagValues()).hasSize(1);
    }

    @Test
    void emptyStringValueCountsAsPresent() {
        Policy policy = policy(1L, "base", List.of(TagRule.required("Owner")));

        EvaluationResult result = evaluator.evaluate(resource("ec2", CloudProvider.AWS, Map.of("Owner", "")), List.of(policy));

        assertThat(result.isCompliant()).isTrue();
    }

    @Test
    void policiesOutsideTheirScopeAreIgnored() {
        Policy ec2Only = policy(1L, "ec2", List.of(TagRule.required("Owner")));
        ec2Only.setResourceTypes(List.of("ec2"));
        Policy azureOnly = policy(2L, "azure", List.of(TagRule.required("CostCenter")));
        azureOnly.setCloudProviders(List.of(CloudProvider.AZURE));
        Policy emptyScope = policy(3L, "all", List.of(TagRule.required("App")));
        emptyScope.setResourceTypes(List.of());

        EvaluationResult result = evaluator.evaluate(resource("s3", CloudProvider.AWS, Map.of()),
                List.of(ec2Only, azureOnly, emptyScope));

        assertThat(result.getIssues().getMissingTags()).extracting(MissingTagIssue::getTagName).containsExactly("App");
    }

    @Test
    void noPoliciesMeansCompliant() {
        assertThat(evaluator.evaluate(resource("vm", CloudProvider.AZURE, Map.of()), List.of()).isCompliant()).isTrue();
    }

    @Test
    void overlappingPoliciesEachReportTheirFinding() {
        Policy first = policy(1L, "first", List.of(TagRule.required("Owner")));
        Policy second = policy(2L, "second", List.of(TagRule.required("Owner")));

        EvaluationResult result = evaluator.evaluate(resource("ec2", CloudProvider.AWS, Map.of()), List.of(second, first));

        assertThat(result.getIssues().getMissingTags()).extracting(MissingTagIssue::getPolicyId).containsExactly(1L, 2L);
    }

    @Test
    void resultDoesNotDependOnPolicyOrder() {
        Policy a = policy(1L, "a", List.of(TagRule.required("Owner"), TagRule.withAllowedValues("Env", List.of("prod"))));
        Policy b = policy(2L, "b", List.of(TagRule.required("App"), TagRule.required("Owner")));
        Policy c = policy(3L, "c", List.of(TagRule.withAllowedValues("Env", List.of("dev"))));
        CloudResource resource = resource("ec2", CloudProvider.AWS, Map.of("Env", "qa"));

        List<Policy> shuffled = new ArrayList<>(List.of(a, b, c));
        Collections.reverse(shuffled);

        assertThat(evaluator.evaluate(resource, shuffled).getIssues())
                .isEqualTo(evaluator.evaluate(resource, List.of(a, b, c)).getIssues());
    }

    @Test
    void suggestsDefaultThenFirstAllowedThenEmpty() {
        Policy policy = policy(1L, "base", List.of(
                TagRule.required("Owner"),
                TagRule.withAllowedValues("Environment", List.of("prod", "dev")),
                new TagRule("CostCenter", true, null, "CC-000")));
        CloudResource resource = resource("ec2", CloudProvider.AWS, Map.of("Environment", "qa"));

        EvaluationResult result = evaluator.evaluate(resource, List.of(policy));
        Map<String, String> suggested = evaluator.suggestTags(result.getIssues(), List.of(policy));

        assertThat(suggested).containsOnly(
                Map.entry("Owner", ""), Map.entry("Environment", "prod"), Map.entry("CostCenter", "CC-000"));
    }

    @Test
    void lowestPolicyIdDecidesSuggestionForSharedTag() {
        Policy low = policy(1L, "low", List.of(new TagRule("Env", true, null, "dev")));
        Policy high = policy(2L, "high", List.of(new TagRule("Env", true, null, "prod")));
        CloudResource resource = resource("ec2", CloudProvider.AWS, Map.of());

        EvaluationResult result = evaluator.evaluate(resource, List.of(high, low));

        assertThat(evaluator.suggestTags(result.getIssues(), List.of(high, low))).containsOnly(Map.entry("Env", "dev"));
    }

    private static CloudResource resource(String type, CloudProvider provider, Map<String, String> tags) {
        CloudResource resource = new CloudResource("id-" + type, type, type, provider, "region-1");
        resource.setTags(tags);
        return resource;
    }

    private static Policy policy(Long id, String name, List<TagRule> rules) {
        Policy policy = new Policy();
        policy.setId(id);
        policy.setName(name);
        policy.setRequiredTags(rules);
        return policy;
    }
}
