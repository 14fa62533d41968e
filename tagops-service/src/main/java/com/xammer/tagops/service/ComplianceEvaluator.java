package com.xammer.tagops.service;

import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.domain.ComplianceIssues;
import com.xammer.tagops.domain.InvalidTagValueIssue;
import com.xammer.tagops.domain.MissingTagIssue;
import com.xammer.tagops.domain.Policy;
import com.xammer.tagops.domain.TagRule;
import com.xammer.tagops.dto.EvaluationResult;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Judges one resource against a set of policies. Holds no state and touches no store; callers persist the result.
 */
@Component
public class ComplianceEvaluator {

    /**
     * Every applicable rule of every applicable policy is checked, and each finding is kept even when another
     * policy already flagged the same tag. Issues come back in canonical order, so the result does not depend
     * on the order of {@code policies}.
     */
    public EvaluationResult evaluate(CloudResource resource, List<Policy> policies) {
        Map<String, String> tags = resource.getTags() == null ? Map.of() : resource.getTags();
        ComplianceIssues issues = new ComplianceIssues();

        for (Policy policy : policies) {
            if (!policy.appliesTo(resource)) {
                continue;
            }
            for (TagRule rule : policy.getRequiredTags()) {
                String value = tags.get(rule.getName());
                if (value == null && !tags.containsKey(rule.getName())) {
                    if (rule.isRequired()) {
                        issues.addMissing(new MissingTagIssue(rule.getName(), policy.getId(), policy.getName()));
                    }
                } else if (!rule.permits(value)) {
                    issues.addInvalid(new InvalidTagValueIssue(rule.getName(), value, rule.getAllowedValues(),
                            policy.getId(), policy.getName()));
                }
            }
        }
        return new EvaluationResult(issues.canonical());
    }

    /**
     * One suggested value per flagged tag name: the rule's default, else its first allowed value, else "".
     * When several policies flag a tag, the finding that sorts first (lowest policy id) decides.
     */
    public Map<String, String> suggestTags(ComplianceIssues issues, List<Policy> policies) {
        Map<Long, Policy> byId = new HashMap<>();
        for (Policy policy : policies) {
            byId.put(policy.getId(), policy);
        }
        ComplianceIssues ordered = issues.canonical();
        Map<String, String> suggested = new LinkedHashMap<>();
        for (MissingTagIssue issue : ordered.getMissingTags()) {
            suggested.putIfAbsent(issue.getTagName(), suggestionFor(issue.getTagName(), byId.get(issue.getPolicyId())));
        }
        for (InvalidTagValueIssue issue : ordered.getInvalidTagValues()) {
            suggested.putIfAbsent(issue.getTagName(), suggestionFor(issue.getTagName(), byId.get(issue.getPolicyId())));
        }
        return suggested;
    }

    private String suggestionFor(String tagName, Policy policy) {
        if (policy == null) {
            return "";
        }
        return policy.getRequiredTags().stream()
                .filter(rule -> rule.getName().equals(tagName))
                .findFirst()
                .map(TagRule::suggestedValue)
                .orElse("");
    }
}
