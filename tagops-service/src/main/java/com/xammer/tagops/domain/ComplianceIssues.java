package com.xammer.tagops.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Itemized findings for one resource, grouped by kind. Several policies may flag the same tag;
 * every finding is kept so an approver sees each violated policy.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ComplianceIssues {

    private static final Comparator<MissingTagIssue> MISSING_ORDER = Comparator
            .comparing(MissingTagIssue::getTagName, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(MissingTagIssue::getPolicyId, Comparator.nullsFirst(Comparator.<Long>naturalOrder()));

    private static final Comparator<InvalidTagValueIssue> INVALID_ORDER = Comparator
            .comparing(InvalidTagValueIssue::getTagName, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(InvalidTagValueIssue::getPolicyId, Comparator.nullsFirst(Comparator.<Long>naturalOrder()))
            .thenComparing(InvalidTagValueIssue::getCurrentValue, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    private List<MissingTagIssue> missingTags = new ArrayList<>();
    private List<InvalidTagValueIssue> invalidTagValues = new ArrayList<>();

    public static ComplianceIssues none() {
        return new ComplianceIssues();
    }

    public void addMissing(MissingTagIssue issue) {
        missingTags.add(issue);
    }

    public void addInvalid(InvalidTagValueIssue issue) {
        invalidTagValues.add(issue);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return (missingTags == null || missingTags.isEmpty())
                && (invalidTagValues == null || invalidTagValues.isEmpty());
    }

    @JsonIgnore
    public int getIssueCount() {
        return (missingTags == null ? 0 : missingTags.size())
                + (invalidTagValues == null ? 0 : invalidTagValues.size());
    }

    /**
     * Copy with both lists sorted by (tag name, policy id), the form used for order-insensitive comparison.
     */
    public ComplianceIssues canonical() {
        List<MissingTagIssue> missing = missingTags == null ? new ArrayList<>()
                : missingTags.stream().sorted(MISSING_ORDER).collect(Collectors.toCollection(ArrayList::new));
        List<InvalidTagValueIssue> invalid = invalidTagValues == null ? new ArrayList<>()
                : invalidTagValues.stream().sorted(INVALID_ORDER).collect(Collectors.toCollection(ArrayList::new));
        return new ComplianceIssues(missing, invalid);
    }

    public boolean sameIssuesAs(ComplianceIssues other) {
        if (other == null) {
            return isEmpty();
        }
        return canonical().equals(other.canonical());
    }
}
