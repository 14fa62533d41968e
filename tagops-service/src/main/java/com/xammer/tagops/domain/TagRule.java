package com.xammer.tagops.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.xammer.tagops.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * A single required-tag constraint inside a policy. Instances are validated on construction,
 * so a policy can never hold a rule without a name or with an empty allowed-value list.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TagRule {

    private final String name;
    private final boolean required;
    @JsonProperty("allowed_values")
    private final List<String> allowedValues;
    @JsonProperty("default_value")
    private final String defaultValue;

    @JsonCreator
    public TagRule(@JsonProperty("name") String name,
                   @JsonProperty("required") Boolean required,
                   @JsonProperty("allowed_values") List<String> allowedValues,
                   @JsonProperty("default_value") String defaultValue) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Each required tag must have a non-empty 'name'");
        }
        if (allowedValues != null) {
            if (allowedValues.isEmpty()) {
                throw new ValidationException("allowed_values for tag '" + name + "' must be a non-empty list");
            }
            if (allowedValues.stream().anyMatch(v -> v == null)) {
                throw new ValidationException("allowed_values for tag '" + name + "' must not contain null");
            }
        }
        this.name = name;
        this.required = required == null || required;
        this.allowedValues = allowedValues == null ? null : List.copyOf(allowedValues);
        this.defaultValue = defaultValue;
    }

    public static TagRule required(String name) {
        return new TagRule(name, true, null, null);
    }

    public static TagRule withAllowedValues(String name, List<String> allowedValues) {
        return new TagRule(name, true, allowedValues, null);
    }

    public boolean hasAllowedValues() {
        return allowedValues != null;
    }

    public boolean permits(String value) {
        return allowedValues == null || allowedValues.contains(value);
    }

    /**
     * Value proposed when this rule is violated: the default, else the first allowed value, else "".
     */
    public String suggestedValue() {
        if (defaultValue != null) {
            return defaultValue;
        }
        if (allowedValues != null && !allowedValues.isEmpty()) {
            return allowedValues.get(0);
        }
        return "";
    }
}
