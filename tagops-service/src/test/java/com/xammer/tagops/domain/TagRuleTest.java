package com.xammer.tagops.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.tagops.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TagRuleTest {

    @Test
    void requiredDefaultsToTrueWhenOmitted() {
        TagRule rule = new TagRule("Owner", null, null, null);

        assertThat(rule.isRequired()).isTrue();
        assertThat(rule.hasAllowedValues()).isFalse();
        assertThat(rule.permits("anything")).isTrue();
    }

    @Test
    void rejectsBlankNameAndEmptyAllowedValues() {
        assertThatThrownBy(() -> new TagRule(" ", true, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new TagRule("Env", true, List.of(), null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Env");
    }

    @Test
    void permitsOnlyListedValuesCaseSensitively() {
        TagRule rule = TagRule.withAllowedValues("Environment", List.of("prod", "dev"));

        assertThat(rule.permits("prod")).isTrue();
        assertThat(rule.permits("Prod")).isFalse();
        assertThat(rule.permits("")).isFalse();
    }

    @Test
    void suggestedValuePrefersDefaultThenFirstAllowedValue() {
        assertThat(new TagRule("Env", true, List.of("prod", "dev"), "dev").suggestedValue()).isEqualTo("dev");
        assertThat(TagRule.withAllowedValues("Env", List.of("prod", "dev")).suggestedValue()).isEqualTo("prod");
        assertThat(TagRule.required("Owner").suggestedValue()).isEmpty();
    }

    @Test
    void deserializesSnakeCaseJson() throws Exception {
        TagRule rule = new ObjectMapper().readValue(
                "{\"name\":\"Env\",\"required\":false,\"allowed_values\":[\"prod\"],\"default_value\":\"prod\"}",
                TagRule.class);

        assertThat(rule.isRequired()).isFalse();
        assertThat(rule.getAllowedValues()).containsExactly("prod");
        assertThat(rule.getDefaultValue()).isEqualTo("prod");
    }
}
