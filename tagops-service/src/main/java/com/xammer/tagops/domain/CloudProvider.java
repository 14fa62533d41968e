package com.xammer.tagops.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.xammer.tagops.exception.ValidationException;

import java.util.Locale;

public enum CloudProvider {
    AWS("aws"),
    AZURE("azure"),
    GCP("gcp");

    private final String value;

    CloudProvider(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a provider name case-insensitively ("aws", "AWS", "Azure" ...).
     */
    @JsonCreator
    public static CloudProvider fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Cloud provider must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CloudProvider provider : values()) {
            if (provider.value.equals(normalized)) {
                return provider;
            }
        }
        throw new ValidationException("Unsupported cloud provider: " + raw);
    }
}
