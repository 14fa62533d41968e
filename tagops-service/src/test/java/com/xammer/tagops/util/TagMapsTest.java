package com.xammer.tagops.util;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TagMapsTest {

    @Test
    void mergeLetsIncomingValuesWinAndKeepsOthers() {
        Map<String, String> existing = new HashMap<>(Map.of("Owner", "alice", "Env", "dev"));
        Map<String, String> incoming = Map.of("Env", "prod", "App", "billing");

        Map<String, String> merged = TagMaps.merge(existing, incoming);

        assertThat(merged).containsOnly(
                Map.entry("Owner", "alice"), Map.entry("Env", "prod"), Map.entry("App", "billing"));
        assertThat(existing).containsEntry("Env", "dev").doesNotContainKey("App");
    }

    @Test
    void mergeToleratesNullSides() {
        assertThat(TagMaps.merge(null, Map.of("A", "1"))).containsOnly(Map.entry("A", "1"));
        assertThat(TagMaps.merge(Map.of("A", "1"), null)).containsOnly(Map.entry("A", "1"));
        assertThat(TagMaps.merge(null, null)).isEmpty();
    }

    @Test
    void copyOfNullIsAnEmptyMutableMap() {
        Map<String, String> copy = TagMaps.copyOf(null);
        copy.put("A", "1");

        assertThat(copy).hasSize(1);
        assertThat(TagMaps.nullToEmpty(null)).isEmpty();
    }
}
