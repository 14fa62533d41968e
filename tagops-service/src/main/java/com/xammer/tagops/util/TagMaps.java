package com.xammer.tagops.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class TagMaps {

    private TagMaps() {
    }

    /**
     * Returns a new map holding {@code existing} overlaid with {@code incoming}; incoming values win on
     * key collision. Neither argument is modified and the result shares no structure with them.
     */
    public static Map<String, String> merge(Map<String, String> existing, Map<String, String> incoming) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (existing != null) {
            merged.putAll(existing);
        }
        if (incoming != null) {
            merged.putAll(incoming);
        }
        return merged;
    }

    public static Map<String, String> copyOf(Map<String, String> tags) {
        return tags == null ? new LinkedHashMap<>() : new LinkedHashMap<>(tags);
    }

    public static Map<String, String> nullToEmpty(Map<String, String> tags) {
        return tags == null ? Collections.emptyMap() : tags;
    }
}
