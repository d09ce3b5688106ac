package com.bracketeer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One phase of a tournament. {@code type} selects the bracket format; {@code config} and
 * {@code metadata} carry format-specific knobs, with {@code config} taking precedence.
 */
public record StageDescriptor(
        Long id,
        String name,
        String type,
        Integer order,
        Map<String, Object> config,
        Map<String, Object> metadata
) {

    public StageDescriptor {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public StageDescriptor(Long id, String name, String type, Integer order, Map<String, Object> config) {
        this(id, name, type, order, config, Map.of());
    }

    public Object setting(String key) {
        Object value = config.get(key);
        return value != null ? value : metadata.get(key);
    }
}
