package com.modelgate.modelgate_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized as the bare map, e.g. {@code {"openAI": ["gpt-4o"], "groq": ["llama3-8b"]}}.
 */
public record PlainModelsConfig(Map<String, List<String>> models) implements ModelsResult {

    public static final PlainModelsConfig EMPTY = new PlainModelsConfig(Collections.emptyMap());

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public PlainModelsConfig {
        models = freeze(models);
    }

    /**
     * Copies the map and every list in it, so a cached result cannot be changed through
     * a reference held by whoever built it or read it.
     */
    static Map<String, List<String>> freeze(Map<String, List<String>> models) {
        if (models == null) return Collections.emptyMap();
        Map<String, List<String>> copy = new LinkedHashMap<>();
        models.forEach((name, ids) -> copy.put(name, ids != null
                ? Collections.unmodifiableList(new ArrayList<>(ids))
                : Collections.emptyList()));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    @JsonValue
    public Map<String, List<String>> models() {
        return models;
    }

    @Override
    public Verbosity verbosity() {
        return Verbosity.PLAIN;
    }
}
