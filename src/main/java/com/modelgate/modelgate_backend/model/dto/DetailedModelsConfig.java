package com.modelgate.modelgate_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized as {@code {"models": {...}, "modelDetails": {"<model id>": {...}}}}.
 * Detail records are opaque here; their shape belongs to the provider that listed them.
 */
public record DetailedModelsConfig(
    Map<String, List<String>> models,
    Map<String, Map<String, Object>> modelDetails
) implements ModelsResult {

    public DetailedModelsConfig {
        models = PlainModelsConfig.freeze(models);
        modelDetails = freezeDetails(modelDetails);
    }

    private static Map<String, Map<String, Object>> freezeDetails(Map<String, Map<String, Object>> details) {
        if (details == null) return Collections.emptyMap();
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        details.forEach((id, attributes) -> copy.put(id, attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Collections.emptyMap()));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    @JsonIgnore
    public Verbosity verbosity() {
        return Verbosity.DETAILED;
    }
}
