package com.modelgate.modelgate_backend.model.fetch;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * What one listing call produced. {@code models} may be empty or null when the provider
 * had nothing usable; callers fall back to the endpoint defaults in that case.
 */
public record FetchedModels(List<String> models, Map<String, Map<String, Object>> modelDetails) {

    public static final FetchedModels EMPTY = new FetchedModels(Collections.emptyList(), Collections.emptyMap());

    public static FetchedModels plain(List<String> models) {
        return new FetchedModels(models, Collections.emptyMap());
    }

    public boolean hasModels() {
        return models != null && !models.isEmpty();
    }

    public Map<String, Map<String, Object>> modelDetails() {
        return modelDetails != null ? modelDetails : Collections.emptyMap();
    }
}
