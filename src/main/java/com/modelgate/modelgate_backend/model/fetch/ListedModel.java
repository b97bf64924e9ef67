package com.modelgate.modelgate_backend.model.fetch;

import java.util.Collections;
import java.util.Map;

/**
 * One model as a provider listed it: its id plus every other attribute the listing carried.
 */
public record ListedModel(String id, Map<String, Object> attributes) {

    public Map<String, Object> attributes() {
        return attributes != null ? attributes : Collections.emptyMap();
    }
}
