package com.modelgate.modelgate_backend.repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for single-instance deployments and tests. Values are kept as-is,
 * so they must be immutable.
 */
public class InMemoryModelsConfigStore implements ModelsConfigStore {

    private final Map<String, Object> entries = new ConcurrentHashMap<>();

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = entries.get(NAMESPACE + key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    @Override
    public void set(String key, Object value) {
        entries.put(NAMESPACE + key, value);
    }
}
