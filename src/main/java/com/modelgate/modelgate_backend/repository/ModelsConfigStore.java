package com.modelgate.modelgate_backend.repository;

import java.util.Optional;

/**
 * Key/value store behind the resolved-models cache. No transactions, no locking:
 * concurrent writers to one key simply overwrite each other.
 */
public interface ModelsConfigStore {

    /** Namespace every key is stored under. */
    String NAMESPACE = "CONFIG_STORE:";

    /**
     * @return the stored value, or empty when the key is absent or holds a value of another type
     */
    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value);
}
