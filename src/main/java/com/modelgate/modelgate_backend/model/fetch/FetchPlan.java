package com.modelgate.modelgate_backend.model.fetch;

import com.modelgate.modelgate_backend.model.domain.EndpointConfig;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request-scoped outcome of deduplication: the model lists already known without a
 * fetch, the fetch groups still to run, and the config behind every normalized name.
 * Group order is first-seen configuration order.
 */
public class FetchPlan {

    private final Map<String, List<String>> staticModels = new LinkedHashMap<>();
    private final Map<FetchKey, FetchGroup> groups = new LinkedHashMap<>();
    private final Map<String, EndpointConfig> endpointsByName = new LinkedHashMap<>();

    public void register(String name, EndpointConfig endpoint) {
        endpointsByName.put(name, endpoint);
    }

    public void putStatic(String name, List<String> models) {
        staticModels.put(name, models);
    }

    public void addToGroup(FetchKey key, FetchParams firstSeenParams, String name) {
        groups.computeIfAbsent(key, k -> new FetchGroup(k, firstSeenParams)).addEndpoint(name);
    }

    public Map<String, List<String>> getStaticModels() {
        return Collections.unmodifiableMap(staticModels);
    }

    public Collection<FetchGroup> getGroups() {
        return Collections.unmodifiableCollection(groups.values());
    }

    /** Every eligible endpoint name, in configuration order. */
    public Collection<String> getEndpointNames() {
        return Collections.unmodifiableSet(endpointsByName.keySet());
    }

    public EndpointConfig getEndpoint(String name) {
        return endpointsByName.get(name);
    }

    public boolean hasFetches() {
        return !groups.isEmpty();
    }
}
