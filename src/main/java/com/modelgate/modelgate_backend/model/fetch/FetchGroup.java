package com.modelgate.modelgate_backend.model.fetch;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The endpoints that share one {@link FetchKey}. The params are those of the first
 * endpoint seen for the key; later members only add their names.
 */
public class FetchGroup {

    private final FetchKey key;
    private final FetchParams params;
    private final Set<String> endpointNames = new LinkedHashSet<>();

    public FetchGroup(FetchKey key, FetchParams params) {
        this.key = key;
        this.params = params;
    }

    void addEndpoint(String name) {
        endpointNames.add(name);
    }

    public FetchKey getKey()              { return key; }
    public FetchParams getParams()        { return params; }
    public Set<String> getEndpointNames() { return Collections.unmodifiableSet(endpointNames); }

    @Override
    public String toString() {
        return key + " -> " + endpointNames;
    }
}
