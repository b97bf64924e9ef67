package com.modelgate.modelgate_backend.model.fetch;

import com.modelgate.modelgate_backend.model.domain.CallerIdentity;

import java.util.Collections;
import java.util.Map;

/**
 * Everything a fetcher needs to list one provider's models.
 * {@code apiKey} and {@code baseURL} are already resolved.
 */
public record FetchParams(
    String name,
    String apiKey,
    String baseURL,
    CallerIdentity caller,
    Map<String, String> headers,
    boolean direct,
    boolean userIdQuery
) {
    public Map<String, String> headers() {
        return headers != null ? headers : Collections.emptyMap();
    }
}
