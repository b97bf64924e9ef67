package com.modelgate.modelgate_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.Map;

/**
 * One entry of {@code endpoints.custom}. {@code baseURL} and {@code apiKey} may be literals
 * or {@code ${VAR}} references; they are resolved when the fetch plan is built.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointConfig(
    String name,
    String baseURL,
    String apiKey,
    Map<String, String> headers,
    boolean directEndpoint,
    EndpointModels models
) {
    public Map<String, String> headers() {
        return headers != null ? headers : Collections.emptyMap();
    }

    /** Eligible endpoints name a base URL, a key, and either fetch or a default list. */
    public boolean isEligible() {
        return notBlank(name) && notBlank(baseURL) && notBlank(apiKey)
                && models != null && (models.fetch() || models.hasDefaults());
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isEmpty();
    }
}
