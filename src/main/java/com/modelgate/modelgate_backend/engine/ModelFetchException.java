package com.modelgate.modelgate_backend.engine;

/**
 * A fetch failed instead of returning an (empty) result. Not recovered locally:
 * it aborts the resolution and surfaces to the HTTP handler.
 */
public class ModelFetchException extends RuntimeException {

    public ModelFetchException(String message) {
        super(message);
    }

    public ModelFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ModelFetchException forEndpoint(String endpointName, Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ModelFetchException("Failed to fetch models for endpoint '" + endpointName + "': " + reason, cause);
    }
}
