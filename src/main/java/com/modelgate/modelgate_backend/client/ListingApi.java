package com.modelgate.modelgate_backend.client;

/**
 * Shape of a provider's model listing endpoint.
 */
public enum ListingApi {
    /** {@code GET {baseURL}/models}, ids under {@code data[].id}. */
    OPENAI_COMPATIBLE,
    /** {@code GET {host}/api/tags}, ids under {@code models[].name}. */
    OLLAMA
}
