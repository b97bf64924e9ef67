package com.modelgate.modelgate_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The {@code endpoints} section of the configuration document.
 * <p>
 * {@code custom} is kept as a raw node: it is only trusted once the endpoint filter
 * has checked that it is a sequence and dropped the entries that do not bind.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointsConfig(
    @JsonProperty("azureOpenAI") AzureEndpointConfig azureOpenAI,
    JsonNode custom
) {
    public static final EndpointsConfig EMPTY = new EndpointsConfig(null, null);
}
