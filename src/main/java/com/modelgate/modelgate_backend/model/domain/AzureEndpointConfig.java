package com.modelgate.modelgate_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AzureEndpointConfig(
    List<String> modelNames,
    boolean assistants,
    List<String> assistantModels
) {}
