package com.modelgate.modelgate_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Root of the endpoint configuration document (modelgate.yaml).
 * Only the sections the model resolution reads are mapped; everything else is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AppConfig(EndpointsConfig endpoints) {

    public EndpointsConfig endpoints() {
        return endpoints != null ? endpoints : EndpointsConfig.EMPTY;
    }
}
