package com.modelgate.modelgate_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The {@code models} block of a custom endpoint:
 * <pre>
 * models:
 *   fetch: true
 *   default: [gpt-4o-mini, { name: gpt-4o }]
 *   userIdQuery: false
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointModels(
    boolean fetch,
    @JsonProperty("default") List<DefaultModelEntry> defaults,
    Boolean userIdQuery
) {
    public boolean hasDefaults() {
        return defaults != null;
    }

    /** Default list flattened to plain identifiers; empty when none is configured. */
    public List<String> defaultModelNames() {
        if (defaults == null) return Collections.emptyList();
        return defaults.stream()
                .filter(Objects::nonNull)
                .map(DefaultModelEntry::name)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    public boolean userIdQueryEnabled() {
        return Boolean.TRUE.equals(userIdQuery);
    }
}
