package com.modelgate.modelgate_backend.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgate.modelgate_backend.model.domain.EndpointConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns the raw {@code endpoints.custom} node into the endpoints the pipeline may use.
 * Entries that do not bind, or that miss a name, base URL, API key or model source,
 * never reach deduplication.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EndpointFilter {

    private final ObjectMapper objectMapper;

    public List<EndpointConfig> filter(JsonNode customEndpoints) {
        if (customEndpoints == null || !customEndpoints.isArray()) {
            return Collections.emptyList();
        }
        List<EndpointConfig> eligible = new ArrayList<>();
        for (JsonNode node : customEndpoints) {
            if (!node.isObject()) {
                log.debug("Skipping custom endpoint entry that is not a mapping: {}", node.getNodeType());
                continue;
            }
            EndpointConfig endpoint;
            try {
                endpoint = objectMapper.convertValue(node, EndpointConfig.class);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed custom endpoint {}: {}", node.path("name").asText("<unnamed>"), e.getMessage());
                continue;
            }
            if (endpoint.isEligible()) {
                eligible.add(endpoint);
            } else {
                log.debug("Custom endpoint {} is not eligible for model resolution", endpoint.name());
            }
        }
        return eligible;
    }
}
