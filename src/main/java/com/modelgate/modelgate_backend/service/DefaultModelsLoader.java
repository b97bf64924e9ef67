package com.modelgate.modelgate_backend.service;

import com.modelgate.modelgate_backend.config.ModelgateProperties;
import com.modelgate.modelgate_backend.model.domain.BuiltInEndpoint;
import com.modelgate.modelgate_backend.model.domain.CallerIdentity;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Baseline models config from static configuration: every built-in endpoint with its
 * known models, or the list configured under {@code modelgate.defaults.<endpoint>}.
 * The same for every caller.
 */
@Service
public class DefaultModelsLoader {

    private final ModelgateProperties properties;

    public DefaultModelsLoader(ModelgateProperties properties) {
        this.properties = properties;
    }

    public Map<String, List<String>> loadDefaultModels(CallerIdentity caller) {
        Map<String, List<String>> overrides = properties.getDefaults();
        Map<String, List<String>> models = new LinkedHashMap<>();
        for (BuiltInEndpoint endpoint : BuiltInEndpoint.values()) {
            String name = endpoint.getEndpointName();
            List<String> configured = overrides.get(name);
            models.put(name, configured != null ? List.copyOf(configured) : endpoint.getKnownModels());
        }
        return models;
    }
}
