package com.modelgate.modelgate_backend.engine;

import com.modelgate.modelgate_backend.model.domain.EndpointConfig;
import com.modelgate.modelgate_backend.model.dto.DetailedModelsConfig;
import com.modelgate.modelgate_backend.model.dto.ModelsResult;
import com.modelgate.modelgate_backend.model.dto.PlainModelsConfig;
import com.modelgate.modelgate_backend.model.dto.Verbosity;
import com.modelgate.modelgate_backend.model.fetch.FetchGroup;
import com.modelgate.modelgate_backend.model.fetch.FetchKey;
import com.modelgate.modelgate_backend.model.fetch.FetchPlan;
import com.modelgate.modelgate_backend.model.fetch.FetchedModels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scatters fetch results back to every endpoint of their group and fills in defaults
 * where a fetch came back empty.
 * <p>
 * Model details from all groups are merged into one map in group order (first-seen
 * configuration order). When two providers describe the same model id, the group
 * processed last wins and the overwrite is logged.
 */
@Slf4j
@Component
public class ResultMerger {

    public ModelsResult merge(FetchPlan plan, Map<FetchKey, FetchedModels> fetched, Verbosity verbosity) {
        return merge(plan, fetched, verbosity, Collections.emptyMap());
    }

    /**
     * @param seed entries placed ahead of the endpoint results; an endpoint of the same name replaces them
     */
    public ModelsResult merge(FetchPlan plan, Map<FetchKey, FetchedModels> fetched, Verbosity verbosity,
                              Map<String, List<String>> seed) {
        Map<String, List<String>> fromFetch = new LinkedHashMap<>();
        Map<String, Map<String, Object>> allModelDetails = new LinkedHashMap<>();

        for (FetchGroup group : plan.getGroups()) {
            FetchedModels data = fetched.get(group.getKey());
            for (String name : group.getEndpointNames()) {
                fromFetch.put(name, modelsOrDefaults(data, plan.getEndpoint(name)));
            }
            if (verbosity == Verbosity.DETAILED && data != null) {
                data.modelDetails().forEach((modelId, details) -> {
                    Map<String, Object> previous = allModelDetails.put(modelId, details);
                    if (previous != null && !Objects.equals(previous, details)) {
                        log.warn("Model details for {} listed by more than one provider, keeping those from {}",
                                modelId, group.getParams().name());
                    }
                });
            }
        }

        Map<String, List<String>> modelsConfig = new LinkedHashMap<>(seed);
        for (String name : plan.getEndpointNames()) {
            List<String> models = fromFetch.containsKey(name)
                    ? fromFetch.get(name)
                    : plan.getStaticModels().getOrDefault(name, Collections.emptyList());
            modelsConfig.put(name, models);
        }

        if (verbosity == Verbosity.DETAILED) {
            return new DetailedModelsConfig(modelsConfig, allModelDetails);
        }
        return new PlainModelsConfig(modelsConfig);
    }

    private static List<String> modelsOrDefaults(FetchedModels data, EndpointConfig endpoint) {
        if (data != null && data.hasModels()) {
            return data.models();
        }
        return endpoint.models().defaultModelNames();
    }
}
