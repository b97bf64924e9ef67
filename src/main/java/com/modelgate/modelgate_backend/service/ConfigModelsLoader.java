package com.modelgate.modelgate_backend.service;

import com.modelgate.modelgate_backend.config.AppConfigLoader;
import com.modelgate.modelgate_backend.engine.EndpointFilter;
import com.modelgate.modelgate_backend.engine.FetchCoordinator;
import com.modelgate.modelgate_backend.engine.KeyDeduplicator;
import com.modelgate.modelgate_backend.engine.ResultMerger;
import com.modelgate.modelgate_backend.model.domain.AppConfig;
import com.modelgate.modelgate_backend.model.domain.AzureEndpointConfig;
import com.modelgate.modelgate_backend.model.domain.CallerIdentity;
import com.modelgate.modelgate_backend.model.domain.EndpointConfig;
import com.modelgate.modelgate_backend.model.domain.EndpointsConfig;
import com.modelgate.modelgate_backend.model.dto.DetailedModelsConfig;
import com.modelgate.modelgate_backend.model.dto.ModelsResult;
import com.modelgate.modelgate_backend.model.dto.PlainModelsConfig;
import com.modelgate.modelgate_backend.model.dto.Verbosity;
import com.modelgate.modelgate_backend.model.fetch.FetchKey;
import com.modelgate.modelgate_backend.model.fetch.FetchPlan;
import com.modelgate.modelgate_backend.model.fetch.FetchedModels;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the configured (Azure and custom) part of the models config.
 * Stateless between calls; everything it builds belongs to the current request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigModelsLoader {

    static final String AZURE_OPENAI = "azureOpenAI";
    static final String AZURE_ASSISTANTS = "azureAssistants";

    private final AppConfigLoader appConfigLoader;
    private final EndpointFilter endpointFilter;
    private final KeyDeduplicator keyDeduplicator;
    private final FetchCoordinator fetchCoordinator;
    private final ResultMerger resultMerger;

    public ModelsResult loadConfigModels(CallerIdentity caller, Verbosity verbosity) {
        Optional<AppConfig> appConfig = appConfigLoader.getAppConfig();
        if (appConfig.isEmpty()) {
            return empty(verbosity, Collections.emptyMap());
        }
        EndpointsConfig endpoints = appConfig.get().endpoints();
        Map<String, List<String>> azureModels = azureModels(endpoints.azureOpenAI());

        if (endpoints.custom() == null || !endpoints.custom().isArray()) {
            if (endpoints.custom() != null && !endpoints.custom().isNull()) {
                log.warn("endpoints.custom is not a list, ignoring custom endpoints");
            }
            return empty(verbosity, azureModels);
        }

        List<EndpointConfig> eligible = endpointFilter.filter(endpoints.custom());
        FetchPlan plan = keyDeduplicator.plan(eligible, caller);
        Map<FetchKey, FetchedModels> fetched = plan.hasFetches()
                ? fetchCoordinator.fetchAll(plan.getGroups(), verbosity)
                : Collections.emptyMap();
        return resultMerger.merge(plan, fetched, verbosity, azureModels);
    }

    private static Map<String, List<String>> azureModels(AzureEndpointConfig azure) {
        Map<String, List<String>> models = new LinkedHashMap<>();
        if (azure == null) return models;
        if (azure.modelNames() != null) {
            models.put(AZURE_OPENAI, azure.modelNames());
        }
        if (azure.assistants() && azure.assistantModels() != null) {
            models.put(AZURE_ASSISTANTS, azure.assistantModels());
        }
        return models;
    }

    private static ModelsResult empty(Verbosity verbosity, Map<String, List<String>> models) {
        return verbosity == Verbosity.DETAILED
                ? new DetailedModelsConfig(models, Collections.emptyMap())
                : new PlainModelsConfig(models);
    }
}
