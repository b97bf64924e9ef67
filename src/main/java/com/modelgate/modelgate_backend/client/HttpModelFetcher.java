package com.modelgate.modelgate_backend.client;

import com.modelgate.modelgate_backend.model.fetch.FetchParams;
import com.modelgate.modelgate_backend.model.fetch.FetchedModels;
import com.modelgate.modelgate_backend.model.fetch.ListedModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fetches model lists over HTTP. Provider failures are logged and answered with an empty
 * result so the endpoint falls back to its defaults.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpModelFetcher implements ModelFetcher {

    private final ModelListClientFactory clientFactory;

    @Override
    public List<String> fetchModels(FetchParams params) {
        return list(params).stream().map(ListedModel::id).collect(Collectors.toList());
    }

    @Override
    public FetchedModels fetchModelsWithDetails(FetchParams params) {
        List<ListedModel> listed = list(params);
        List<String> ids = listed.stream().map(ListedModel::id).collect(Collectors.toList());
        Map<String, Map<String, Object>> details = new LinkedHashMap<>();
        for (ListedModel model : listed) {
            if (!model.attributes().isEmpty()) {
                details.put(model.id(), model.attributes());
            }
        }
        return new FetchedModels(ids, details);
    }

    private List<ListedModel> list(FetchParams params) {
        ModelListClient client = clientFactory.clientFor(params.name());
        try {
            List<ListedModel> models = client.listModels(params);
            log.debug("[{}] listed {} model(s)", params.name(), models.size());
            return models;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while listing models", params.name());
            return Collections.emptyList();
        } catch (Exception e) {
            log.warn("[{}] Failed to list models from {}: {}", params.name(), params.baseURL(), e.getMessage());
            return Collections.emptyList();
        }
    }
}
