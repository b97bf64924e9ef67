package com.modelgate.modelgate_backend.client;

import com.modelgate.modelgate_backend.model.fetch.FetchParams;
import com.modelgate.modelgate_backend.model.fetch.FetchedModels;

import java.util.List;

/**
 * Lists the models one provider offers. Implementations recover from provider errors by
 * returning an empty result; anything they throw aborts the whole resolution.
 */
public interface ModelFetcher {

    List<String> fetchModels(FetchParams params);

    FetchedModels fetchModelsWithDetails(FetchParams params);
}
