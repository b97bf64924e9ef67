package com.modelgate.modelgate_backend.engine;

import com.modelgate.modelgate_backend.client.ModelFetcher;
import com.modelgate.modelgate_backend.model.dto.Verbosity;
import com.modelgate.modelgate_backend.model.fetch.FetchGroup;
import com.modelgate.modelgate_backend.model.fetch.FetchKey;
import com.modelgate.modelgate_backend.model.fetch.FetchParams;
import com.modelgate.modelgate_backend.model.fetch.FetchedModels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs one fetch per group, all at once, and waits for every one of them before
 * returning. Results are keyed by group so each can be scattered back to its members.
 */
@Slf4j
@Component
public class FetchCoordinator {

    private final ModelFetcher modelFetcher;
    private final Executor executor;

    public FetchCoordinator(ModelFetcher modelFetcher, @Qualifier("modelFetchExecutor") Executor executor) {
        this.modelFetcher = modelFetcher;
        this.executor = executor;
    }

    public Map<FetchKey, FetchedModels> fetchAll(Collection<FetchGroup> groups, Verbosity verbosity) {
        Map<FetchKey, CompletableFuture<FetchedModels>> inFlight = new LinkedHashMap<>();
        for (FetchGroup group : groups) {
            FetchParams params = group.getParams();
            inFlight.put(group.getKey(), CompletableFuture.supplyAsync(() -> fetch(params, verbosity), executor));
        }

        try {
            CompletableFuture.allOf(inFlight.values().toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelFetchException("Interrupted while waiting for " + inFlight.size() + " model fetch(es)");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ModelFetchException) {
                throw (ModelFetchException) cause;
            }
            throw new ModelFetchException("Model fetch failed: " + cause.getMessage(), cause);
        }

        Map<FetchKey, FetchedModels> results = new LinkedHashMap<>();
        inFlight.forEach((key, future) -> results.put(key, future.join()));
        return results;
    }

    private FetchedModels fetch(FetchParams params, Verbosity verbosity) {
        try {
            log.debug("Fetching models for {} ({})", params.name(), verbosity);
            if (verbosity == Verbosity.DETAILED) {
                return modelFetcher.fetchModelsWithDetails(params);
            }
            return FetchedModels.plain(modelFetcher.fetchModels(params));
        } catch (RuntimeException e) {
            throw ModelFetchException.forEndpoint(params.name(), e);
        }
    }
}
