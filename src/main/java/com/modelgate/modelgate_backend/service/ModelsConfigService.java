package com.modelgate.modelgate_backend.service;

import com.modelgate.modelgate_backend.model.domain.CallerIdentity;
import com.modelgate.modelgate_backend.model.dto.DetailedModelsConfig;
import com.modelgate.modelgate_backend.model.dto.ModelsResult;
import com.modelgate.modelgate_backend.model.dto.PlainModelsConfig;
import com.modelgate.modelgate_backend.model.dto.Verbosity;
import com.modelgate.modelgate_backend.repository.ModelsConfigStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cache-aside front of model resolution. Plain and detailed results live in separate
 * slots and are never derived from one another.
 * <p>
 * The miss path takes no lock: callers that miss together each recompute and write the
 * slot, and the last write wins. Given the same configuration the writes are identical.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelsConfigService {

    private final ModelsConfigStore store;
    private final DefaultModelsLoader defaultModelsLoader;
    private final ConfigModelsLoader configModelsLoader;

    /**
     * Read path for other server components. Same result as {@link #loadModels}.
     */
    public ModelsResult getModelsConfig(CallerIdentity caller, Verbosity verbosity) {
        return cached(verbosity).orElseGet(() -> loadModels(caller, verbosity));
    }

    public ModelsResult loadModels(CallerIdentity caller, Verbosity verbosity) {
        Optional<ModelsResult> cached = cached(verbosity);
        if (cached.isPresent()) {
            log.debug("Models config cache hit ({})", verbosity.getCacheKey());
            return cached.get();
        }

        log.debug("Models config cache miss ({}), resolving", verbosity.getCacheKey());
        Map<String, List<String>> defaults = defaultModelsLoader.loadDefaultModels(caller);
        ModelsResult custom = configModelsLoader.loadConfigModels(caller, verbosity);

        Map<String, List<String>> merged = new LinkedHashMap<>(defaults);
        merged.putAll(custom.models());

        ModelsResult result;
        if (verbosity == Verbosity.DETAILED) {
            result = new DetailedModelsConfig(merged, ((DetailedModelsConfig) custom).modelDetails());
        } else {
            result = new PlainModelsConfig(merged);
        }
        store.set(verbosity.getCacheKey(), result);
        return result;
    }

    private Optional<ModelsResult> cached(Verbosity verbosity) {
        return store.get(verbosity.getCacheKey(), verbosity.getResultType()).map(ModelsResult.class::cast);
    }
}
