package com.modelgate.modelgate_backend.model.dto;

import java.util.List;
import java.util.Map;

/**
 * A resolved models config: endpoint name to its ordered model identifiers.
 * Implemented by exactly {@link PlainModelsConfig} and {@link DetailedModelsConfig}.
 */
public interface ModelsResult {

    Map<String, List<String>> models();

    Verbosity verbosity();
}
