package com.modelgate.modelgate_backend.model.dto;

/**
 * How much a caller wants back. Each mode owns its own cache slot and result type;
 * nothing ever converts one into the other.
 */
public enum Verbosity {

    PLAIN("MODELS_CONFIG", PlainModelsConfig.class),
    DETAILED("MODELS_CONFIG_details", DetailedModelsConfig.class);

    private final String cacheKey;
    private final Class<? extends ModelsResult> resultType;

    Verbosity(String cacheKey, Class<? extends ModelsResult> resultType) {
        this.cacheKey = cacheKey;
        this.resultType = resultType;
    }

    public String getCacheKey() { return cacheKey; }
    public Class<? extends ModelsResult> getResultType() { return resultType; }

    public static Verbosity fromIncludeDetails(boolean includeDetails) {
        return includeDetails ? DETAILED : PLAIN;
    }
}
