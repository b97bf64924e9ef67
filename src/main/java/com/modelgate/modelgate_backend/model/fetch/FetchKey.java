package com.modelgate.modelgate_backend.model.fetch;

/**
 * Identity of one provider listing call: the resolved base URL and API key.
 * Endpoints that resolve to the same pair share a single fetch, whatever their names.
 * Holding the parts separately means no choice of separator can make two pairs collide.
 */
public record FetchKey(String baseURL, String apiKey) {

    @Override
    public String toString() {
        return baseURL + "__" + mask(apiKey);
    }

    private static String mask(String key) {
        if (key == null || key.length() < 10) return "****";
        return key.substring(0, 4) + "****" + key.substring(key.length() - 4);
    }
}
