package com.modelgate.modelgate_backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgate.modelgate_backend.config.ModelgateProperties;
import com.modelgate.modelgate_backend.model.fetch.FetchParams;
import com.modelgate.modelgate_backend.model.fetch.ListedModel;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Ollama is usually configured with its OpenAI-compatible {@code /v1} base URL, but only
 * the native {@code /api/tags} route lists the pulled models.
 */
@Component
public class OllamaModelListClient extends AbstractModelListClient {

    public OllamaModelListClient(ObjectMapper mapper, ModelgateProperties properties) {
        super(mapper, properties.getFetch().getTimeout());
    }

    @Override
    public ListingApi getListingApi() {
        return ListingApi.OLLAMA;
    }

    @Override
    public List<ListedModel> listModels(FetchParams params) throws IOException, InterruptedException {
        JsonNode body = getJson(tagsUrl(params.baseURL()), params.headers());
        return toListedModels(body.path("models"), "name");
    }

    static String tagsUrl(String baseURL) {
        String host = trimTrailingSlashes(baseURL);
        if (host.endsWith("/v1")) {
            host = host.substring(0, host.length() - 3);
        }
        return host + "/api/tags";
    }
}
