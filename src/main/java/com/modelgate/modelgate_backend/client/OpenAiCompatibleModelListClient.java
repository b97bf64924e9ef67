package com.modelgate.modelgate_backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgate.modelgate_backend.config.ModelgateProperties;
import com.modelgate.modelgate_backend.model.fetch.FetchParams;
import com.modelgate.modelgate_backend.model.fetch.ListedModel;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists models from any OpenAI-style {@code /models} endpoint (OpenAI, Groq, Mistral,
 * OpenRouter, vLLM, LiteLLM ...).
 */
@Component
public class OpenAiCompatibleModelListClient extends AbstractModelListClient {

    public OpenAiCompatibleModelListClient(ObjectMapper mapper, ModelgateProperties properties) {
        super(mapper, properties.getFetch().getTimeout());
    }

    @Override
    public ListingApi getListingApi() {
        return ListingApi.OPENAI_COMPATIBLE;
    }

    @Override
    public List<ListedModel> listModels(FetchParams params) throws IOException, InterruptedException {
        JsonNode body = getJson(modelsUrl(params), requestHeaders(params));
        return toListedModels(body.path("data"), "id");
    }

    String modelsUrl(FetchParams params) {
        String url = params.direct() ? params.baseURL() : trimTrailingSlashes(params.baseURL()) + "/models";
        if (params.userIdQuery() && params.caller() != null) {
            url += (url.contains("?") ? "&" : "?") + "user=" + URLEncoder.encode(params.caller().id(), StandardCharsets.UTF_8);
        }
        return url;
    }

    private static Map<String, String> requestHeaders(FetchParams params) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + params.apiKey());
        headers.putAll(params.headers());
        return headers;
    }
}
