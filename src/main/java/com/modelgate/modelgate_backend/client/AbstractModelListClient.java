package com.modelgate.modelgate_backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgate.modelgate_backend.model.fetch.ListedModel;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared HTTP plumbing for the listing clients: one GET, JSON body, non-2xx is an error.
 */
public abstract class AbstractModelListClient implements ModelListClient {

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;
    protected final Duration timeout;

    protected AbstractModelListClient(ObjectMapper mapper, Duration timeout) {
        this.mapper = mapper;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    protected JsonNode getJson(String url, Map<String, String> headers) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        headers.forEach(builder::header);

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("HTTP " + response.statusCode() + " from " + url + ": " + abbreviate(response.body()));
        }
        return mapper.readTree(response.body());
    }

    /** Reads {@code array[].idField}, keeping every other attribute of the entry. */
    protected List<ListedModel> toListedModels(JsonNode array, String idField) {
        List<ListedModel> models = new ArrayList<>();
        if (array == null || !array.isArray()) return models;
        for (JsonNode entry : array) {
            String id = entry.path(idField).asText(null);
            if (id == null || id.isBlank()) continue;
            Map<String, Object> attributes = new LinkedHashMap<>();
            entry.fields().forEachRemaining(field -> {
                if (!idField.equals(field.getKey())) {
                    attributes.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
                }
            });
            models.add(new ListedModel(id, attributes));
        }
        return models;
    }

    protected static String trimTrailingSlashes(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String abbreviate(String body) {
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }
}
