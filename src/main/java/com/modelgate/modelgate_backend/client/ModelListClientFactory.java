package com.modelgate.modelgate_backend.client;

import com.modelgate.modelgate_backend.support.EndpointNames;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ModelListClientFactory {

    private final Map<ListingApi, ModelListClient> clientMap = new EnumMap<>(ListingApi.class);

    public ModelListClientFactory(List<ModelListClient> clients) {
        for (ModelListClient client : clients) {
            clientMap.put(client.getListingApi(), client);
        }
    }

    /** Picks the client for a normalized endpoint name. */
    public ModelListClient clientFor(String endpointName) {
        ListingApi api = EndpointNames.OLLAMA.equals(endpointName) ? ListingApi.OLLAMA : ListingApi.OPENAI_COMPATIBLE;
        ModelListClient client = clientMap.get(api);
        if (client == null) {
            throw new IllegalArgumentException("No ModelListClient registered for " + api);
        }
        return client;
    }
}
