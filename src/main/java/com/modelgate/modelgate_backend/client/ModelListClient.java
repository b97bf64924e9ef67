package com.modelgate.modelgate_backend.client;

import com.modelgate.modelgate_backend.model.fetch.FetchParams;
import com.modelgate.modelgate_backend.model.fetch.ListedModel;

import java.io.IOException;
import java.util.List;

public interface ModelListClient {

    ListingApi getListingApi();

    /**
     * @throws IOException when the provider cannot be reached or answers with an error
     */
    List<ListedModel> listModels(FetchParams params) throws IOException, InterruptedException;
}
