package com.modelgate.modelgate_backend.engine;

import com.modelgate.modelgate_backend.model.domain.CallerIdentity;
import com.modelgate.modelgate_backend.model.domain.EndpointConfig;
import com.modelgate.modelgate_backend.model.domain.EndpointModels;
import com.modelgate.modelgate_backend.model.fetch.FetchKey;
import com.modelgate.modelgate_backend.model.fetch.FetchParams;
import com.modelgate.modelgate_backend.model.fetch.FetchPlan;
import com.modelgate.modelgate_backend.support.EndpointNames;
import com.modelgate.modelgate_backend.support.EnvResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Decides, for each eligible endpoint, whether its models come from a live fetch or from
 * its default list, and groups the fetching endpoints by resolved base URL and API key.
 * Group membership is final once {@link #plan} returns; no fetch has been issued yet.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeyDeduplicator {

    private final EnvResolver envResolver;

    public FetchPlan plan(List<EndpointConfig> endpoints, CallerIdentity caller) {
        FetchPlan plan = new FetchPlan();

        for (EndpointConfig endpoint : endpoints) {
            String name = EndpointNames.normalize(endpoint.name());
            EndpointModels models = endpoint.models();
            plan.register(name, endpoint);

            String apiKey = envResolver.extractEnvVariable(endpoint.apiKey());
            String baseURL = envResolver.extractEnvVariable(endpoint.baseURL());

            if (models.fetch() && !envResolver.isUserProvided(apiKey) && !envResolver.isUserProvided(baseURL)) {
                FetchKey key = new FetchKey(baseURL, apiKey);
                FetchParams params = new FetchParams(
                        name,
                        apiKey,
                        baseURL,
                        caller,
                        endpoint.headers(),
                        endpoint.directEndpoint(),
                        models.userIdQueryEnabled());
                plan.addToGroup(key, params, name);
                continue;
            }

            plan.putStatic(name, models.hasDefaults() ? models.defaultModelNames() : Collections.emptyList());
        }

        if (log.isDebugEnabled()) {
            log.debug("Planned {} fetch group(s) for {} endpoint(s): {}",
                    plan.getGroups().size(), plan.getEndpointNames().size(), plan.getGroups());
        }
        return plan;
    }
}
