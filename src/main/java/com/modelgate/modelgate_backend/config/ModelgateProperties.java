package com.modelgate.modelgate_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service settings under the {@code modelgate.} prefix:
 *
 * <pre>
 * modelgate:
 *   config-path: classpath:modelgate.yaml
 *   fetch:
 *     timeout: 10s
 *     pool-size: 8
 *   cache:
 *     store: redis
 *     ttl: 30m
 *   defaults:
 *     openAI: [gpt-4o, gpt-4o-mini]
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "modelgate")
public class ModelgateProperties {

    /** Spring resource location of the endpoint configuration document. */
    private String configPath = "classpath:modelgate.yaml";

    private Fetch fetch = new Fetch();

    private Cache cache = new Cache();

    /** Replaces the known model list of a built-in endpoint, keyed by endpoint name. */
    private Map<String, List<String>> defaults = new LinkedHashMap<>();

    @Data
    public static class Fetch {
        private Duration timeout = Duration.ofSeconds(10);
        private int poolSize = 8;
    }

    @Data
    public static class Cache {
        private StoreType store = StoreType.MEMORY;

        /** Only honoured by the Redis store. Null means entries never expire. */
        private Duration ttl;
    }

    public enum StoreType { MEMORY, REDIS }
}
