package com.modelgate.modelgate_backend.config;

import com.modelgate.modelgate_backend.repository.ModelsConfigStore;
import com.modelgate.modelgate_backend.repository.RedisModelsConfigStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Logs at startup which store backs the models cache, and whether Redis answers when it is the one.
 */
@Slf4j
@Component
public class CacheStoreStartupLogger implements ApplicationRunner {

    private final ModelsConfigStore store;
    private final ObjectProvider<RedisConnectionFactory> connectionFactoryProvider;

    public CacheStoreStartupLogger(ModelsConfigStore store,
                                   ObjectProvider<RedisConnectionFactory> connectionFactoryProvider) {
        this.store = store;
        this.connectionFactoryProvider = connectionFactoryProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!(store instanceof RedisModelsConfigStore)) {
            log.info("Models cache: in-memory (single instance)");
            return;
        }
        RedisConnectionFactory factory = connectionFactoryProvider.getIfAvailable();
        if (factory == null) {
            log.warn("Models cache: Redis store selected but no RedisConnectionFactory is present");
            return;
        }
        try (RedisConnection connection = factory.getConnection()) {
            log.info("Models cache: Redis ({})", connection.ping());
        } catch (Exception e) {
            log.warn("Models cache: Redis is unreachable, cache reads and writes will fail: {}", e.getMessage());
        }
    }
}
