package com.modelgate.modelgate_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgate.modelgate_backend.repository.InMemoryModelsConfigStore;
import com.modelgate.modelgate_backend.repository.ModelsConfigStore;
import com.modelgate.modelgate_backend.repository.RedisModelsConfigStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Creates the one store the models cache lives in for the lifetime of the process.
 * Redis is used when configured and a connection factory exists; otherwise the
 * in-memory store.
 */
@Slf4j
@Configuration
public class ModelsCacheConfig {

    @Bean
    public ModelsConfigStore modelsConfigStore(ModelgateProperties properties,
                                               ObjectProvider<StringRedisTemplate> redisTemplateProvider,
                                               ObjectMapper objectMapper) {
        ModelgateProperties.Cache cache = properties.getCache();
        if (cache.getStore() == ModelgateProperties.StoreType.REDIS) {
            StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
            if (redisTemplate != null) {
                return new RedisModelsConfigStore(redisTemplate, objectMapper, cache.getTtl());
            }
            log.warn("modelgate.cache.store=redis but no Redis connection is configured, falling back to memory");
        }
        return new InMemoryModelsConfigStore();
    }
}
