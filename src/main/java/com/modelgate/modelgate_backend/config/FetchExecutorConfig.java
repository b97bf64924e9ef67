package com.modelgate.modelgate_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool the provider listings run on. Sized independently of the servlet pool so a
 * slow provider cannot starve request handling.
 */
@Configuration
public class FetchExecutorConfig {

    @Bean(name = "modelFetchExecutor")
    public ThreadPoolTaskExecutor modelFetchExecutor(ModelgateProperties properties) {
        int poolSize = Math.max(1, properties.getFetch().getPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("model-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
