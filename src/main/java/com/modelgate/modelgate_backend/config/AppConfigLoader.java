package com.modelgate.modelgate_backend.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.modelgate.modelgate_backend.model.domain.AppConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Loads the endpoint configuration document once and hands the same parsed instance to
 * every request. A missing or unreadable document means "no configuration", never an error.
 */
@Slf4j
@Component
public class AppConfigLoader {

    private final ResourceLoader resourceLoader;
    private final ModelgateProperties properties;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private volatile Optional<AppConfig> cached;

    public AppConfigLoader(ResourceLoader resourceLoader, ModelgateProperties properties) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    public Optional<AppConfig> getAppConfig() {
        Optional<AppConfig> result = cached;
        if (result == null) {
            synchronized (this) {
                result = cached;
                if (result == null) {
                    result = load();
                    cached = result;
                }
            }
        }
        return result;
    }

    private Optional<AppConfig> load() {
        String location = properties.getConfigPath();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.info("No endpoint configuration at {}, serving default endpoints only", location);
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            AppConfig config = yamlMapper.readValue(in, AppConfig.class);
            if (config == null) {
                log.warn("Endpoint configuration at {} is empty", location);
                return Optional.empty();
            }
            log.info("Loaded endpoint configuration from {}", location);
            return Optional.of(config);
        } catch (IOException e) {
            log.warn("Could not read endpoint configuration at {}: {}", location, e.getMessage());
            return Optional.empty();
        }
    }
}
