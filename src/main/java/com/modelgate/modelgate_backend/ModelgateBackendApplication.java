package com.modelgate.modelgate_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ModelgateBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelgateBackendApplication.class, args);
    }
}
