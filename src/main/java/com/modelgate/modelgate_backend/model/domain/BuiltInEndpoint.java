package com.modelgate.modelgate_backend.model.domain;

import java.util.List;

/**
 * Endpoints served without any custom configuration.
 * Each contributes its known model list to the default models config.
 */
public enum BuiltInEndpoint {

    OPENAI("openAI",         List.of("gpt-4o", "gpt-4o-mini", "gpt-4-turbo", "gpt-3.5-turbo")),
    ASSISTANTS("assistants", List.of("gpt-4o", "gpt-4o-mini", "gpt-4-turbo")),
    ANTHROPIC("anthropic",   List.of("claude-3-5-sonnet-latest", "claude-3-5-haiku-latest", "claude-3-opus-latest")),
    GOOGLE("google",         List.of("gemini-1.5-pro", "gemini-1.5-flash", "gemini-2.0-flash")),
    BEDROCK("bedrock",       List.of("anthropic.claude-3-5-sonnet-20240620-v1:0", "meta.llama3-1-70b-instruct-v1:0"));

    private final String endpointName;
    private final List<String> knownModels;

    BuiltInEndpoint(String endpointName, List<String> knownModels) {
        this.endpointName = endpointName;
        this.knownModels  = knownModels;
    }

    public String getEndpointName()     { return endpointName; }
    public List<String> getKnownModels() { return knownModels; }
}
