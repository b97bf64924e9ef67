package com.modelgate.modelgate_backend.support;

import java.util.Locale;

public final class EndpointNames {

    public static final String OLLAMA = "ollama";

    private EndpointNames() {}

    /** Ollama is recognised in any casing; every other name is kept exactly as configured. */
    public static String normalize(String name) {
        if (name != null && OLLAMA.equals(name.toLowerCase(Locale.ROOT))) {
            return OLLAMA;
        }
        return name;
    }
}
