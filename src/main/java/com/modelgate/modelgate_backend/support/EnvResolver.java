package com.modelgate.modelgate_backend.support;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${VAR}} references in configured values against the Spring environment
 * (system environment, system properties, application properties).
 */
@Slf4j
@Component
public class EnvResolver {

    /** Sentinel for values each user supplies at request time. */
    public static final String USER_PROVIDED = "user_provided";

    private static final Pattern WHOLE_REF = Pattern.compile("^\\$\\{([^}]+)}$");
    private static final Pattern EMBEDDED_REF = Pattern.compile("\\$\\{([^}]+)}");

    private final Environment env;

    public EnvResolver(Environment env) {
        this.env = env;
    }

    /**
     * A whole-value reference resolves to the variable, or stays as written when unset.
     * References embedded in a longer value are substituted where set and left alone otherwise.
     */
    public String extractEnvVariable(String value) {
        if (value == null || !value.contains("${")) return value;

        Matcher whole = WHOLE_REF.matcher(value.trim());
        if (whole.matches()) {
            String resolved = env.getProperty(whole.group(1).trim());
            if (resolved == null) {
                log.debug("Variable {} is not set, keeping the configured value", whole.group(1));
                return value;
            }
            return resolved;
        }

        Matcher matcher = EMBEDDED_REF.matcher(value);
        StringBuffer result = new StringBuffer();
        while (matcher.find()) {
            String resolved = env.getProperty(matcher.group(1).trim());
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolved != null ? resolved : matcher.group()));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    public boolean isUserProvided(String resolvedValue) {
        return USER_PROVIDED.equals(resolvedValue);
    }
}
