package com.modelgate.modelgate_backend.model.domain;

/**
 * Who is asking for the model list. Authentication happens upstream; this only carries
 * what the fetchers forward to providers (the id, for {@code userIdQuery}).
 */
public record CallerIdentity(String id, String role) {

    public static final String ANONYMOUS = "anonymous";
    public static final String DEFAULT_ROLE = "USER";

    public static CallerIdentity of(String id, String role) {
        return new CallerIdentity(
                id != null && !id.isBlank() ? id : ANONYMOUS,
                role != null && !role.isBlank() ? role : DEFAULT_ROLE);
    }
}
