package io.jobhive.core.auth;

import java.util.Set;

/**
 * Authenticated principal attached to the request by {@link AuthGatewayFilter}.
 */
public record Caller(String id, Kind kind, Set<String> roles) {

    public static final String REQUEST_ATTRIBUTE = Caller.class.getName();

    public enum Kind {
        SERVICE,
        USER
    }

    public static Caller service() {
        return new Caller("service", Kind.SERVICE, Set.of());
    }

    public boolean isService() {
        return kind == Kind.SERVICE;
    }
}
