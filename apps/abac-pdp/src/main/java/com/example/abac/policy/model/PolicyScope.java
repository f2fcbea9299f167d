package com.example.abac.policy.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Administrative scope of a policy. Scopes nest: PLATFORM encloses TENANT, which encloses RESOURCE.
 * A request evaluated at a given scope is governed by the policies of that scope and every enclosing one.
 */
public enum PolicyScope {
    PLATFORM,
    TENANT,
    RESOURCE;

    /**
     * Scopes whose policies govern a request at this scope, broadest first.
     */
    public Set<PolicyScope> governingScopes() {
        return switch (this) {
            case PLATFORM -> EnumSet.of(PLATFORM);
            case TENANT -> EnumSet.of(PLATFORM, TENANT);
            case RESOURCE -> EnumSet.of(PLATFORM, TENANT, RESOURCE);
        };
    }

    public static Optional<PolicyScope> parse(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.toString().trim().toUpperCase(Locale.ROOT);
        for (PolicyScope scope : values()) {
            if (scope.name().equals(normalized)) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
