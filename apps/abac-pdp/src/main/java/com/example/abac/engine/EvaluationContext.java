package com.example.abac.engine;

import com.example.abac.policy.model.AttributeCategory;
import com.example.abac.policy.model.PolicyScope;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The four attribute maps a decision is made over. Values are plain JSON-like data:
 * strings, numbers, booleans, lists and nested maps.
 */
public record EvaluationContext(
        Map<String, Object> subject,
        Map<String, Object> action,
        Map<String, Object> resource,
        Map<String, Object> environment
) {
    private static final Set<String> PLATFORM_ROLES = Set.of("SuperAdmin", "FinanceAdmin", "PlatformSupport");

    public EvaluationContext {
        subject = freeze(subject);
        action = freeze(action);
        resource = freeze(resource);
        environment = freeze(environment);
    }

    public static EvaluationContext of(Map<String, Object> subject, Map<String, Object> action,
                                       Map<String, Object> resource, Map<String, Object> environment) {
        return new EvaluationContext(subject, action, resource, environment);
    }

    /**
     * Names of the parts that were not supplied, in category order. A context with missing parts is
     * rejected by the engine.
     */
    public List<String> missingParts() {
        List<String> missing = new ArrayList<>(4);
        for (AttributeCategory category : AttributeCategory.values()) {
            if (attributes(category) == null) {
                missing.add(category.key());
            }
        }
        return missing;
    }

    @Nullable
    public Map<String, Object> attributes(AttributeCategory category) {
        return switch (category) {
            case SUBJECT -> subject;
            case ACTION -> action;
            case RESOURCE -> resource;
            case ENVIRONMENT -> environment;
        };
    }

    /**
     * Looks up an attribute. A key containing dots is first tried verbatim, then walked as a
     * path through nested maps. Returns null when any step is absent.
     */
    @Nullable
    public Object lookup(AttributeCategory category, String path) {
        Map<String, Object> attributes = attributes(category);
        if (attributes == null || path == null) {
            return null;
        }
        if (attributes.containsKey(path) || path.indexOf('.') < 0) {
            return attributes.get(path);
        }
        Object current = attributes;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    /**
     * The administrative scope the request is evaluated at: an explicit {@code scope} on the resource
     * or action, else PLATFORM for platform operators, else TENANT.
     */
    public PolicyScope resolveScope() {
        return PolicyScope.parse(lookup(AttributeCategory.RESOURCE, "scope"))
                .or(() -> PolicyScope.parse(lookup(AttributeCategory.ACTION, "scope")))
                .orElseGet(() -> {
                    Object platformRole = lookup(AttributeCategory.SUBJECT, "platformRole");
                    return platformRole != null && PLATFORM_ROLES.contains(platformRole.toString())
                            ? PolicyScope.PLATFORM
                            : PolicyScope.TENANT;
                });
    }

    @Nullable
    private static Map<String, Object> freeze(@Nullable Map<String, Object> attributes) {
        if (attributes == null) {
            return null;
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
