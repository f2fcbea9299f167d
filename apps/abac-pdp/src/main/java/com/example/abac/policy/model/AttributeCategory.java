package com.example.abac.policy.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The four parts of an evaluation context.
 */
public enum AttributeCategory {
    SUBJECT("Subject"),
    ACTION("Action"),
    RESOURCE("Resource"),
    ENVIRONMENT("Environment");

    private final String label;

    AttributeCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Key of this category inside a context document and inside {@code ${category.path}} references.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a reference prefix. {@code user} is accepted as an alias of {@code subject}.
     */
    public static Optional<AttributeCategory> fromReferencePrefix(String prefix) {
        if (prefix == null) {
            return Optional.empty();
        }
        String normalized = prefix.toLowerCase(Locale.ROOT);
        if ("user".equals(normalized)) {
            return Optional.of(SUBJECT);
        }
        for (AttributeCategory category : values()) {
            if (category.key().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
