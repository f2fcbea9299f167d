package com.example.abac.policy.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Closed set of comparison operators a predicate may use.
 * The wire name is camelCase; the legacy snake_case spellings are accepted on input.
 */
public enum PredicateOperator {
    EQUALS("equals", null),
    NOT_EQUALS("notEquals", "not_equals"),
    IN("in", null),
    NOT_IN("notIn", "not_in"),
    GREATER_THAN("greaterThan", "greater_than"),
    LESS_THAN("lessThan", "less_than"),
    EXISTS("exists", null),
    MATCHES_PATTERN("matchesPattern", "matches_pattern"),
    CONTAINS("contains", null);

    private final String wireName;
    private final String legacyName;

    PredicateOperator(String wireName, String legacyName) {
        this.wireName = wireName;
        this.legacyName = legacyName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean requiresList() {
        return this == IN || this == NOT_IN;
    }

    public static Optional<PredicateOperator> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (PredicateOperator op : values()) {
            if (op.wireName.equals(trimmed) || trimmed.equals(op.legacyName) || op.name().equals(trimmed)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
