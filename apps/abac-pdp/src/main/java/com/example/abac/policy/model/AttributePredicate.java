package com.example.abac.policy.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single condition on one attribute of one context category.
 *
 * <p>{@code value} is a scalar (String, Number, Boolean), a list of scalars for {@code in}/{@code notIn},
 * or a reference string of the form {@code ${category.path}} resolved against the context at evaluation time.
 * Shapes are checked by {@link com.example.abac.policy.PolicyValidator} before a predicate is stored.
 *
 * @param attribute attribute name, may be a dotted path into nested maps
 * @param operator  comparison operator
 * @param value     expected value
 */
public record AttributePredicate(String attribute, PredicateOperator operator, Object value) {

    private static final Pattern REFERENCE = Pattern.compile("^\\$\\{([A-Za-z]+)\\.([A-Za-z0-9_.]+)}$");

    public AttributePredicate {
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(operator, "operator");
        if (value instanceof List<?> list) {
            // null elements survive so the validator can reject them
            value = Collections.unmodifiableList(new ArrayList<>(list));
        }
    }

    public static AttributePredicate of(String attribute, PredicateOperator operator, Object value) {
        return new AttributePredicate(attribute, operator, value);
    }

    /**
     * Returns the reference target when {@code value} is a {@code ${category.path}} string.
     */
    public Optional<Reference> reference() {
        return parseReference(value);
    }

    public static Optional<Reference> parseReference(Object candidate) {
        if (!(candidate instanceof String text)) {
            return Optional.empty();
        }
        Matcher matcher = REFERENCE.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return AttributeCategory.fromReferencePrefix(matcher.group(1))
                .map(category -> new Reference(category, matcher.group(2)));
    }

    /**
     * A pointer to another attribute in the same evaluation context.
     */
    public record Reference(AttributeCategory category, String path) {

        @Override
        public String toString() {
            return category.key() + "." + path;
        }
    }
}
