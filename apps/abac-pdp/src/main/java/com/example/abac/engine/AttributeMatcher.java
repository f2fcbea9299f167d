package com.example.abac.engine;

import com.example.abac.common.util.StringSanitizer;
import com.example.abac.policy.model.AttributeCategory;
import com.example.abac.policy.model.AttributePredicate;
import com.example.abac.policy.model.Policy;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a policy applies to a context.
 *
 * <p>A policy applies when, in each of the four categories, the predicate list is empty or every
 * predicate holds. Operands that are both numeric (numbers or numeric strings) compare as numbers,
 * everything else compares by its string form. An absent attribute is treated as null:
 * <ul>
 *   <li>{@code equals} holds only if the expected value is also absent, {@code notEquals} only if it is present</li>
 *   <li>{@code in}, {@code greaterThan}, {@code lessThan}, {@code contains} and {@code matchesPattern} never hold</li>
 *   <li>{@code notIn} always holds</li>
 *   <li>{@code exists} holds when presence equals the expected boolean</li>
 * </ul>
 * A collection-valued attribute satisfies {@code equals}/{@code in} when any element does.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class AttributeMatcher {

    public static final String ALL_MATCHED = "All policy conditions matched";
    public static final String NOT_MET_PREFIX = "Policy conditions not met: ";

    private static final Pattern NUMERIC = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d{1,4})?$");
    private static final int MAX_NUMERIC_LENGTH = 64;
    private static final int MAX_REASON_VALUE_LENGTH = 64;

    /**
     * Matches every predicate of a policy and explains the outcome.
     */
    @NonNull
    public PolicyEvaluation evaluate(@NonNull Policy policy, @NonNull EvaluationContext context) {
        List<String> failures = new ArrayList<>(4);
        for (AttributeCategory category : AttributeCategory.values()) {
            matchCategory(category, policy.predicates(category), context)
                    .ifPresent(reason -> failures.add(category.label() + ": " + reason));
        }
        boolean matched = failures.isEmpty();
        String reason = matched ? ALL_MATCHED : NOT_MET_PREFIX + String.join(", ", failures);
        return new PolicyEvaluation(policy.policyId(), policy.name(), policy.effect(), policy.priority(), matched, reason);
    }

    /**
     * Returns the reason of the first failing predicate, or empty when the category matches.
     */
    @NonNull
    Optional<String> matchCategory(@NonNull AttributeCategory category,
                                   @NonNull List<AttributePredicate> predicates,
                                   @NonNull EvaluationContext context) {
        for (AttributePredicate predicate : predicates) {
            Optional<String> failure = matchPredicate(category, predicate, context);
            if (failure.isPresent()) {
                return failure;
            }
        }
        return Optional.empty();
    }

    @NonNull
    Optional<String> matchPredicate(@NonNull AttributeCategory category,
                                    @NonNull AttributePredicate predicate,
                                    @NonNull EvaluationContext context) {
        String name = predicate.attribute();
        Object actual = context.lookup(category, name);
        Object expected = resolveExpected(predicate, context);

        return switch (predicate.operator()) {
            case EQUALS -> valuesEqual(actual, expected)
                    ? Optional.empty()
                    : fail("%s (%s) != %s", name, display(actual), display(expected));
            case NOT_EQUALS -> !valuesEqual(actual, expected)
                    ? Optional.empty()
                    : fail("%s equals %s", name, display(expected));
            case IN -> actual != null && anyEqual(actual, expected)
                    ? Optional.empty()
                    : fail("%s (%s) not in %s", name, display(actual), display(expected));
            case NOT_IN -> actual == null || !anyEqual(actual, expected)
                    ? Optional.empty()
                    : fail("%s (%s) in %s", name, display(actual), display(expected));
            case GREATER_THAN -> compare(actual, expected).filter(c -> c > 0).isPresent()
                    ? Optional.empty()
                    : fail("%s (%s) not greater than %s", name, display(actual), display(expected));
            case LESS_THAN -> compare(actual, expected).filter(c -> c < 0).isPresent()
                    ? Optional.empty()
                    : fail("%s (%s) not less than %s", name, display(actual), display(expected));
            case EXISTS -> {
                boolean wanted = !Boolean.FALSE.equals(expected);
                boolean present = actual != null;
                yield present == wanted
                        ? Optional.empty()
                        : fail(present ? "%s is present" : "%s is missing", name);
            }
            case MATCHES_PATTERN -> actual != null && !(actual instanceof Collection<?>) && expected != null
                    && GlobPattern.matches(expected.toString(), stringify(actual))
                    ? Optional.empty()
                    : fail("%s (%s) does not match %s", name, display(actual), display(expected));
            case CONTAINS -> contains(actual, expected)
                    ? Optional.empty()
                    : fail("%s (%s) does not contain %s", name, display(actual), display(expected));
        };
    }

    @Nullable
    private Object resolveExpected(AttributePredicate predicate, EvaluationContext context) {
        return predicate.reference()
                .map(ref -> context.lookup(ref.category(), ref.path()))
                .orElse(predicate.value());
    }

    private boolean valuesEqual(@Nullable Object actual, @Nullable Object expected) {
        if (actual == null || expected == null) {
            return actual == null && expected == null;
        }
        if (actual instanceof Collection<?> elements) {
            for (Object element : elements) {
                if (element != null && !(element instanceof Collection<?>) && valuesEqual(element, expected)) {
                    return true;
                }
            }
            return false;
        }
        if (expected instanceof Collection<?>) {
            return false;
        }
        Optional<BigDecimal> left = toNumber(actual);
        Optional<BigDecimal> right = toNumber(expected);
        if (left.isPresent() && right.isPresent()) {
            return left.get().compareTo(right.get()) == 0;
        }
        return stringify(actual).equals(stringify(expected));
    }

    private boolean anyEqual(Object actual, @Nullable Object expected) {
        if (!(expected instanceof Collection<?> candidates)) {
            return valuesEqual(actual, expected);
        }
        for (Object candidate : candidates) {
            if (valuesEqual(actual, candidate)) {
                return true;
            }
        }
        return false;
    }

    private Optional<Integer> compare(@Nullable Object actual, @Nullable Object expected) {
        if (actual == null || expected == null
                || actual instanceof Collection<?> || expected instanceof Collection<?>) {
            return Optional.empty();
        }
        Optional<BigDecimal> left = toNumber(actual);
        Optional<BigDecimal> right = toNumber(expected);
        if (left.isPresent() && right.isPresent()) {
            return Optional.of(left.get().compareTo(right.get()));
        }
        return Optional.of(stringify(actual).compareTo(stringify(expected)));
    }

    private boolean contains(@Nullable Object actual, @Nullable Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof Collection<?>) {
            return valuesEqual(actual, expected);
        }
        return stringify(actual).contains(stringify(expected));
    }

    private Optional<BigDecimal> toNumber(Object value) {
        if (value instanceof Boolean) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        if (text.isEmpty() || text.length() > MAX_NUMERIC_LENGTH) {
            return Optional.empty();
        }
        if (!(value instanceof Number) && !NUMERIC.matcher(text).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            // NaN and Infinity fall back to string comparison
            return Optional.empty();
        }
    }

    private String stringify(Object value) {
        return value.toString();
    }

    private String display(@Nullable Object value) {
        if (value == null) {
            return "missing";
        }
        return StringSanitizer.forLog(value, MAX_REASON_VALUE_LENGTH);
    }

    private static Optional<String> fail(String format, Object... args) {
        return Optional.of(String.format(format, args));
    }
}
