package com.example.abac.policy;

import com.example.abac.exception.InvalidPolicyException;
import com.example.abac.policy.model.AttributeCategory;
import com.example.abac.policy.model.AttributePredicate;
import com.example.abac.policy.model.Policy;
import com.example.abac.policy.model.PolicyDraft;
import com.example.abac.policy.model.PolicyPatch;
import com.example.abac.policy.model.PredicateOperator;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates and normalizes policy definitions before they reach a store.
 *
 * <p>All shape checks happen here so that evaluation never meets an unknown operator or a
 * malformed expected value.
 */
public final class PolicyValidator {

    public static final int DEFAULT_PRIORITY = 100;
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 1000;
    public static final String DEFAULT_CATEGORY = "CUSTOM";

    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 500;
    static final int MAX_PATTERN_LENGTH = 256;
    static final int MAX_PREDICATES_PER_CATEGORY = 32;
    static final int MAX_LIST_VALUES = 256;

    private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Z0-9_]{1,64}$");
    private static final Pattern ATTRIBUTE_PATTERN = Pattern.compile("^[A-Za-z0-9_]+(\\.[A-Za-z0-9_]+){0,7}$");

    private PolicyValidator() {}

    /**
     * Builds the first version of a policy from a draft.
     */
    @NonNull
    public static Policy newPolicy(@NonNull PolicyDraft draft, @Nullable String actorId, @NonNull Instant now) {
        String actor = requireActor(actorId);
        String policyId = normalizePolicyId(draft.policyId());

        return Policy.builder()
                .policyId(policyId)
                .name(requireText("name", draft.name(), MAX_NAME_LENGTH))
                .description(requireText("description", draft.description(), MAX_DESCRIPTION_LENGTH))
                .scope(requireValue("scope", draft.scope()))
                .category(normalizeCategory(draft.category()))
                .effect(requireValue("effect", draft.effect()))
                .priority(checkPriority(draft.priority() == null ? DEFAULT_PRIORITY : draft.priority()))
                .subjectAttributes(checkPredicates(AttributeCategory.SUBJECT, draft.subjectAttributes()))
                .actionAttributes(checkPredicates(AttributeCategory.ACTION, draft.actionAttributes()))
                .resourceAttributes(checkPredicates(AttributeCategory.RESOURCE, draft.resourceAttributes()))
                .environmentAttributes(checkPredicates(AttributeCategory.ENVIRONMENT, draft.environmentAttributes()))
                .active(draft.active() == null || draft.active())
                .version(1)
                .createdBy(actor)
                .lastModifiedBy(actor)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Applies a patch and produces the next version. Usage counters are carried over untouched;
     * stores never persist them from this object.
     */
    @NonNull
    public static Policy applyPatch(@NonNull Policy current, @NonNull PolicyPatch patch,
                                    @Nullable String actorId, @NonNull Instant now) {
        String actor = requireActor(actorId);
        if (patch.policyId() != null && !normalizePolicyId(patch.policyId()).equals(current.policyId())) {
            throw new InvalidPolicyException("policyId is immutable");
        }

        Policy.PolicyBuilder next = current.toBuilder()
                .version(current.version() + 1)
                .lastModifiedBy(actor)
                .updatedAt(now);

        if (patch.name() != null) {
            next.name(requireText("name", patch.name(), MAX_NAME_LENGTH));
        }
        if (patch.description() != null) {
            next.description(requireText("description", patch.description(), MAX_DESCRIPTION_LENGTH));
        }
        if (patch.scope() != null) {
            next.scope(patch.scope());
        }
        if (patch.category() != null) {
            next.category(normalizeCategory(patch.category()));
        }
        if (patch.effect() != null) {
            next.effect(patch.effect());
        }
        if (patch.priority() != null) {
            next.priority(checkPriority(patch.priority()));
        }
        if (patch.subjectAttributes() != null) {
            next.subjectAttributes(checkPredicates(AttributeCategory.SUBJECT, patch.subjectAttributes()));
        }
        if (patch.actionAttributes() != null) {
            next.actionAttributes(checkPredicates(AttributeCategory.ACTION, patch.actionAttributes()));
        }
        if (patch.resourceAttributes() != null) {
            next.resourceAttributes(checkPredicates(AttributeCategory.RESOURCE, patch.resourceAttributes()));
        }
        if (patch.environmentAttributes() != null) {
            next.environmentAttributes(checkPredicates(AttributeCategory.ENVIRONMENT, patch.environmentAttributes()));
        }
        if (patch.active() != null) {
            next.active(patch.active());
        }
        return next.build();
    }

    /**
     * Produces the next version of a policy with its active flag flipped.
     */
    @NonNull
    public static Policy toggled(@NonNull Policy current, @Nullable String actorId, @NonNull Instant now) {
        return current.toBuilder()
                .active(!current.active())
                .version(current.version() + 1)
                .lastModifiedBy(requireActor(actorId))
                .updatedAt(now)
                .build();
    }

    @NonNull
    public static String normalizePolicyId(@Nullable String policyId) {
        if (policyId == null || policyId.isBlank()) {
            throw new InvalidPolicyException("policyId is required");
        }
        String normalized = policyId.trim().toUpperCase(Locale.ROOT);
        if (!KEY_PATTERN.matcher(normalized).matches()) {
            throw new InvalidPolicyException("policyId must match [A-Z0-9_]{1,64}");
        }
        return normalized;
    }

    @NonNull
    static String normalizeCategory(@Nullable String category) {
        if (category == null || category.isBlank()) {
            return DEFAULT_CATEGORY;
        }
        String normalized = category.trim().toUpperCase(Locale.ROOT);
        if (!KEY_PATTERN.matcher(normalized).matches()) {
            throw new InvalidPolicyException("category must match [A-Z0-9_]{1,64}");
        }
        return normalized;
    }

    @NonNull
    static List<AttributePredicate> checkPredicates(@NonNull AttributeCategory category,
                                                    @Nullable List<AttributePredicate> predicates) {
        if (predicates == null || predicates.isEmpty()) {
            return List.of();
        }
        if (predicates.size() > MAX_PREDICATES_PER_CATEGORY) {
            throw new InvalidPolicyException(String.format("%s attributes exceed %d predicates",
                    category.label(), MAX_PREDICATES_PER_CATEGORY));
        }
        List<AttributePredicate> checked = new ArrayList<>(predicates.size());
        for (AttributePredicate predicate : predicates) {
            checked.add(checkPredicate(category, predicate));
        }
        return List.copyOf(checked);
    }

    @NonNull
    static AttributePredicate checkPredicate(@NonNull AttributeCategory category, @Nullable AttributePredicate predicate) {
        if (predicate == null) {
            throw new InvalidPolicyException(category.label() + " attributes contain a null predicate");
        }
        String attribute = predicate.attribute().trim();
        if (!ATTRIBUTE_PATTERN.matcher(attribute).matches()) {
            throw new InvalidPolicyException(String.format("%s attribute name '%s' is invalid",
                    category.label(), attribute));
        }

        PredicateOperator operator = predicate.operator();
        Object value = predicate.value();
        String where = category.label() + "." + attribute;

        switch (operator) {
            case IN, NOT_IN -> {
                if (!(value instanceof List<?> list) || list.isEmpty()) {
                    throw new InvalidPolicyException(where + ": operator " + operator.wireName()
                            + " requires a non-empty list");
                }
                if (list.size() > MAX_LIST_VALUES) {
                    throw new InvalidPolicyException(where + ": list exceeds " + MAX_LIST_VALUES + " values");
                }
                for (Object element : list) {
                    if (!isScalar(element)) {
                        throw new InvalidPolicyException(where + ": list values must be strings, numbers or booleans");
                    }
                }
            }
            case EXISTS -> {
                if (value == null) {
                    value = Boolean.TRUE;
                } else if (!(value instanceof Boolean)) {
                    throw new InvalidPolicyException(where + ": operator exists takes a boolean");
                }
            }
            case MATCHES_PATTERN -> {
                if (!(value instanceof String pattern) || pattern.isEmpty()) {
                    throw new InvalidPolicyException(where + ": operator matchesPattern requires a pattern string");
                }
                if (pattern.length() > MAX_PATTERN_LENGTH) {
                    throw new InvalidPolicyException(where + ": pattern exceeds " + MAX_PATTERN_LENGTH + " characters");
                }
            }
            default -> {
                if (!isScalar(value)) {
                    throw new InvalidPolicyException(where + ": operator " + operator.wireName()
                            + " requires a string, number, boolean or reference");
                }
                if (value instanceof String text && text.trim().startsWith("${")
                        && AttributePredicate.parseReference(text).isEmpty()) {
                    throw new InvalidPolicyException(where + ": malformed reference " + text);
                }
            }
        }
        return new AttributePredicate(attribute, operator, value);
    }

    private static boolean isScalar(@Nullable Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static int checkPriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new InvalidPolicyException(String.format("priority must be between %d and %d",
                    MIN_PRIORITY, MAX_PRIORITY));
        }
        return priority;
    }

    @NonNull
    private static String requireText(String field, @Nullable String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new InvalidPolicyException(field + " is required");
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw new InvalidPolicyException(String.format("%s exceeds %d characters", field, maxLength));
        }
        return trimmed;
    }

    @NonNull
    private static <T> T requireValue(String field, @Nullable T value) {
        if (value == null) {
            throw new InvalidPolicyException(field + " is required");
        }
        return value;
    }

    @NonNull
    private static String requireActor(@Nullable String actorId) {
        if (actorId == null || actorId.isBlank()) {
            throw new InvalidPolicyException("actorId is required");
        }
        return actorId.trim();
    }
}
