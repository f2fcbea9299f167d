package com.example.abac.policy.model;

import lombok.Builder;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * One access-control rule. Immutable; every change produces a new instance.
 *
 * <p>The business key {@code policyId} doubles as the MongoDB document id.
 */
@Builder(toBuilder = true)
@Document(collection = "abac_policies")
@CompoundIndexes({
        @CompoundIndex(name = "scope_active_priority_idx", def = "{'scope': 1, 'active': 1, 'priority': -1}"),
        @CompoundIndex(name = "category_active_idx", def = "{'category': 1, 'active': 1}")
})
public record Policy(
        @Id String policyId,
        String name,
        String description,
        PolicyScope scope,
        String category,
        PolicyEffect effect,
        int priority,

        List<AttributePredicate> subjectAttributes,
        List<AttributePredicate> actionAttributes,
        List<AttributePredicate> resourceAttributes,
        List<AttributePredicate> environmentAttributes,

        boolean active,
        long version,

        // Usage statistics, maintained asynchronously
        long evaluationCount,
        long allowCount,
        long denyCount,

        String createdBy,
        String lastModifiedBy,
        Instant createdAt,
        Instant updatedAt
) {
    /**
     * Evaluation order: priority descending, then policyId ascending.
     */
    public static final Comparator<Policy> EVALUATION_ORDER =
            Comparator.comparingInt(Policy::priority).reversed().thenComparing(Policy::policyId);

    public Policy {
        subjectAttributes = subjectAttributes == null ? List.of() : List.copyOf(subjectAttributes);
        actionAttributes = actionAttributes == null ? List.of() : List.copyOf(actionAttributes);
        resourceAttributes = resourceAttributes == null ? List.of() : List.copyOf(resourceAttributes);
        environmentAttributes = environmentAttributes == null ? List.of() : List.copyOf(environmentAttributes);
    }

    public List<AttributePredicate> predicates(AttributeCategory category) {
        return switch (category) {
            case SUBJECT -> subjectAttributes;
            case ACTION -> actionAttributes;
            case RESOURCE -> resourceAttributes;
            case ENVIRONMENT -> environmentAttributes;
        };
    }

    /**
     * Share of evaluations in which this policy controlled an ALLOW, as a percentage.
     */
    public double successRate() {
        if (evaluationCount == 0) {
            return 0.0;
        }
        return (double) allowCount / evaluationCount * 100.0;
    }
}
