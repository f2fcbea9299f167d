package com.example.abac.policy.model;

import lombok.Builder;

import java.util.List;

/**
 * Partial update of a policy's definition. Null fields are left unchanged.
 *
 * <p>{@code policyId} is only present to detect attempts to rename a policy; it must be null
 * or equal to the id being updated.
 */
@Builder
public record PolicyPatch(
        String policyId,
        String name,
        String description,
        PolicyScope scope,
        String category,
        PolicyEffect effect,
        Integer priority,
        List<AttributePredicate> subjectAttributes,
        List<AttributePredicate> actionAttributes,
        List<AttributePredicate> resourceAttributes,
        List<AttributePredicate> environmentAttributes,
        Boolean active
) {
}
