package com.example.abac.policy.model;

import lombok.Builder;

import java.util.List;

/**
 * Input for creating a policy. Optional fields fall back to defaults during validation.
 */
@Builder(toBuilder = true)
public record PolicyDraft(
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
