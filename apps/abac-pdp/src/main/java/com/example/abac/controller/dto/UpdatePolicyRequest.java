package com.example.abac.controller.dto;

import com.example.abac.policy.model.PolicyEffect;
import com.example.abac.policy.model.PolicyPatch;
import com.example.abac.policy.model.PolicyScope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Partial update. Omitted fields keep their stored values; {@code expectedVersion} is the version
 * the caller last read.
 */
public record UpdatePolicyRequest(
        @NotNull @Min(1) Long expectedVersion,
        String policyId,
        @Size(max = 100) String name,
        @Size(max = 500) String description,
        PolicyScope scope,
        @Size(max = 64) String category,
        PolicyEffect effect,
        @Min(1) @Max(1000) Integer priority,
        @Valid List<PredicateRequest> subjectAttributes,
        @Valid List<PredicateRequest> actionAttributes,
        @Valid List<PredicateRequest> resourceAttributes,
        @Valid List<PredicateRequest> environmentAttributes,
        Boolean active
) {
    public PolicyPatch toPatch() {
        return PolicyPatch.builder()
                .policyId(policyId)
                .name(name)
                .description(description)
                .scope(scope)
                .category(category)
                .effect(effect)
                .priority(priority)
                .subjectAttributes(PredicateRequest.toPredicates(subjectAttributes))
                .actionAttributes(PredicateRequest.toPredicates(actionAttributes))
                .resourceAttributes(PredicateRequest.toPredicates(resourceAttributes))
                .environmentAttributes(PredicateRequest.toPredicates(environmentAttributes))
                .active(active)
                .build();
    }
}
