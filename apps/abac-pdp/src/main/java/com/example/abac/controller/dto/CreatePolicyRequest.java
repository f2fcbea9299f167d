package com.example.abac.controller.dto;

import com.example.abac.policy.model.PolicyDraft;
import com.example.abac.policy.model.PolicyEffect;
import com.example.abac.policy.model.PolicyScope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreatePolicyRequest(
        @NotBlank @Size(max = 64) String policyId,
        @NotBlank @Size(max = 100) String name,
        @NotBlank @Size(max = 500) String description,
        @NotNull PolicyScope scope,
        @Size(max = 64) String category,
        @NotNull PolicyEffect effect,
        @Min(1) @Max(1000) Integer priority,
        @Valid List<PredicateRequest> subjectAttributes,
        @Valid List<PredicateRequest> actionAttributes,
        @Valid List<PredicateRequest> resourceAttributes,
        @Valid List<PredicateRequest> environmentAttributes,
        Boolean active
) {
    public PolicyDraft toDraft() {
        return PolicyDraft.builder()
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
