package com.example.abac.engine;

import com.example.abac.policy.model.PolicyEffect;

/**
 * Outcome of matching one candidate policy against a context.
 */
public record PolicyEvaluation(
        String policyId,
        String policyName,
        PolicyEffect effect,
        int priority,
        boolean matched,
        String reason
) {
}
