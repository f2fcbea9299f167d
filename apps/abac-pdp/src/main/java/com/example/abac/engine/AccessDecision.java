package com.example.abac.engine;

import com.example.abac.policy.model.PolicyEffect;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * The result of an evaluation.
 *
 * @param decisionId          id shared with the decision log entry
 * @param result              ALLOW or DENY
 * @param controllingPolicyId policy that determined the result, null for a default deny
 * @param reason              human-readable explanation
 * @param appliedPolicies     every candidate policy considered, in evaluation order
 * @param evaluationTimeMs    wall time spent deciding
 * @param evaluatedAt         when the decision was made
 */
public record AccessDecision(
        String decisionId,
        PolicyEffect result,
        @Nullable String controllingPolicyId,
        String reason,
        List<PolicyEvaluation> appliedPolicies,
        long evaluationTimeMs,
        Instant evaluatedAt
) {
    public AccessDecision {
        appliedPolicies = appliedPolicies == null ? List.of() : List.copyOf(appliedPolicies);
    }

    public boolean isAllowed() {
        return result == PolicyEffect.ALLOW;
    }

    public boolean isDenied() {
        return result == PolicyEffect.DENY;
    }
}
