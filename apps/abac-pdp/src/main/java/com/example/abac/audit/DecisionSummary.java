package com.example.abac.audit;

import com.example.abac.policy.model.PolicyEffect;

/**
 * Count and mean evaluation time of the decisions with one outcome.
 */
public record DecisionSummary(PolicyEffect decision, long count, double averageEvaluationTimeMs) {
}
