package com.example.abac.statistics;

import com.example.abac.audit.DecisionSummary;
import com.example.abac.policy.model.PolicyEffect;
import com.example.abac.policy.model.PolicyScope;

import java.time.Instant;
import java.util.List;

/**
 * Usage overview for a time window.
 */
public record AbacStatistics(
        int timeRangeHours,
        Instant since,
        Instant generatedAt,
        Overview overview,
        List<PolicyUsage> topPolicies,
        List<Denial> recentDenials
) {

    public record Overview(
            long totalDecisions,
            long allowCount,
            long denyCount,
            double averageEvaluationTimeMs,
            List<DecisionSummary> byDecision
    ) {
    }

    public record PolicyUsage(
            String policyId,
            String name,
            PolicyScope scope,
            String category,
            PolicyEffect effect,
            long evaluationCount,
            long allowCount,
            long denyCount,
            double successRate
    ) {
    }

    public record Denial(
            String decisionId,
            Instant createdAt,
            String userId,
            String tenantId,
            String action,
            String resourceType,
            String resourceId,
            String controllingPolicyId,
            String reason
    ) {
    }
}
