package com.example.abac.audit;

import com.example.abac.common.util.StringSanitizer;
import com.example.abac.engine.AccessDecision;
import com.example.abac.engine.EvaluationContext;
import com.example.abac.engine.PolicyEvaluation;
import com.example.abac.policy.model.AttributeCategory;
import com.example.abac.policy.model.PolicyEffect;
import lombok.Builder;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable record of one evaluation, kept for audit and statistics.
 * Entries expire through a TTL index on {@code expiresAt}.
 */
@Builder
@Document(collection = "abac_decision_logs")
@CompoundIndexes({
        @CompoundIndex(name = "decision_created_idx", def = "{'decision': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "user_created_idx", def = "{'userId': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "resource_action_idx", def = "{'resourceType': 1, 'action': 1}"),
        @CompoundIndex(name = "applied_policy_idx", def = "{'appliedPolicies.policyId': 1, 'createdAt': -1}")
})
public record DecisionLogEntry(
        @Id String decisionId,

        Map<String, Object> subjectAttributes,
        Map<String, Object> actionAttributes,
        Map<String, Object> resourceAttributes,
        Map<String, Object> environmentAttributes,

        PolicyEffect decision,
        List<PolicyEvaluation> appliedPolicies,
        @Nullable String controllingPolicyId,
        String reason,
        long evaluationTimeMs,

        @Nullable String userId,
        @Nullable String userRole,
        @Nullable String tenantId,
        @Nullable String action,
        @Nullable String resourceType,
        @Nullable String resourceId,
        @Nullable String ipAddress,
        @Nullable String userAgent,
        @Nullable String endpoint,
        @Nullable String method,

        @Nullable String error,
        @Indexed Instant createdAt,
        @Indexed(name = "expires_at_ttl", expireAfter = "0s") Instant expiresAt
) {
    private static final int MAX_FIELD_LENGTH = 256;
    private static final int MAX_USER_AGENT_LENGTH = 500;

    public DecisionLogEntry {
        subjectAttributes = subjectAttributes == null ? Map.of() : subjectAttributes;
        actionAttributes = actionAttributes == null ? Map.of() : actionAttributes;
        resourceAttributes = resourceAttributes == null ? Map.of() : resourceAttributes;
        environmentAttributes = environmentAttributes == null ? Map.of() : environmentAttributes;
        appliedPolicies = appliedPolicies == null ? List.of() : List.copyOf(appliedPolicies);
    }

    /**
     * Builds the entry for a decision. The indexed convenience fields are lifted from the context.
     */
    @NonNull
    public static DecisionLogEntry from(@NonNull EvaluationContext context, @NonNull AccessDecision decision,
                                        @Nullable String error, @NonNull Duration retention) {
        return DecisionLogEntry.builder()
                .decisionId(decision.decisionId())
                .subjectAttributes(context.subject())
                .actionAttributes(context.action())
                .resourceAttributes(context.resource())
                .environmentAttributes(context.environment())
                .decision(decision.result())
                .appliedPolicies(decision.appliedPolicies())
                .controllingPolicyId(decision.controllingPolicyId())
                .reason(decision.reason())
                .evaluationTimeMs(decision.evaluationTimeMs())
                .userId(firstText(context, AttributeCategory.SUBJECT, "id", "userId"))
                .userRole(firstText(context, AttributeCategory.SUBJECT, "role"))
                .tenantId(firstText(context, AttributeCategory.SUBJECT, "tenantId"))
                .action(firstText(context, AttributeCategory.ACTION, "action", "type"))
                .resourceType(firstText(context, AttributeCategory.RESOURCE, "resourceType", "type"))
                .resourceId(firstText(context, AttributeCategory.RESOURCE, "id", "resourceId"))
                .ipAddress(firstText(context, AttributeCategory.ENVIRONMENT, "ipAddress"))
                .userAgent(StringSanitizer.headerValue(
                        firstText(context, AttributeCategory.ENVIRONMENT, "userAgent"), MAX_USER_AGENT_LENGTH))
                .endpoint(firstText(context, AttributeCategory.ENVIRONMENT, "endpoint"))
                .method(firstText(context, AttributeCategory.ENVIRONMENT, "method"))
                .error(error)
                .createdAt(decision.evaluatedAt())
                .expiresAt(decision.evaluatedAt().plus(retention))
                .build();
    }

    public boolean considered(String policyId) {
        return appliedPolicies.stream().anyMatch(p -> p.policyId().equals(policyId));
    }

    @Nullable
    private static String firstText(EvaluationContext context, AttributeCategory category, String... keys) {
        for (String key : keys) {
            Object value = context.lookup(category, key);
            if (value != null && !(value instanceof Map<?, ?>) && !(value instanceof List<?>)) {
                return StringSanitizer.headerValue(value.toString(), MAX_FIELD_LENGTH);
            }
        }
        return null;
    }
}
