package com.example.abac.audit;

import com.example.abac.policy.model.PolicyEffect;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Optional decision log filters; null fields do not restrict the result.
 * {@code from} is inclusive, {@code to} exclusive.
 */
@Builder
public record AuditLogFilter(
        @Nullable String userId,
        @Nullable PolicyEffect decision,
        @Nullable String resourceType,
        @Nullable String action,
        @Nullable String policyId,
        @Nullable Instant from,
        @Nullable Instant to
) {
    public static AuditLogFilter all() {
        return AuditLogFilter.builder().build();
    }

    public boolean matches(DecisionLogEntry entry) {
        return (userId == null || userId.equals(entry.userId()))
                && (decision == null || decision == entry.decision())
                && (resourceType == null || resourceType.equals(entry.resourceType()))
                && (action == null || action.equals(entry.action()))
                && (policyId == null || entry.considered(policyId))
                && (from == null || !entry.createdAt().isBefore(from))
                && (to == null || entry.createdAt().isBefore(to));
    }
}
