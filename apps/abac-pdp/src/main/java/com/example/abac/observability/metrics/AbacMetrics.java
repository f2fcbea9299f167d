package com.example.abac.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized recording of decision point metrics.
 * Uses bounded tag values to prevent high-cardinality metric explosion.
 */
@Component
public class AbacMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";
    private static final String TAG_UNKNOWN = "unknown";
    private static final String TAG_NONE = "none";
    private static final int MAX_TAG_LENGTH = 50;

    private final MeterRegistry registry;

    private final Counter decisionAllowed;
    private final Counter decisionDenied;
    private final Timer evaluationTimer;

    private final Counter cacheRefreshSuccess;
    private final Counter cacheRefreshFailure;

    private final Counter auditWriteSuccess;
    private final Counter auditWriteFailure;
    private final Counter statisticsUpdateSuccess;
    private final Counter statisticsUpdateFailure;

    public AbacMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.decisionAllowed = Counter.builder("abac.decision")
                .tag("result", "allowed")
                .description("Decisions that allowed access")
                .register(registry);

        this.decisionDenied = Counter.builder("abac.decision")
                .tag("result", "denied")
                .description("Decisions that denied access")
                .register(registry);

        this.evaluationTimer = Timer.builder("abac.evaluation")
                .description("Time spent evaluating a request")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.cacheRefreshSuccess = Counter.builder("abac.cache.refresh")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Policy snapshot rebuilds")
                .register(registry);

        this.cacheRefreshFailure = Counter.builder("abac.cache.refresh")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Failed policy snapshot rebuilds")
                .register(registry);

        this.auditWriteSuccess = Counter.builder("abac.audit.write")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Decision log entries persisted")
                .register(registry);

        this.auditWriteFailure = Counter.builder("abac.audit.write")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Decision log entries that failed to persist")
                .register(registry);

        this.statisticsUpdateSuccess = Counter.builder("abac.statistics.update")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Policy counter increments applied")
                .register(registry);

        this.statisticsUpdateFailure = Counter.builder("abac.statistics.update")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Policy counter increments that failed")
                .register(registry);
    }

    public void recordDecision(boolean allowed, @Nullable String controllingPolicyId, @Nullable String scope,
                               long evaluationTimeNanos) {
        if (allowed) {
            decisionAllowed.increment();
        } else {
            decisionDenied.increment();
        }
        evaluationTimer.record(evaluationTimeNanos, TimeUnit.NANOSECONDS);

        registry.counter("abac.decision.detailed",
                Tags.of("result", allowed ? "allowed" : "denied",
                        "policy", controllingPolicyId == null ? TAG_NONE : sanitizeTag(controllingPolicyId),
                        "scope", sanitizeTag(scope)))
                .increment();
    }

    public void recordCacheRefresh(boolean success) {
        if (success) {
            cacheRefreshSuccess.increment();
        } else {
            cacheRefreshFailure.increment();
        }
    }

    public void recordAuditDropped(@NonNull String reason) {
        registry.counter("abac.audit.dropped", Tags.of("reason", sanitizeTag(reason))).increment();
    }

    public void recordAuditWrite(boolean success) {
        if (success) {
            auditWriteSuccess.increment();
        } else {
            auditWriteFailure.increment();
        }
    }

    public void recordStatisticsUpdate(boolean success) {
        if (success) {
            statisticsUpdateSuccess.increment();
        } else {
            statisticsUpdateFailure.increment();
        }
    }

    public void recordPolicyMutation(@NonNull String operation, boolean success) {
        registry.counter("abac.policy.mutation",
                Tags.of("operation", sanitizeTag(operation),
                        "outcome", success ? OUTCOME_SUCCESS : OUTCOME_FAILURE))
                .increment();
    }

    public void registerAuditQueueDepth(@NonNull Supplier<Number> depth) {
        Gauge.builder("abac.audit.queue.depth", depth)
                .description("Decision log entries waiting to be written")
                .register(registry);
    }

    public void registerCachedPolicies(@NonNull Supplier<Number> size) {
        Gauge.builder("abac.cache.policies", size)
                .description("Active policies in the current snapshot")
                .register(registry);
    }

    @NonNull
    private String sanitizeTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
        if (sanitized.length() > MAX_TAG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_TAG_LENGTH);
        }
        return sanitized.isBlank() ? TAG_UNKNOWN : sanitized;
    }
}
