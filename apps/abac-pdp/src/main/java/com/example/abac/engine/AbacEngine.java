package com.example.abac.engine;

import com.example.abac.audit.AuditLogFilter;
import com.example.abac.audit.DecisionLogEntry;
import com.example.abac.audit.DecisionLogStore;
import com.example.abac.audit.DecisionRecorder;
import com.example.abac.common.dto.PageResult;
import com.example.abac.common.util.StringSanitizer;
import com.example.abac.config.AbacProperties;
import com.example.abac.exception.DuplicatePolicyException;
import com.example.abac.exception.InvalidContextException;
import com.example.abac.exception.PolicyNotFoundException;
import com.example.abac.exception.PolicyStoreUnavailableException;
import com.example.abac.exception.PolicyVersionConflictException;
import com.example.abac.exception.ProtectedPolicyException;
import com.example.abac.observability.metrics.AbacMetrics;
import com.example.abac.policy.CorePolicies;
import com.example.abac.policy.PolicyValidator;
import com.example.abac.policy.model.Policy;
import com.example.abac.policy.model.PolicyDraft;
import com.example.abac.policy.model.PolicyEffect;
import com.example.abac.policy.model.PolicyPatch;
import com.example.abac.policy.model.PolicyScope;
import com.example.abac.policy.store.PolicyFilter;
import com.example.abac.policy.store.PolicyStore;
import com.example.abac.statistics.AbacStatistics;
import com.example.abac.statistics.StatisticsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the policy decision point.
 *
 * <p>Evaluation reads the current policy snapshot, matches every candidate policy of the request's
 * scope and enclosing scopes, combines the applicable ones deny-overrides, and hands one log entry to
 * the {@link DecisionRecorder} before returning. Any failure on that path resolves to DENY.
 *
 * <p>Administrative operations write through the {@link PolicyStore} and rebuild the snapshot on success.
 */
@Slf4j
@Service
public class AbacEngine {

    static final String STORE_UNAVAILABLE_REASON = "policy store unavailable";
    static final String EVALUATION_ERROR_REASON = "evaluation error";
    private static final int TOGGLE_MAX_RETRIES = 3;

    private final PolicyStore policyStore;
    private final PolicyCache policyCache;
    private final AttributeMatcher matcher;
    private final DecisionCombiner combiner;
    private final DecisionRecorder recorder;
    private final DecisionLogStore logStore;
    private final StatisticsService statisticsService;
    private final AbacMetrics metrics;
    private final Duration retention;

    public AbacEngine(PolicyStore policyStore,
                      PolicyCache policyCache,
                      AttributeMatcher matcher,
                      DecisionCombiner combiner,
                      DecisionRecorder recorder,
                      DecisionLogStore logStore,
                      StatisticsService statisticsService,
                      AbacMetrics metrics,
                      AbacProperties properties) {
        this.policyStore = policyStore;
        this.policyCache = policyCache;
        this.matcher = matcher;
        this.combiner = combiner;
        this.recorder = recorder;
        this.logStore = logStore;
        this.statisticsService = statisticsService;
        this.metrics = metrics;
        this.retention = properties.getAudit().getRetention();
    }

    // ---------------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------------

    /**
     * Decides a request.
     *
     * @return the decision, or {@link InvalidContextException} if a context part is missing
     *         (the rejection is still logged as a DENY)
     */
    @NonNull
    public Mono<AccessDecision> evaluate(@Nullable EvaluationContext context) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            EvaluationContext ctx = context != null ? context : new EvaluationContext(null, null, null, null);

            List<String> missing = ctx.missingParts();
            if (!missing.isEmpty()) {
                InvalidContextException error = new InvalidContextException(missing);
                AccessDecision denied = deny(null, error.getMessage(), List.of(), start);
                complete(ctx, denied, error.getMessage(), null, start);
                return Mono.error(error);
            }

            PolicyScope scope = ctx.resolveScope();
            return policyCache.snapshot()
                    .map(snapshot -> decide(snapshot, ctx, scope, start))
                    .onErrorResume(error -> {
                        boolean storeDown = error instanceof PolicyStoreUnavailableException;
                        String reason = storeDown ? STORE_UNAVAILABLE_REASON : EVALUATION_ERROR_REASON;
                        if (!storeDown) {
                            log.error("Evaluation failed, denying: {}", StringSanitizer.forLog(error.getMessage(), 200), error);
                        }
                        return Mono.just(deny(null, reason, List.of(), start));
                    })
                    .doOnNext(decision -> complete(ctx, decision, failureOf(decision), scope, start));
        });
    }

    private AccessDecision decide(PolicySnapshot snapshot, EvaluationContext context, PolicyScope scope, long start) {
        List<Policy> candidates = snapshot.candidates(scope);
        List<PolicyEvaluation> evaluations = new ArrayList<>(candidates.size());
        for (Policy policy : candidates) {
            evaluations.add(matcher.evaluate(policy, context));
        }
        DecisionCombiner.Outcome outcome = combiner.combine(evaluations);
        return new AccessDecision(
                UUID.randomUUID().toString(),
                outcome.effect(),
                outcome.controllingPolicyId(),
                outcome.reason(),
                evaluations,
                elapsedMillis(start),
                Instant.now());
    }

    private AccessDecision deny(@Nullable String policyId, String reason, List<PolicyEvaluation> evaluations, long start) {
        return new AccessDecision(UUID.randomUUID().toString(), PolicyEffect.DENY, policyId, reason,
                evaluations, elapsedMillis(start), Instant.now());
    }

    private void complete(EvaluationContext context, AccessDecision decision, @Nullable String error,
                          @Nullable PolicyScope scope, long start) {
        recorder.record(DecisionLogEntry.from(context, decision, error, retention));
        metrics.recordDecision(decision.isAllowed(), decision.controllingPolicyId(),
                scope != null ? scope.name() : null, System.nanoTime() - start);

        if (decision.isAllowed()) {
            log.debug("Access ALLOWED by policy {} (decision={})", decision.controllingPolicyId(), decision.decisionId());
        } else {
            log.debug("Access DENIED: {} (decision={})", StringSanitizer.forLog(decision.reason(), 200),
                    decision.decisionId());
        }
    }

    @Nullable
    private static String failureOf(AccessDecision decision) {
        if (decision.controllingPolicyId() == null
                && (STORE_UNAVAILABLE_REASON.equals(decision.reason()) || EVALUATION_ERROR_REASON.equals(decision.reason()))) {
            return decision.reason();
        }
        return null;
    }

    private static long elapsedMillis(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }

    // ---------------------------------------------------------------------
    // Administration
    // ---------------------------------------------------------------------

    @NonNull
    public Mono<Policy> createPolicy(@NonNull PolicyDraft draft, @Nullable String actorId) {
        return Mono.fromCallable(() -> PolicyValidator.newPolicy(draft, actorId, Instant.now()))
                .flatMap(policyStore::insert)
                .flatMap(this::refreshAfter)
                .doOnSuccess(policy -> {
                    metrics.recordPolicyMutation("create", true);
                    log.info("Policy {} created by {}", policy.policyId(), StringSanitizer.forLog(actorId));
                })
                .doOnError(error -> metrics.recordPolicyMutation("create", false));
    }

    /**
     * Applies a patch if the stored version still equals {@code expectedVersion}.
     */
    @NonNull
    public Mono<Policy> updatePolicy(@NonNull String policyId, @NonNull PolicyPatch patch,
                                     long expectedVersion, @Nullable String actorId) {
        return Mono.fromCallable(() -> PolicyValidator.normalizePolicyId(policyId))
                .flatMap(id -> policyStore.findById(id)
                        .switchIfEmpty(Mono.error(() -> new PolicyNotFoundException(id))))
                .flatMap(current -> {
                    if (current.version() != expectedVersion) {
                        return Mono.error(new PolicyVersionConflictException(current.policyId(), expectedVersion));
                    }
                    Policy next = PolicyValidator.applyPatch(current, patch, actorId, Instant.now());
                    return policyStore.update(next, expectedVersion);
                })
                .flatMap(this::refreshAfter)
                .doOnSuccess(policy -> {
                    metrics.recordPolicyMutation("update", true);
                    log.info("Policy {} updated to version {} by {}", policy.policyId(), policy.version(),
                            StringSanitizer.forLog(actorId));
                })
                .doOnError(error -> metrics.recordPolicyMutation("update", false));
    }

    /**
     * Deletes a policy. Core policies are refused whether or not they exist.
     */
    @NonNull
    public Mono<Void> deletePolicy(@NonNull String policyId) {
        return Mono.fromCallable(() -> PolicyValidator.normalizePolicyId(policyId))
                .flatMap(id -> {
                    if (CorePolicies.isCore(id)) {
                        return Mono.error(new ProtectedPolicyException(id));
                    }
                    return policyStore.delete(id)
                            .flatMap(deleted -> deleted
                                    ? refreshAfter(id)
                                    : Mono.error(new PolicyNotFoundException(id)));
                })
                .doOnSuccess(id -> {
                    metrics.recordPolicyMutation("delete", true);
                    log.info("Policy {} deleted", id);
                })
                .doOnError(error -> metrics.recordPolicyMutation("delete", false))
                .then();
    }

    /**
     * Flips the active flag. A write lost to a concurrent change is retried against the newer version.
     */
    @NonNull
    public Mono<Policy> togglePolicy(@NonNull String policyId, @Nullable String actorId) {
        return Mono.fromCallable(() -> PolicyValidator.normalizePolicyId(policyId))
                .flatMap(id -> Mono.defer(() -> policyStore.findById(id)
                                .switchIfEmpty(Mono.error(() -> new PolicyNotFoundException(id)))
                                .flatMap(current -> policyStore.update(
                                        PolicyValidator.toggled(current, actorId, Instant.now()), current.version())))
                        .retryWhen(Retry.max(TOGGLE_MAX_RETRIES)
                                .filter(PolicyVersionConflictException.class::isInstance)
                                .onRetryExhaustedThrow((spec, signal) -> signal.failure())))
                .flatMap(this::refreshAfter)
                .doOnSuccess(policy -> {
                    metrics.recordPolicyMutation("toggle", true);
                    log.info("Policy {} {} by {}", policy.policyId(), policy.active() ? "activated" : "deactivated",
                            StringSanitizer.forLog(actorId));
                })
                .doOnError(error -> metrics.recordPolicyMutation("toggle", false));
    }

    /**
     * Creates a core policy from its built-in template unless it already exists.
     */
    @NonNull
    public Mono<Policy> initializeCorePolicy(@NonNull String policyId, @Nullable String actorId) {
        return Mono.fromCallable(() -> PolicyValidator.normalizePolicyId(policyId))
                .flatMap(id -> {
                    PolicyDraft template = CorePolicies.template(id).orElse(null);
                    if (template == null) {
                        return Mono.error(new PolicyNotFoundException(id, "Core policy template " + id + " not found"));
                    }
                    return policyStore.findById(id)
                            .doOnNext(existing -> log.debug("Core policy {} already present", id))
                            .switchIfEmpty(Mono.defer(() -> createCore(template, actorId)));
                });
    }

    @NonNull
    public Flux<Policy> initializeCorePolicies(@Nullable String actorId) {
        return Flux.fromIterable(CorePolicies.IDS)
                .concatMap(id -> initializeCorePolicy(id, actorId));
    }

    private Mono<Policy> createCore(PolicyDraft template, @Nullable String actorId) {
        return Mono.fromCallable(() -> PolicyValidator.newPolicy(template, actorId, Instant.now()))
                .flatMap(policyStore::insert)
                .onErrorResume(DuplicatePolicyException.class, e -> policyStore.findById(template.policyId()))
                .flatMap(this::refreshAfter)
                .doOnSuccess(policy -> log.info("Core policy {} initialized", policy.policyId()));
    }

    /**
     * Rebuilds the policy snapshot now.
     */
    @NonNull
    public Mono<Void> refreshCache() {
        return policyCache.refresh()
                .doOnNext(snapshot -> log.info("Policy cache refreshed: generation {}, {} active policies",
                        snapshot.generation(), snapshot.size()))
                .then();
    }

    private <T> Mono<T> refreshAfter(T result) {
        return policyCache.refresh()
                .thenReturn(result)
                .onErrorResume(error -> {
                    // the write is durable; force the next evaluation to reload rather than serve stale policies
                    policyCache.invalidate();
                    log.warn("Policy cache refresh after mutation failed: {}",
                            StringSanitizer.forLog(error.getMessage(), 200));
                    return Mono.just(result);
                });
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    @NonNull
    public Mono<Policy> getPolicy(@NonNull String policyId) {
        return Mono.fromCallable(() -> PolicyValidator.normalizePolicyId(policyId))
                .flatMap(id -> policyStore.findById(id)
                        .switchIfEmpty(Mono.error(() -> new PolicyNotFoundException(id))));
    }

    @NonNull
    public Mono<PageResult<Policy>> listPolicies(@NonNull PolicyFilter filter, @NonNull Pageable pageable) {
        return Mono.zip(policyStore.find(filter, pageable).collectList(), policyStore.count(filter))
                .map(t -> new PageResult<>(t.getT1(), pageNumber(pageable), pageSize(pageable, t.getT2()), t.getT2()));
    }

    @NonNull
    public Mono<PageResult<DecisionLogEntry>> listAuditLogs(@NonNull AuditLogFilter filter, @NonNull Pageable pageable) {
        return Mono.zip(logStore.find(filter, pageable).collectList(), logStore.count(filter))
                .map(t -> new PageResult<>(t.getT1(), pageNumber(pageable), pageSize(pageable, t.getT2()), t.getT2()));
    }

    @NonNull
    public Mono<AbacStatistics> getStatistics(int timeRangeHours) {
        return statisticsService.getStatistics(timeRangeHours);
    }

    private static int pageNumber(Pageable pageable) {
        return pageable.isPaged() ? pageable.getPageNumber() : 0;
    }

    private static int pageSize(Pageable pageable, long total) {
        return pageable.isPaged() ? pageable.getPageSize() : (int) Math.min(total, Integer.MAX_VALUE);
    }
}
