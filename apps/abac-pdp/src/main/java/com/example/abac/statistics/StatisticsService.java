package com.example.abac.statistics;

import com.example.abac.audit.DecisionLogEntry;
import com.example.abac.audit.DecisionLogStore;
import com.example.abac.audit.DecisionSummary;
import com.example.abac.config.AbacProperties;
import com.example.abac.policy.model.Policy;
import com.example.abac.policy.model.PolicyEffect;
import com.example.abac.policy.store.PolicyFilter;
import com.example.abac.policy.store.PolicyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Builds usage overviews from the decision log and the per-policy counters.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatisticsService {

    public static final int MAX_TIME_RANGE_HOURS = 24 * 365;

    private static final Comparator<Policy> MOST_EVALUATED =
            Comparator.comparingLong(Policy::evaluationCount).reversed().thenComparing(Policy::policyId);

    private final DecisionLogStore logStore;
    private final PolicyStore policyStore;
    private final AbacProperties properties;

    @NonNull
    public Mono<AbacStatistics> getStatistics(int timeRangeHours) {
        if (timeRangeHours < 1 || timeRangeHours > MAX_TIME_RANGE_HOURS) {
            return Mono.error(new IllegalArgumentException(
                    "timeRange must be between 1 and " + MAX_TIME_RANGE_HOURS + " hours"));
        }
        Instant now = Instant.now();
        Instant since = now.minus(Duration.ofHours(timeRangeHours));
        int topLimit = Math.max(0, properties.getStatistics().getTopPolicies());
        int denialLimit = Math.max(0, properties.getStatistics().getRecentDenials());

        Mono<AbacStatistics.Overview> overview = logStore.summarize(since)
                .collectList()
                .map(this::toOverview);

        Mono<List<AbacStatistics.PolicyUsage>> topPolicies = policyStore
                .find(new PolicyFilter(null, null, true), Pageable.unpaged())
                .sort(MOST_EVALUATED)
                .take(topLimit)
                .map(this::toUsage)
                .collectList();

        Mono<List<AbacStatistics.Denial>> recentDenials = logStore.recentDenials(since, denialLimit)
                .map(this::toDenial)
                .collectList();

        return Mono.zip(overview, topPolicies, recentDenials)
                .map(t -> new AbacStatistics(timeRangeHours, since, now, t.getT1(), t.getT2(), t.getT3()))
                .doOnNext(stats -> log.debug("Statistics for last {}h: {} decisions",
                        timeRangeHours, stats.overview().totalDecisions()));
    }

    private AbacStatistics.Overview toOverview(List<DecisionSummary> summaries) {
        long total = 0;
        long allows = 0;
        long denies = 0;
        double weightedTime = 0;
        for (DecisionSummary summary : summaries) {
            total += summary.count();
            weightedTime += summary.averageEvaluationTimeMs() * summary.count();
            if (summary.decision() == PolicyEffect.ALLOW) {
                allows += summary.count();
            } else {
                denies += summary.count();
            }
        }
        double average = total == 0 ? 0.0 : weightedTime / total;
        List<DecisionSummary> ordered = summaries.stream()
                .sorted(Comparator.comparing(DecisionSummary::decision))
                .toList();
        return new AbacStatistics.Overview(total, allows, denies, average, ordered);
    }

    private AbacStatistics.PolicyUsage toUsage(Policy policy) {
        return new AbacStatistics.PolicyUsage(
                policy.policyId(),
                policy.name(),
                policy.scope(),
                policy.category(),
                policy.effect(),
                policy.evaluationCount(),
                policy.allowCount(),
                policy.denyCount(),
                policy.successRate());
    }

    private AbacStatistics.Denial toDenial(DecisionLogEntry entry) {
        return new AbacStatistics.Denial(
                entry.decisionId(),
                entry.createdAt(),
                entry.userId(),
                entry.tenantId(),
                entry.action(),
                entry.resourceType(),
                entry.resourceId(),
                entry.controllingPolicyId(),
                entry.reason());
    }
}
