package com.example.abac.audit;

import com.example.abac.config.AbacProperties;
import com.example.abac.policy.model.PolicyEffect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * In-memory implementation of DecisionLogStore.
 * Keeps the newest entries up to a fixed capacity; older ones are evicted first.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "abac.store", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryDecisionLogStore implements DecisionLogStore {

    private final ConcurrentLinkedDeque<DecisionLogEntry> entries = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final int capacity;

    public InMemoryDecisionLogStore(AbacProperties properties) {
        this.capacity = Math.max(1, properties.getAudit().getInMemoryCapacity());
        log.info("Using in-memory decision log store (capacity={})", capacity);
    }

    @Override
    public Mono<DecisionLogEntry> save(DecisionLogEntry entry) {
        return Mono.fromSupplier(() -> {
            entries.addFirst(entry);
            if (size.incrementAndGet() > capacity && entries.pollLast() != null) {
                size.decrementAndGet();
            }
            return entry;
        });
    }

    @Override
    public Flux<DecisionLogEntry> find(AuditLogFilter filter, Pageable pageable) {
        return Flux.defer(() -> Flux.fromStream(newestFirst()
                .filter(filter::matches)
                .skip(pageable.isPaged() ? pageable.getOffset() : 0)
                .limit(pageable.isPaged() ? pageable.getPageSize() : Long.MAX_VALUE)));
    }

    @Override
    public Mono<Long> count(AuditLogFilter filter) {
        return Mono.fromSupplier(() -> entries.stream().filter(filter::matches).count());
    }

    @Override
    public Flux<DecisionSummary> summarize(Instant since) {
        return Flux.defer(() -> {
            Map<PolicyEffect, long[]> totals = new EnumMap<>(PolicyEffect.class);
            entries.stream()
                    .filter(entry -> !entry.createdAt().isBefore(since))
                    .forEach(entry -> {
                        long[] total = totals.computeIfAbsent(entry.decision(), d -> new long[2]);
                        total[0]++;
                        total[1] += entry.evaluationTimeMs();
                    });
            List<DecisionSummary> summaries = totals.entrySet().stream()
                    .map(e -> new DecisionSummary(e.getKey(), e.getValue()[0],
                            (double) e.getValue()[1] / e.getValue()[0]))
                    .toList();
            return Flux.fromIterable(summaries);
        });
    }

    @Override
    public Flux<DecisionLogEntry> recentDenials(Instant since, int limit) {
        return Flux.defer(() -> Flux.fromStream(newestFirst()
                .filter(entry -> entry.decision() == PolicyEffect.DENY)
                .filter(entry -> !entry.createdAt().isBefore(since))
                .limit(Math.max(0, limit))));
    }

    private Stream<DecisionLogEntry> newestFirst() {
        return entries.stream()
                .sorted((a, b) -> b.createdAt().compareTo(a.createdAt()));
    }
}
