package com.example.abac.audit;

import org.springframework.data.domain.Pageable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Append-only store of decision log entries.
 */
public interface DecisionLogStore {

    Mono<DecisionLogEntry> save(DecisionLogEntry entry);

    /**
     * Entries matching the filter, newest first.
     */
    Flux<DecisionLogEntry> find(AuditLogFilter filter, Pageable pageable);

    Mono<Long> count(AuditLogFilter filter);

    /**
     * Per-outcome totals of the entries created at or after {@code since}.
     */
    Flux<DecisionSummary> summarize(Instant since);

    /**
     * The most recent DENY entries created at or after {@code since}, newest first.
     */
    Flux<DecisionLogEntry> recentDenials(Instant since, int limit);
}
