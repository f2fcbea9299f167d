package com.example.abac.engine;

import com.example.abac.common.util.StringSanitizer;
import com.example.abac.config.AbacProperties;
import com.example.abac.exception.AbacException;
import com.example.abac.exception.PolicyStoreUnavailableException;
import com.example.abac.observability.metrics.AbacMetrics;
import com.example.abac.policy.store.PolicyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link PolicySnapshot}.
 *
 * <p>The snapshot is loaded on first use, rebuilt after every policy mutation and on a fixed
 * interval. Each rebuild takes a generation number when it starts; a rebuild that finishes after a
 * newer one never replaces it. Callers that find the cache empty share a single load.
 */
@Slf4j
@Component
public class PolicyCache {

    private final PolicyStore policyStore;
    private final AbacMetrics metrics;
    private final Duration loadTimeout;

    private final AtomicReference<PolicySnapshot> current = new AtomicReference<>();
    private final AtomicReference<Mono<PolicySnapshot>> coldLoad = new AtomicReference<>();
    private final AtomicLong generations = new AtomicLong();
    private final AtomicLong invalidatedThrough = new AtomicLong();

    public PolicyCache(PolicyStore policyStore, AbacMetrics metrics, AbacProperties properties) {
        this.policyStore = policyStore;
        this.metrics = metrics;
        this.loadTimeout = properties.getCache().getLoadTimeout();
        metrics.registerCachedPolicies(() -> current().map(PolicySnapshot::size).orElse(0));
    }

    /**
     * The current snapshot, loading it if none has been built yet.
     */
    @NonNull
    public Mono<PolicySnapshot> snapshot() {
        return Mono.defer(() -> {
            PolicySnapshot snapshot = current.get();
            return snapshot != null ? Mono.just(snapshot) : coldLoad.updateAndGet(this::joinOrStartLoad);
        });
    }

    public Optional<PolicySnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Rebuilds the snapshot from the store.
     *
     * @return the snapshot in effect afterwards, or {@code PolicyStoreUnavailableException}
     */
    @NonNull
    public Mono<PolicySnapshot> refresh() {
        return Mono.defer(() -> {
            long generation = generations.incrementAndGet();
            return policyStore.findActive()
                    .collectList()
                    .timeout(loadTimeout)
                    .flatMap(policies -> {
                        PolicySnapshot installed = install(PolicySnapshot.of(policies, generation, Instant.now()));
                        // null when this load started before an invalidation and nothing newer is in place
                        return installed != null ? Mono.just(installed) : refresh();
                    })
                    .doOnNext(snapshot -> {
                        metrics.recordCacheRefresh(true);
                        log.debug("Policy snapshot generation {} in effect with {} active policies",
                                snapshot.generation(), snapshot.size());
                    })
                    .onErrorMap(error -> !(error instanceof AbacException),
                            error -> new PolicyStoreUnavailableException("Policy store unavailable", error))
                    .doOnError(error -> {
                        metrics.recordCacheRefresh(false);
                        log.error("Policy snapshot rebuild {} failed: {}", generation,
                                StringSanitizer.forLog(rootMessage(error), 200));
                    });
        });
    }

    /**
     * Drops the current snapshot so the next evaluation reloads it.
     */
    public void invalidate() {
        invalidatedThrough.set(generations.get());
        current.set(null);
        log.warn("Policy snapshot invalidated");
    }

    @Scheduled(fixedDelayString = "${abac.cache.refresh-interval:PT5M}",
            initialDelayString = "${abac.cache.refresh-interval:PT5M}")
    void scheduledRefresh() {
        refresh().subscribe(
                snapshot -> log.debug("Scheduled policy refresh complete"),
                error -> log.warn("Scheduled policy refresh failed, keeping generation {}",
                        current().map(PolicySnapshot::generation).orElse(0L)));
    }

    private Mono<PolicySnapshot> joinOrStartLoad(Mono<PolicySnapshot> inFlight) {
        if (inFlight != null) {
            return inFlight;
        }
        AtomicReference<Mono<PolicySnapshot>> self = new AtomicReference<>();
        Mono<PolicySnapshot> load = refresh()
                .doFinally(signal -> coldLoad.compareAndSet(self.get(), null))
                .cache();
        self.set(load);
        return load;
    }

    private PolicySnapshot install(PolicySnapshot candidate) {
        return current.accumulateAndGet(candidate, (existing, fresh) -> {
            if (fresh.generation() <= invalidatedThrough.get()) {
                return existing;
            }
            return existing == null || existing.generation() < fresh.generation() ? fresh : existing;
        });
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }
}
