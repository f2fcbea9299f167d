package com.example.abac.policy.store;

import com.example.abac.exception.DuplicatePolicyException;
import com.example.abac.exception.PolicyNotFoundException;
import com.example.abac.exception.PolicyVersionConflictException;
import com.example.abac.policy.model.Policy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of PolicyStore.
 * Conditional writes are applied inside {@link ConcurrentMap#compute}, which serializes them per key.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "abac.store", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryPolicyStore implements PolicyStore {

    private final ConcurrentMap<String, Policy> policies = new ConcurrentHashMap<>();

    public InMemoryPolicyStore() {
        log.info("Using in-memory policy store");
    }

    @Override
    public Mono<Policy> insert(Policy policy) {
        return Mono.fromCallable(() -> {
            Policy existing = policies.putIfAbsent(policy.policyId(), policy);
            if (existing != null) {
                throw new DuplicatePolicyException(policy.policyId());
            }
            return policy;
        });
    }

    @Override
    public Mono<Policy> findById(String policyId) {
        return Mono.fromSupplier(() -> policies.get(policyId));
    }

    @Override
    public Flux<Policy> findActive() {
        return Flux.defer(() -> Flux.fromIterable(policies.values()))
                .filter(Policy::active);
    }

    @Override
    public Flux<Policy> find(PolicyFilter filter, Pageable pageable) {
        return Flux.defer(() -> Flux.fromStream(policies.values().stream()
                .filter(filter::matches)
                .sorted(Policy.EVALUATION_ORDER)
                .skip(pageable.isPaged() ? pageable.getOffset() : 0)
                .limit(pageable.isPaged() ? pageable.getPageSize() : Long.MAX_VALUE)));
    }

    @Override
    public Mono<Long> count(PolicyFilter filter) {
        return Mono.fromSupplier(() -> policies.values().stream().filter(filter::matches).count());
    }

    @Override
    public Mono<Policy> update(Policy next, long expectedVersion) {
        return Mono.fromCallable(() -> {
            AtomicReference<RuntimeException> failure = new AtomicReference<>();
            Policy stored = policies.computeIfPresent(next.policyId(), (id, current) -> {
                if (current.version() != expectedVersion) {
                    failure.set(new PolicyVersionConflictException(id, expectedVersion));
                    return current;
                }
                return next.toBuilder()
                        .version(expectedVersion + 1)
                        .evaluationCount(current.evaluationCount())
                        .allowCount(current.allowCount())
                        .denyCount(current.denyCount())
                        .createdBy(current.createdBy())
                        .createdAt(current.createdAt())
                        .build();
            });
            if (stored == null) {
                throw new PolicyNotFoundException(next.policyId());
            }
            if (failure.get() != null) {
                throw failure.get();
            }
            return stored;
        });
    }

    @Override
    public Mono<Boolean> delete(String policyId) {
        return Mono.fromSupplier(() -> policies.remove(policyId) != null);
    }

    @Override
    public Mono<Void> incrementCounters(String policyId, long evaluations, long allows, long denies) {
        return Mono.fromRunnable(() -> policies.computeIfPresent(policyId, (id, current) -> current.toBuilder()
                .evaluationCount(current.evaluationCount() + evaluations)
                .allowCount(current.allowCount() + allows)
                .denyCount(current.denyCount() + denies)
                .build()));
    }
}
