package com.example.abac.policy.store;

import com.example.abac.policy.model.Policy;
import org.springframework.data.domain.Pageable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable keyed collection of policies.
 *
 * <p>Writes of a policy definition are conditional on its version. Usage counters are owned by
 * {@link #incrementCounters} and are never overwritten by {@link #update}.
 */
public interface PolicyStore {

    /**
     * Stores a new policy.
     *
     * @return the stored policy, or {@code DuplicatePolicyException} when the id is taken
     */
    Mono<Policy> insert(Policy policy);

    Mono<Policy> findById(String policyId);

    Flux<Policy> findActive();

    /**
     * Policies matching the filter, ordered by priority descending then policyId.
     */
    Flux<Policy> find(PolicyFilter filter, Pageable pageable);

    Mono<Long> count(PolicyFilter filter);

    /**
     * Replaces the definitional fields of a policy if its stored version equals {@code expectedVersion}.
     * The stored version becomes {@code expectedVersion + 1}; counters and creation metadata are kept.
     *
     * @return the stored policy, {@code PolicyVersionConflictException} on a stale version,
     *         or {@code PolicyNotFoundException} for an unknown id
     */
    Mono<Policy> update(Policy next, long expectedVersion);

    /**
     * @return true if a policy was removed
     */
    Mono<Boolean> delete(String policyId);

    /**
     * Atomically adds to the usage counters. Completes empty if the policy no longer exists.
     */
    Mono<Void> incrementCounters(String policyId, long evaluations, long allows, long denies);
}
