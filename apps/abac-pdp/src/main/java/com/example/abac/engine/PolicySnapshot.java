package com.example.abac.engine;

import com.example.abac.policy.model.Policy;
import com.example.abac.policy.model.PolicyScope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of the active policies at one point in time.
 *
 * <p>The candidate list for each request scope (that scope plus every enclosing one) is
 * precomputed in evaluation order.
 */
public final class PolicySnapshot {

    private final long generation;
    private final Instant loadedAt;
    private final Map<PolicyScope, List<Policy>> candidatesByScope;
    private final int size;

    private PolicySnapshot(long generation, Instant loadedAt,
                           Map<PolicyScope, List<Policy>> candidatesByScope, int size) {
        this.generation = generation;
        this.loadedAt = loadedAt;
        this.candidatesByScope = candidatesByScope;
        this.size = size;
    }

    /**
     * Builds a snapshot from store contents. Inactive policies are left out.
     */
    public static PolicySnapshot of(Collection<Policy> policies, long generation, Instant loadedAt) {
        Map<PolicyScope, List<Policy>> byScope = new EnumMap<>(PolicyScope.class);
        int size = 0;
        for (Policy policy : policies) {
            if (!policy.active() || policy.scope() == null) {
                continue;
            }
            byScope.computeIfAbsent(policy.scope(), s -> new ArrayList<>()).add(policy);
            size++;
        }

        Map<PolicyScope, List<Policy>> candidates = new EnumMap<>(PolicyScope.class);
        for (PolicyScope requestScope : PolicyScope.values()) {
            List<Policy> merged = new ArrayList<>();
            for (PolicyScope governing : requestScope.governingScopes()) {
                merged.addAll(byScope.getOrDefault(governing, List.of()));
            }
            merged.sort(Policy.EVALUATION_ORDER);
            candidates.put(requestScope, List.copyOf(merged));
        }

        return new PolicySnapshot(generation, loadedAt, Collections.unmodifiableMap(candidates), size);
    }

    /**
     * Active policies governing a request at the given scope, in evaluation order.
     */
    public List<Policy> candidates(PolicyScope requestScope) {
        return candidatesByScope.getOrDefault(requestScope, List.of());
    }

    public long generation() {
        return generation;
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    public int size() {
        return size;
    }
}
