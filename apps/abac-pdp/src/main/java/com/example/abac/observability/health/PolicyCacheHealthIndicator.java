package com.example.abac.observability.health;

import com.example.abac.engine.PolicyCache;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Health of the policy snapshot. DOWN until a snapshot has been loaded, since every
 * evaluation before then fails closed.
 */
@Component
@RequiredArgsConstructor
public class PolicyCacheHealthIndicator implements ReactiveHealthIndicator {

    private final PolicyCache policyCache;

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(() -> policyCache.current()
                .map(snapshot -> Health.up()
                        .withDetail("generation", snapshot.generation())
                        .withDetail("activePolicies", snapshot.size())
                        .withDetail("loadedAt", snapshot.loadedAt().toString())
                        .build())
                .orElseGet(() -> Health.down()
                        .withDetail("reason", "policy snapshot not loaded")
                        .build()));
    }
}
