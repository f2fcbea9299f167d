package com.example.abac.controller;

import com.example.abac.audit.AuditLogFilter;
import com.example.abac.audit.DecisionLogEntry;
import com.example.abac.common.dto.PageResult;
import com.example.abac.common.util.StringSanitizer;
import com.example.abac.controller.dto.CreatePolicyRequest;
import com.example.abac.controller.dto.EvaluateRequest;
import com.example.abac.controller.dto.UpdatePolicyRequest;
import com.example.abac.engine.AbacEngine;
import com.example.abac.engine.AccessDecision;
import com.example.abac.policy.model.Policy;
import com.example.abac.policy.model.PolicyEffect;
import com.example.abac.policy.model.PolicyScope;
import com.example.abac.policy.store.PolicyFilter;
import com.example.abac.statistics.AbacStatistics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Administrative and evaluation endpoints. The acting administrator is identified by the
 * {@code X-Actor-Id} header; authenticating it is left to the enclosing application.
 * Page numbers are 1-based on the wire.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/abac")
@RequiredArgsConstructor
public class AbacController {

    static final String ACTOR_HEADER = "X-Actor-Id";
    private static final int MAX_PAGE_SIZE = 100;

    private final AbacEngine engine;

    @GetMapping("/policies")
    public Mono<PageResult<Policy>> listPolicies(
            @RequestParam(required = false) PolicyScope scope,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) Boolean active,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {

        PolicyFilter filter = new PolicyFilter(scope,
                category != null ? category.trim().toUpperCase(Locale.ROOT) : null, active);
        return engine.listPolicies(filter, pageRequest(page, limit))
                .map(this::toOneBased);
    }

    @GetMapping("/policies/{id}")
    public Mono<Policy> getPolicy(@PathVariable String id) {
        return engine.getPolicy(id);
    }

    @PostMapping("/policies")
    public Mono<ResponseEntity<Policy>> createPolicy(
            @RequestHeader(name = ACTOR_HEADER, required = false) String actorId,
            @Valid @RequestBody CreatePolicyRequest request) {

        return Mono.fromCallable(request::toDraft)
                .flatMap(draft -> engine.createPolicy(draft, actorId))
                .map(policy -> ResponseEntity.status(HttpStatus.CREATED).body(policy));
    }

    @PutMapping("/policies/{id}")
    public Mono<Policy> updatePolicy(
            @PathVariable String id,
            @RequestHeader(name = ACTOR_HEADER, required = false) String actorId,
            @Valid @RequestBody UpdatePolicyRequest request) {

        return Mono.fromCallable(request::toPatch)
                .flatMap(patch -> engine.updatePolicy(id, patch, request.expectedVersion(), actorId));
    }

    @DeleteMapping("/policies/{id}")
    public Mono<ResponseEntity<Void>> deletePolicy(@PathVariable String id) {
        return engine.deletePolicy(id)
                .then(Mono.fromSupplier(() -> ResponseEntity.noContent().<Void>build()));
    }

    @PatchMapping("/policies/{id}/toggle")
    public Mono<Policy> togglePolicy(
            @PathVariable String id,
            @RequestHeader(name = ACTOR_HEADER, required = false) String actorId) {
        return engine.togglePolicy(id, actorId);
    }

    @PostMapping({"/evaluate", "/test"})
    public Mono<AccessDecision> evaluate(@RequestBody EvaluateRequest request) {
        return engine.evaluate(request.toContext());
    }

    @GetMapping("/audit-logs")
    public Mono<PageResult<DecisionLogEntry>> listAuditLogs(
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) PolicyEffect decision,
            @RequestParam(required = false) String resourceType,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String policyId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit) {

        AuditLogFilter filter = AuditLogFilter.builder()
                .userId(userId)
                .decision(decision)
                .resourceType(resourceType)
                .action(action)
                .policyId(policyId != null ? policyId.trim().toUpperCase(Locale.ROOT) : null)
                .from(from)
                .to(to)
                .build();
        return engine.listAuditLogs(filter, pageRequest(page, limit))
                .map(this::toOneBased);
    }

    @GetMapping("/statistics")
    public Mono<AbacStatistics> getStatistics(@RequestParam(defaultValue = "24") int timeRange) {
        return engine.getStatistics(timeRange);
    }

    @PostMapping("/core-policies/{policyId}/initialize")
    public Mono<Policy> initializeCorePolicy(
            @PathVariable String policyId,
            @RequestHeader(name = ACTOR_HEADER, required = false) String actorId) {
        return engine.initializeCorePolicy(policyId, actorId);
    }

    @PostMapping("/core-policies/initialize")
    public Mono<List<Policy>> initializeCorePolicies(
            @RequestHeader(name = ACTOR_HEADER, required = false) String actorId) {
        return engine.initializeCorePolicies(actorId).collectList();
    }

    @PostMapping("/cache/refresh")
    public Mono<ResponseEntity<Void>> refreshCache(
            @RequestHeader(name = ACTOR_HEADER, required = false) String actorId) {
        log.info("Policy cache refresh requested by {}", StringSanitizer.forLog(actorId));
        return engine.refreshCache()
                .then(Mono.fromSupplier(() -> ResponseEntity.noContent().<Void>build()));
    }

    private PageRequest pageRequest(int page, int limit) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        return PageRequest.of(page - 1, limit);
    }

    private <T> PageResult<T> toOneBased(PageResult<T> result) {
        return new PageResult<>(result.items(), result.page() + 1, result.size(), result.total());
    }
}
