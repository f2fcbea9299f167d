package com.example.abac.audit;

import com.example.abac.common.util.StringSanitizer;
import com.example.abac.config.AbacProperties;
import com.example.abac.engine.PolicyEvaluation;
import com.example.abac.observability.metrics.AbacMetrics;
import com.example.abac.policy.model.PolicyEffect;
import com.example.abac.policy.store.PolicyStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Records decisions off the request path.
 *
 * <p>Entries go onto a bounded queue drained by a single worker thread, which for each entry writes
 * one JSON line to the {@code ABAC_AUDIT} logger, persists the entry, and then applies the usage
 * counters: every considered policy gets one evaluation, the controlling policy also one allow or
 * deny. A full queue drops the entry. Failures are reported through logs and metrics only.
 */
@Slf4j
@Component
public class DecisionRecorder {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("ABAC_AUDIT");
    private static final long POLL_INTERVAL_MS = 200L;

    private final DecisionLogStore logStore;
    private final PolicyStore policyStore;
    private final ObjectMapper objectMapper;
    private final AbacMetrics metrics;
    private final Duration writeTimeout;
    private final Duration shutdownTimeout;

    private final BlockingQueue<DecisionLogEntry> queue;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Thread worker;

    public DecisionRecorder(DecisionLogStore logStore,
                            PolicyStore policyStore,
                            ObjectMapper objectMapper,
                            AbacMetrics metrics,
                            AbacProperties properties) {
        this.logStore = logStore;
        this.policyStore = policyStore;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.writeTimeout = properties.getAudit().getWriteTimeout();
        this.shutdownTimeout = properties.getAudit().getShutdownTimeout();
        this.queue = new ArrayBlockingQueue<>(Math.max(1, properties.getAudit().getQueueCapacity()));

        metrics.registerAuditQueueDepth(queue::size);

        this.worker = new Thread(this::drainLoop, "abac-decision-recorder");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    /**
     * Enqueues an entry without blocking.
     *
     * @return false if the entry was dropped
     */
    public boolean record(@NonNull DecisionLogEntry entry) {
        if (!running.get()) {
            metrics.recordAuditDropped("shutdown");
            log.error("Decision recorder stopped, dropping decision {}", entry.decisionId());
            return false;
        }
        if (queue.offer(entry)) {
            return true;
        }
        metrics.recordAuditDropped("queue_full");
        log.error("Decision log queue full, dropping decision {}", entry.decisionId());
        return false;
    }

    public int pending() {
        return queue.size();
    }

    @PreDestroy
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            worker.join(shutdownTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        // whatever is still queued here is never written, including entries offered after the worker exited
        List<DecisionLogEntry> unwritten = new ArrayList<>();
        queue.drainTo(unwritten);
        if (worker.isAlive()) {
            worker.interrupt();
        }
        if (!unwritten.isEmpty()) {
            unwritten.forEach(entry -> metrics.recordAuditDropped("shutdown"));
            log.error("Decision recorder stopped after {}, {} entries not written",
                    shutdownTimeout, unwritten.size());
        }
        log.info("Decision recorder stopped");
    }

    private void drainLoop() {
        while (running.get() || !queue.isEmpty()) {
            DecisionLogEntry entry;
            try {
                entry = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Decision recorder interrupted with {} entries pending", queue.size());
                return;
            }
            if (entry != null) {
                process(entry);
            }
        }
    }

    void process(@NonNull DecisionLogEntry entry) {
        writeAuditLine(entry);
        persist(entry);
        applyCounters(entry);
    }

    private void writeAuditLine(DecisionLogEntry entry) {
        try {
            String json = objectMapper.writeValueAsString(toStructuredLog(entry));
            if (entry.error() != null) {
                AUDIT_LOG.error(json);
            } else if (entry.decision() == PolicyEffect.ALLOW) {
                AUDIT_LOG.info(json);
            } else {
                AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize decision {}: {}", entry.decisionId(),
                    StringSanitizer.forLog(e.getMessage()));
            AUDIT_LOG.warn("ABAC {} - user={}, action={}, resource={}/{}, policy={}, reason={}",
                    entry.decision(),
                    StringSanitizer.forLog(entry.userId()),
                    StringSanitizer.forLog(entry.action()),
                    StringSanitizer.forLog(entry.resourceType()),
                    StringSanitizer.forLog(entry.resourceId()),
                    StringSanitizer.forLog(entry.controllingPolicyId()),
                    StringSanitizer.forLog(entry.reason(), 200));
        }
    }

    private void persist(DecisionLogEntry entry) {
        try {
            logStore.save(entry).block(writeTimeout);
            metrics.recordAuditWrite(true);
        } catch (RuntimeException e) {
            metrics.recordAuditWrite(false);
            log.error("Failed to persist decision {}: {}", entry.decisionId(),
                    StringSanitizer.forLog(e.getMessage(), 200));
        }
    }

    private void applyCounters(DecisionLogEntry entry) {
        for (PolicyEvaluation considered : entry.appliedPolicies()) {
            boolean controlling = Objects.equals(considered.policyId(), entry.controllingPolicyId());
            long allows = controlling && entry.decision() == PolicyEffect.ALLOW ? 1 : 0;
            long denies = controlling && entry.decision() == PolicyEffect.DENY ? 1 : 0;
            try {
                policyStore.incrementCounters(considered.policyId(), 1, allows, denies).block(writeTimeout);
                metrics.recordStatisticsUpdate(true);
            } catch (RuntimeException e) {
                metrics.recordStatisticsUpdate(false);
                log.error("Failed to update counters of policy {}: {}", considered.policyId(),
                        StringSanitizer.forLog(e.getMessage(), 200));
            }
        }
    }

    private Map<String, Object> toStructuredLog(DecisionLogEntry entry) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("eventType", "ABAC_DECISION");
        line.put("timestamp", entry.createdAt() != null ? entry.createdAt().toString() : null);
        line.put("decisionId", entry.decisionId());
        line.put("decision", entry.decision());
        line.put("controllingPolicyId", entry.controllingPolicyId());
        line.put("reason", entry.reason());
        line.put("evaluationTimeMs", entry.evaluationTimeMs());
        line.put("policiesConsidered", entry.appliedPolicies().size());
        line.put("userId", entry.userId());
        line.put("userRole", entry.userRole());
        line.put("tenantId", entry.tenantId());
        line.put("action", entry.action());
        line.put("resourceType", entry.resourceType());
        line.put("resourceId", entry.resourceId());
        line.put("ipAddress", entry.ipAddress());
        line.put("endpoint", entry.endpoint());
        line.put("method", entry.method());
        if (entry.error() != null) {
            line.put("error", entry.error());
        }
        return line;
    }
}
