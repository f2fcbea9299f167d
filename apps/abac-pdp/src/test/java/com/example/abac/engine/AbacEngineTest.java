package com.example.abac.engine;

import com.example.abac.audit.AuditLogFilter;
import com.example.abac.audit.DecisionLogEntry;
import com.example.abac.audit.DecisionRecorder;
import com.example.abac.audit.InMemoryDecisionLogStore;
import com.example.abac.config.AbacProperties;
import com.example.abac.exception.DuplicatePolicyException;
import com.example.abac.exception.InvalidContextException;
import com.example.abac.exception.PolicyNotFoundException;
import com.example.abac.exception.PolicyVersionConflictException;
import com.example.abac.exception.ProtectedPolicyException;
import com.example.abac.observability.metrics.AbacMetrics;
import com.example.abac.policy.CorePolicies;
import com.example.abac.policy.model.Policy;
import com.example.abac.policy.model.PolicyEffect;
import com.example.abac.policy.model.PolicyPatch;
import com.example.abac.policy.store.InMemoryPolicyStore;
import com.example.abac.policy.store.PolicyFilter;
import com.example.abac.policy.store.PolicyStore;
import com.example.abac.statistics.StatisticsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static com.example.abac.policy.model.PredicateOperator.EQUALS;
import static com.example.abac.util.ContextTestBuilder.aTenantRequest;
import static com.example.abac.util.PolicyTestBuilder.aDenyPolicy;
import static com.example.abac.util.PolicyTestBuilder.anAllowPolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("AbacEngine")
class AbacEngineTest {

    private static final String ACTOR = "admin-1";

    private SimpleMeterRegistry registry;
    private AbacProperties properties;
    private AbacMetrics metrics;
    private InMemoryDecisionLogStore logStore;
    private DecisionRecorder recorder;

    @BeforeEach
    void setUpShared() {
        registry = new SimpleMeterRegistry();
        properties = new AbacProperties();
        properties.getCache().setLoadTimeout(Duration.ofSeconds(2));
        metrics = new AbacMetrics(registry);
        logStore = new InMemoryDecisionLogStore(properties);
    }

    @AfterEach
    void tearDown() {
        if (recorder != null) {
            recorder.shutdown();
        }
    }

    private AbacEngine engineOver(PolicyStore policyStore) {
        recorder = new DecisionRecorder(logStore, policyStore, new ObjectMapper(), metrics, properties);
        PolicyCache cache = new PolicyCache(policyStore, metrics, properties);
        StatisticsService statistics = new StatisticsService(logStore, policyStore, properties);
        return new AbacEngine(policyStore, cache, new AttributeMatcher(), new DecisionCombiner(),
                recorder, logStore, statistics, metrics, properties);
    }

    private long loggedDecisions() {
        Long count = logStore.count(AuditLogFilter.all()).block();
        return count == null ? 0 : count;
    }

    @Nested
    @DisplayName("evaluate")
    class Evaluate {

        private InMemoryPolicyStore policyStore;
        private AbacEngine engine;

        @BeforeEach
        void setUp() {
            policyStore = new InMemoryPolicyStore();
            engine = engineOver(policyStore);
        }

        @Test
        @DisplayName("should deny cross-tenant access through tenant isolation")
        void shouldDenyCrossTenant() {
            engine.initializeCorePolicies(ACTOR).blockLast();
            engine.createPolicy(anAllowPolicy("WILDCARD_ALLOW").buildDraft(), ACTOR).block();

            EvaluationContext context = aTenantRequest("t1").resource("tenantId", "t2").build();

            StepVerifier.create(engine.evaluate(context))
                    .assertNext(decision -> {
                        assertThat(decision.result()).isEqualTo(PolicyEffect.DENY);
                        assertThat(decision.controllingPolicyId()).isEqualTo(CorePolicies.TENANT_ISOLATION);
                        assertThat(decision.reason())
                                .isEqualTo("Denied by policy TENANT_ISOLATION (Tenant Isolation Policy)");
                        assertThat(decision.appliedPolicies())
                                .extracting(PolicyEvaluation::policyId)
                                .contains(CorePolicies.TENANT_ISOLATION, "WILDCARD_ALLOW");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny when no policy applies")
        void shouldDenyByDefault() {
            StepVerifier.create(engine.evaluate(aTenantRequest("t1").build()))
                    .assertNext(decision -> {
                        assertThat(decision.result()).isEqualTo(PolicyEffect.DENY);
                        assertThat(decision.controllingPolicyId()).isNull();
                        assertThat(decision.reason()).isEqualTo(DecisionCombiner.NO_APPLICABLE_POLICY);
                        assertThat(decision.appliedPolicies()).isEmpty();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should allow through a wildcard unless a higher-priority deny matches")
        void shouldLetDenyOverrideWildcard() {
            engine.createPolicy(anAllowPolicy("WILDCARD_ALLOW").withPriority(100).buildDraft(), ACTOR).block();
            engine.createPolicy(aDenyPolicy("SENSITIVE_BLOCK").withPriority(500)
                    .withResource("sensitive", EQUALS, true).buildDraft(), ACTOR).block();

            StepVerifier.create(engine.evaluate(aTenantRequest("t1").build()))
                    .assertNext(decision -> {
                        assertThat(decision.isAllowed()).isTrue();
                        assertThat(decision.controllingPolicyId()).isEqualTo("WILDCARD_ALLOW");
                    })
                    .verifyComplete();
            StepVerifier.create(engine.evaluate(aTenantRequest("t1").resource("sensitive", true).build()))
                    .assertNext(decision -> {
                        assertThat(decision.isDenied()).isTrue();
                        assertThat(decision.controllingPolicyId()).isEqualTo("SENSITIVE_BLOCK");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should log every decision and eventually count every evaluation")
        void shouldCountEvaluations() {
            engine.createPolicy(anAllowPolicy("WILDCARD_ALLOW").buildDraft(), ACTOR).block();

            for (int i = 0; i < 5; i++) {
                engine.evaluate(aTenantRequest("t1").build()).block();
            }

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
                Policy policy = policyStore.findById("WILDCARD_ALLOW").block();
                assertThat(policy.evaluationCount()).isEqualTo(5);
                assertThat(policy.allowCount()).isEqualTo(5);
                assertThat(loggedDecisions()).isEqualTo(5);
            });
            assertThat(registry.get("abac.decision").tag("result", "allowed").counter().count()).isEqualTo(5.0);
        }

        @Test
        @DisplayName("should reject an incomplete context and still log it as a denial")
        void shouldRejectIncompleteContext() {
            EvaluationContext context = EvaluationContext.of(Map.of("id", "user-1"), null, Map.of(), null);

            StepVerifier.create(engine.evaluate(context))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(InvalidContextException.class);
                        assertThat(((InvalidContextException) error).getMissingParts())
                                .containsExactly("action", "environment");
                    })
                    .verify();

            await().atMost(Duration.ofSeconds(5)).until(() -> loggedDecisions() == 1);
            DecisionLogEntry entry = logStore.find(AuditLogFilter.all(), Pageable.unpaged()).blockFirst();
            assertThat(entry.decision()).isEqualTo(PolicyEffect.DENY);
            assertThat(entry.error()).startsWith("Invalid context");
        }

        @Test
        @DisplayName("should stop applying a deactivated policy")
        void shouldHonourToggle() {
            engine.createPolicy(anAllowPolicy("WILDCARD_ALLOW").buildDraft(), ACTOR).block();
            assertThat(engine.evaluate(aTenantRequest("t1").build()).block().isAllowed()).isTrue();

            Policy toggled = engine.togglePolicy("WILDCARD_ALLOW", ACTOR).block();

            assertThat(toggled.active()).isFalse();
            assertThat(toggled.version()).isEqualTo(2);
            assertThat(engine.evaluate(aTenantRequest("t1").build()).block().isDenied()).isTrue();
        }
    }

    @Nested
    @DisplayName("with an unavailable policy store")
    class UnavailableStore {

        @Test
        @DisplayName("should deny and record the failure")
        void shouldFailClosed() {
            PolicyStore policyStore = mock(PolicyStore.class);
            when(policyStore.findActive()).thenReturn(Flux.error(new IllegalStateException("connection refused")));
            AbacEngine engine = engineOver(policyStore);

            StepVerifier.create(engine.evaluate(aTenantRequest("t1").build()))
                    .assertNext(decision -> {
                        assertThat(decision.isDenied()).isTrue();
                        assertThat(decision.controllingPolicyId()).isNull();
                        assertThat(decision.reason()).isEqualTo(AbacEngine.STORE_UNAVAILABLE_REASON);
                    })
                    .verifyComplete();

            await().atMost(Duration.ofSeconds(5)).until(() -> loggedDecisions() == 1);
            DecisionLogEntry entry = logStore.find(AuditLogFilter.all(), Pageable.unpaged()).blockFirst();
            assertThat(entry.error()).isEqualTo(AbacEngine.STORE_UNAVAILABLE_REASON);
        }
    }

    @Nested
    @DisplayName("administration")
    class Administration {

        private InMemoryPolicyStore policyStore;
        private AbacEngine engine;

        @BeforeEach
        void setUp() {
            policyStore = new InMemoryPolicyStore();
            engine = engineOver(policyStore);
        }

        @Test
        @DisplayName("should reject a duplicate create and leave the stored policy unchanged")
        void shouldRejectDuplicate() {
            engine.createPolicy(anAllowPolicy("ORDERS").withPriority(200).buildDraft(), ACTOR).block();

            StepVerifier.create(engine.createPolicy(aDenyPolicy("ORDERS").withPriority(900).buildDraft(), ACTOR))
                    .expectError(DuplicatePolicyException.class)
                    .verify();

            Policy stored = engine.getPolicy("ORDERS").block();
            assertThat(stored.effect()).isEqualTo(PolicyEffect.ALLOW);
            assertThat(stored.priority()).isEqualTo(200);
        }

        @Test
        @DisplayName("should refuse to delete core policies, present or not")
        void shouldProtectCorePolicies() {
            StepVerifier.create(engine.deletePolicy(CorePolicies.TENANT_ISOLATION))
                    .expectError(ProtectedPolicyException.class)
                    .verify();

            engine.initializeCorePolicy(CorePolicies.TENANT_ISOLATION, ACTOR).block();

            StepVerifier.create(engine.deletePolicy("tenant_isolation"))
                    .expectError(ProtectedPolicyException.class)
                    .verify();
            assertThat(engine.getPolicy(CorePolicies.TENANT_ISOLATION).block()).isNotNull();
        }

        @Test
        @DisplayName("should delete custom policies and report unknown ones")
        void shouldDelete() {
            engine.createPolicy(anAllowPolicy("ORDERS").buildDraft(), ACTOR).block();

            StepVerifier.create(engine.deletePolicy("ORDERS")).verifyComplete();
            StepVerifier.create(engine.deletePolicy("ORDERS"))
                    .expectError(PolicyNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("should require the current version to update")
        void shouldUpdateConditionally() {
            engine.createPolicy(anAllowPolicy("ORDERS").buildDraft(), ACTOR).block();
            PolicyPatch patch = PolicyPatch.builder().priority(300).build();

            Policy updated = engine.updatePolicy("ORDERS", patch, 1, ACTOR).block();

            assertThat(updated.version()).isEqualTo(2);
            assertThat(updated.priority()).isEqualTo(300);
            assertThat(updated.lastModifiedBy()).isEqualTo(ACTOR);
            StepVerifier.create(engine.updatePolicy("ORDERS", patch, 1, ACTOR))
                    .expectError(PolicyVersionConflictException.class)
                    .verify();
        }

        @Test
        @DisplayName("should initialize core policies idempotently")
        void shouldInitializeCorePolicies() {
            engine.initializeCorePolicies("system").blockLast();
            engine.togglePolicy(CorePolicies.READ_ONLY_ENFORCEMENT, ACTOR).block();

            engine.initializeCorePolicies("system").blockLast();

            assertThat(policyStore.count(PolicyFilter.all()).block()).isEqualTo(6L);
            assertThat(engine.getPolicy(CorePolicies.READ_ONLY_ENFORCEMENT).block().active()).isFalse();
        }

        @Test
        @DisplayName("should reject an unknown core template")
        void shouldRejectUnknownTemplate() {
            StepVerifier.create(engine.initializeCorePolicy("NOT_A_CORE_POLICY", ACTOR))
                    .expectError(PolicyNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("should page policies in evaluation order")
        void shouldListPolicies() {
            engine.createPolicy(anAllowPolicy("LOW").withPriority(10).buildDraft(), ACTOR).block();
            engine.createPolicy(anAllowPolicy("HIGH").withPriority(900).buildDraft(), ACTOR).block();
            engine.createPolicy(anAllowPolicy("MID").withPriority(500).buildDraft(), ACTOR).block();

            StepVerifier.create(engine.listPolicies(PolicyFilter.all(), PageRequest.of(0, 2)))
                    .assertNext(page -> {
                        assertThat(page.items()).extracting(Policy::policyId).containsExactly("HIGH", "MID");
                        assertThat(page.total()).isEqualTo(3);
                        assertThat(page.pages()).isEqualTo(2);
                    })
                    .verifyComplete();
        }
    }
}
