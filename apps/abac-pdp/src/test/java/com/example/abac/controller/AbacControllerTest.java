package com.example.abac.controller;

import com.example.abac.common.dto.PageResult;
import com.example.abac.common.exception.GlobalExceptionHandler;
import com.example.abac.engine.AbacEngine;
import com.example.abac.engine.AccessDecision;
import com.example.abac.engine.EvaluationContext;
import com.example.abac.exception.DuplicatePolicyException;
import com.example.abac.exception.InvalidContextException;
import com.example.abac.exception.PolicyNotFoundException;
import com.example.abac.exception.PolicyStoreUnavailableException;
import com.example.abac.exception.PolicyVersionConflictException;
import com.example.abac.exception.ProtectedPolicyException;
import com.example.abac.policy.model.Policy;
import com.example.abac.policy.model.PolicyDraft;
import com.example.abac.policy.model.PolicyEffect;
import com.example.abac.policy.model.PolicyPatch;
import com.example.abac.policy.model.PolicyScope;
import com.example.abac.policy.model.PredicateOperator;
import com.example.abac.policy.store.PolicyFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.example.abac.util.PolicyTestBuilder.anAllowPolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AbacController")
class AbacControllerTest {

    private static final String BASE = "/api/v1/abac";

    @Mock
    private AbacEngine engine;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new AbacController(engine))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static Map<String, Object> createBody() {
        return Map.of(
                "policyId", "ORDERS_READ",
                "name", "Orders read",
                "description", "Lets tenant staff read orders",
                "scope", "TENANT",
                "effect", "ALLOW",
                "priority", 200,
                "subjectAttributes", List.of(Map.of("attribute", "role", "operator", "in",
                        "value", List.of("TenantAdmin", "TenantUser"))));
    }

    @Nested
    @DisplayName("policies")
    class Policies {

        @Test
        @DisplayName("POST should create with 201 and pass the actor header through")
        void shouldCreate() {
            when(engine.createPolicy(any(PolicyDraft.class), eq("admin-1")))
                    .thenReturn(Mono.just(anAllowPolicy("ORDERS_READ").build()));

            client.post().uri(BASE + "/policies")
                    .header(AbacController.ACTOR_HEADER, "admin-1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(createBody())
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.policyId").isEqualTo("ORDERS_READ")
                    .jsonPath("$.version").isEqualTo(1);

            ArgumentCaptor<PolicyDraft> draft = ArgumentCaptor.forClass(PolicyDraft.class);
            verify(engine).createPolicy(draft.capture(), eq("admin-1"));
            assertThat(draft.getValue().scope()).isEqualTo(PolicyScope.TENANT);
            assertThat(draft.getValue().subjectAttributes()).singleElement()
                    .satisfies(p -> assertThat(p.operator()).isEqualTo(PredicateOperator.IN));
        }

        @Test
        @DisplayName("POST should reject a missing name before reaching the engine")
        void shouldValidateBody() {
            Map<String, Object> body = new HashMap<>(createBody());
            body.remove("name");

            client.post().uri(BASE + "/policies")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("VALIDATION_ERROR");

            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("POST should map unknown operators to 400")
        void shouldRejectUnknownOperator() {
            Map<String, Object> body = new HashMap<>(createBody());
            body.put("subjectAttributes", List.of(Map.of("attribute", "role", "operator", "like", "value", "x")));

            client.post().uri(BASE + "/policies")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("INVALID_POLICY");
        }

        @Test
        @DisplayName("POST should map a null list value to 400")
        void shouldRejectNullListValue() {
            Map<String, Object> body = new HashMap<>(createBody());
            body.put("subjectAttributes", List.of(Map.of("attribute", "role", "operator", "in",
                    "value", Arrays.asList("TenantAdmin", null))));

            client.post().uri(BASE + "/policies")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("INVALID_POLICY");

            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("POST should map a null condition entry to 400")
        void shouldRejectNullCondition() {
            Map<String, Object> body = new HashMap<>(createBody());
            body.put("resourceAttributes", Arrays.asList(
                    Map.of("attribute", "tenantId", "operator", "equals", "value", "t1"), null));

            client.post().uri(BASE + "/policies")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("INVALID_POLICY");

            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("POST should map a duplicate id to 409")
        void shouldMapDuplicate() {
            when(engine.createPolicy(any(PolicyDraft.class), any()))
                    .thenReturn(Mono.error(new DuplicatePolicyException("ORDERS_READ")));

            client.post().uri(BASE + "/policies")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(createBody())
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("DUPLICATE_KEY");
        }

        @Test
        @DisplayName("GET should return 404 for an unknown policy")
        void shouldMapNotFound() {
            when(engine.getPolicy("MISSING")).thenReturn(Mono.error(new PolicyNotFoundException("MISSING")));

            client.get().uri(BASE + "/policies/MISSING")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("NOT_FOUND")
                    .jsonPath("$.message").isEqualTo("Policy MISSING not found");
        }

        @Test
        @DisplayName("GET list should translate 1-based pages and normalize filters")
        void shouldListOneBased() {
            when(engine.listPolicies(any(PolicyFilter.class), any(Pageable.class)))
                    .thenReturn(Mono.just(new PageResult<>(List.of(anAllowPolicy("A").build()), 1, 10, 11)));

            client.get().uri(BASE + "/policies?scope=TENANT&category=finance&page=2&limit=10")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.page").isEqualTo(2)
                    .jsonPath("$.total").isEqualTo(11)
                    .jsonPath("$.pages").isEqualTo(2)
                    .jsonPath("$.items[0].policyId").isEqualTo("A");

            ArgumentCaptor<PolicyFilter> filter = ArgumentCaptor.forClass(PolicyFilter.class);
            ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
            verify(engine).listPolicies(filter.capture(), pageable.capture());
            assertThat(filter.getValue()).isEqualTo(new PolicyFilter(PolicyScope.TENANT, "FINANCE", null));
            assertThat(pageable.getValue().getPageNumber()).isEqualTo(1);
            assertThat(pageable.getValue().getPageSize()).isEqualTo(10);
        }

        @Test
        @DisplayName("GET list should reject oversized pages")
        void shouldRejectOversizedPage() {
            client.get().uri(BASE + "/policies?limit=101")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("INVALID_ARGUMENT");
        }

        @Test
        @DisplayName("PUT should require expectedVersion and map conflicts to 409")
        void shouldUpdateWithVersion() {
            client.put().uri(BASE + "/policies/ORDERS_READ")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("priority", 300))
                    .exchange()
                    .expectStatus().isBadRequest();

            when(engine.updatePolicy(eq("ORDERS_READ"), any(PolicyPatch.class), eq(3L), eq("admin-1")))
                    .thenReturn(Mono.error(new PolicyVersionConflictException("ORDERS_READ", 3)));

            client.put().uri(BASE + "/policies/ORDERS_READ")
                    .header(AbacController.ACTOR_HEADER, "admin-1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("priority", 300, "expectedVersion", 3))
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("CONFLICT");
        }

        @Test
        @DisplayName("DELETE should answer 204, or 409 for a core policy")
        void shouldDelete() {
            when(engine.deletePolicy("ORDERS_READ")).thenReturn(Mono.empty());
            when(engine.deletePolicy("TENANT_ISOLATION"))
                    .thenReturn(Mono.error(new ProtectedPolicyException("TENANT_ISOLATION")));

            client.delete().uri(BASE + "/policies/ORDERS_READ")
                    .exchange()
                    .expectStatus().isNoContent();
            client.delete().uri(BASE + "/policies/TENANT_ISOLATION")
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("PROTECTED_POLICY");
        }

        @Test
        @DisplayName("PATCH toggle should return the new state")
        void shouldToggle() {
            Policy toggled = anAllowPolicy("ORDERS_READ").inactive().withVersion(2).build();
            when(engine.togglePolicy("ORDERS_READ", "admin-1")).thenReturn(Mono.just(toggled));

            client.patch().uri(BASE + "/policies/ORDERS_READ/toggle")
                    .header(AbacController.ACTOR_HEADER, "admin-1")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.active").isEqualTo(false)
                    .jsonPath("$.version").isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("evaluate")
    class Evaluate {

        private final Map<String, Object> body = Map.of("context", Map.of(
                "subject", Map.of("id", "user-1", "tenantId", "t1"),
                "action", Map.of("action", "read"),
                "resource", Map.of("tenantId", "t1"),
                "environment", Map.of()));

        @Test
        @DisplayName("should return the decision on both routes")
        void shouldEvaluate() {
            AccessDecision decision = new AccessDecision("d-1", PolicyEffect.ALLOW, "ORDERS_READ",
                    "Allowed by policy ORDERS_READ (Orders read)", List.of(), 1, Instant.parse("2024-06-01T10:00:00Z"));
            when(engine.evaluate(any(EvaluationContext.class))).thenReturn(Mono.just(decision));

            for (String route : List.of("/evaluate", "/test")) {
                client.post().uri(BASE + route)
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .exchange()
                        .expectStatus().isOk()
                        .expectBody()
                        .jsonPath("$.result").isEqualTo("ALLOW")
                        .jsonPath("$.controllingPolicyId").isEqualTo("ORDERS_READ");
            }
        }

        @Test
        @DisplayName("should answer 400 for an incomplete context")
        void shouldRejectIncompleteContext() {
            when(engine.evaluate(any(EvaluationContext.class)))
                    .thenReturn(Mono.error(new InvalidContextException(List.of("environment"))));

            client.post().uri(BASE + "/evaluate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("context", Map.of("subject", Map.of())))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("INVALID_CONTEXT")
                    .jsonPath("$.message").isEqualTo("Invalid context. Missing: environment");
        }
    }

    @Nested
    @DisplayName("operations")
    class Operations {

        @Test
        @DisplayName("cache refresh should answer 204, or 503 when the store is down")
        void shouldRefreshCache() {
            when(engine.refreshCache()).thenReturn(Mono.empty(),
                    Mono.error(new PolicyStoreUnavailableException("Policy store unavailable", new IllegalStateException())));

            client.post().uri(BASE + "/cache/refresh").exchange().expectStatus().isNoContent();
            client.post().uri(BASE + "/cache/refresh").exchange().expectStatus().isEqualTo(503);
        }

        @Test
        @DisplayName("statistics should default to a 24 hour window")
        void shouldDefaultTimeRange() {
            when(engine.getStatistics(24)).thenReturn(Mono.error(new IllegalArgumentException("stop here")));

            client.get().uri(BASE + "/statistics")
                    .exchange()
                    .expectStatus().isBadRequest();

            verify(engine).getStatistics(24);
        }

        @Test
        @DisplayName("core policy initialization should use the actor header")
        void shouldInitializeCorePolicy() {
            when(engine.initializeCorePolicy(anyString(), eq("ops-1")))
                    .thenReturn(Mono.just(anAllowPolicy("TENANT_ISOLATION").build()));

            client.post().uri(BASE + "/core-policies/TENANT_ISOLATION/initialize")
                    .header(AbacController.ACTOR_HEADER, "ops-1")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.policyId").isEqualTo("TENANT_ISOLATION");
        }

        @Test
        @DisplayName("audit log listing should default to 50 per page")
        void shouldListAuditLogs() {
            when(engine.listAuditLogs(any(), any(Pageable.class)))
                    .thenReturn(Mono.just(new PageResult<>(List.of(), 0, 50, 0)));

            client.get().uri(BASE + "/audit-logs?decision=DENY&policyId=tenant_isolation")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.page").isEqualTo(1)
                    .jsonPath("$.size").isEqualTo(50);

            ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
            verify(engine).listAuditLogs(any(), pageable.capture());
            assertThat(pageable.getValue().getPageSize()).isEqualTo(50);
        }
    }
}
