package com.example.abac.policy.store;

import com.example.abac.exception.DuplicatePolicyException;
import com.example.abac.exception.PolicyNotFoundException;
import com.example.abac.exception.PolicyVersionConflictException;
import com.example.abac.policy.model.Policy;
import com.example.abac.policy.model.PolicyScope;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.UpdateDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static com.example.abac.util.PolicyTestBuilder.anAllowPolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MongoPolicyStore")
class MongoPolicyStoreTest {

    @Mock
    private ReactiveMongoTemplate mongoTemplate;

    private MongoPolicyStore store;

    @BeforeEach
    void setUp() {
        store = new MongoPolicyStore(mongoTemplate);
    }

    @Test
    @DisplayName("insert should translate a duplicate key into DuplicatePolicyException")
    void shouldMapDuplicateKey() {
        Policy policy = anAllowPolicy("ORDERS").build();
        when(mongoTemplate.insert(policy)).thenReturn(Mono.error(new DuplicateKeyException("E11000")));

        StepVerifier.create(store.insert(policy))
                .expectError(DuplicatePolicyException.class)
                .verify();
    }

    @Test
    @DisplayName("find should sort by priority then id and apply paging and filters")
    void shouldBuildListingQuery() {
        when(mongoTemplate.find(any(Query.class), eq(Policy.class))).thenReturn(Flux.empty());

        store.find(new PolicyFilter(PolicyScope.TENANT, "FINANCE", true), PageRequest.of(2, 10)).blockLast();

        ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(captor.capture(), eq(Policy.class));
        Query query = captor.getValue();
        assertThat(query.getQueryObject())
                .containsEntry("scope", PolicyScope.TENANT)
                .containsEntry("category", "FINANCE")
                .containsEntry("active", true);
        assertThat(query.getSortObject()).isEqualTo(new Document("priority", -1).append("_id", 1));
        assertThat(query.getSkip()).isEqualTo(20);
        assertThat(query.getLimit()).isEqualTo(10);
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("should match on id and expected version and increment the version")
        void shouldBeConditionalOnVersion() {
            Policy next = anAllowPolicy("ORDERS").build();
            Policy stored = next.toBuilder().version(4).build();
            when(mongoTemplate.findAndModify(any(Query.class), any(UpdateDefinition.class),
                    any(FindAndModifyOptions.class), eq(Policy.class))).thenReturn(Mono.just(stored));

            StepVerifier.create(store.update(next, 3))
                    .expectNext(stored)
                    .verifyComplete();

            ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
            ArgumentCaptor<UpdateDefinition> update = ArgumentCaptor.forClass(UpdateDefinition.class);
            verify(mongoTemplate).findAndModify(query.capture(), update.capture(),
                    any(FindAndModifyOptions.class), eq(Policy.class));
            assertThat(query.getValue().getQueryObject())
                    .containsEntry("_id", "ORDERS")
                    .containsEntry("version", 3L);
            Document updateObject = update.getValue().getUpdateObject();
            assertThat(updateObject.get("$inc", Document.class)).containsEntry("version", 1);
            assertThat(updateObject.get("$set", Document.class))
                    .doesNotContainKeys("evaluationCount", "allowCount", "denyCount", "createdBy", "createdAt");
        }

        @Test
        @DisplayName("should report a conflict when the policy exists at another version")
        void shouldReportConflict() {
            when(mongoTemplate.findAndModify(any(Query.class), any(UpdateDefinition.class),
                    any(FindAndModifyOptions.class), eq(Policy.class))).thenReturn(Mono.empty());
            when(mongoTemplate.exists(any(Query.class), eq(Policy.class))).thenReturn(Mono.just(true));

            StepVerifier.create(store.update(anAllowPolicy("ORDERS").build(), 1))
                    .expectError(PolicyVersionConflictException.class)
                    .verify();
        }

        @Test
        @DisplayName("should report not found when the policy is gone")
        void shouldReportNotFound() {
            when(mongoTemplate.findAndModify(any(Query.class), any(UpdateDefinition.class),
                    any(FindAndModifyOptions.class), eq(Policy.class))).thenReturn(Mono.empty());
            when(mongoTemplate.exists(any(Query.class), eq(Policy.class))).thenReturn(Mono.just(false));

            StepVerifier.create(store.update(anAllowPolicy("ORDERS").build(), 1))
                    .expectError(PolicyNotFoundException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("delete should map the deleted count")
    void shouldMapDeletedCount() {
        when(mongoTemplate.remove(any(Query.class), eq(Policy.class)))
                .thenReturn(Mono.just(DeleteResult.acknowledged(1)), Mono.just(DeleteResult.acknowledged(0)));

        StepVerifier.create(store.delete("ORDERS")).expectNext(true).verifyComplete();
        StepVerifier.create(store.delete("ORDERS")).expectNext(false).verifyComplete();
    }

    @Test
    @DisplayName("incrementCounters should use $inc only")
    void shouldIncrementAtomically() {
        when(mongoTemplate.updateFirst(any(Query.class), any(UpdateDefinition.class), eq(Policy.class)))
                .thenReturn(Mono.just(UpdateResult.acknowledged(1, 1L, null)));

        StepVerifier.create(store.incrementCounters("ORDERS", 3, 2, 1)).verifyComplete();

        ArgumentCaptor<UpdateDefinition> update = ArgumentCaptor.forClass(UpdateDefinition.class);
        verify(mongoTemplate).updateFirst(any(Query.class), update.capture(), eq(Policy.class));
        Document updateObject = update.getValue().getUpdateObject();
        assertThat(updateObject.keySet()).containsExactly("$inc");
        assertThat(updateObject.get("$inc", Document.class))
                .containsEntry("evaluationCount", 3L)
                .containsEntry("allowCount", 2L)
                .containsEntry("denyCount", 1L);
    }
}
