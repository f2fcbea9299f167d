package com.example.abac.policy.store;

import com.example.abac.exception.DuplicatePolicyException;
import com.example.abac.exception.PolicyNotFoundException;
import com.example.abac.exception.PolicyVersionConflictException;
import com.example.abac.policy.model.Policy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * MongoDB implementation of PolicyStore, collection {@code abac_policies}.
 *
 * <p>Updates are a single {@code findAndModify} filtered on id and version, so a stale writer
 * matches nothing. Counters change only through {@code $inc}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "abac.store", havingValue = "mongo")
public class MongoPolicyStore implements PolicyStore {

    private static final String ID = "_id";
    private static final Sort EVALUATION_SORT = Sort.by(Sort.Order.desc("priority"), Sort.Order.asc(ID));

    private final ReactiveMongoTemplate mongoTemplate;

    public MongoPolicyStore(ReactiveMongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
        log.info("Using MongoDB policy store");
    }

    @Override
    public Mono<Policy> insert(Policy policy) {
        return mongoTemplate.insert(policy)
                .onErrorMap(DuplicateKeyException.class, e -> new DuplicatePolicyException(policy.policyId()));
    }

    @Override
    public Mono<Policy> findById(String policyId) {
        return mongoTemplate.findById(policyId, Policy.class);
    }

    @Override
    public Flux<Policy> findActive() {
        return mongoTemplate.find(query(where("active").is(true)), Policy.class);
    }

    @Override
    public Flux<Policy> find(PolicyFilter filter, Pageable pageable) {
        Query query = toQuery(filter).with(EVALUATION_SORT);
        if (pageable.isPaged()) {
            query.skip(pageable.getOffset()).limit(pageable.getPageSize());
        }
        return mongoTemplate.find(query, Policy.class);
    }

    @Override
    public Mono<Long> count(PolicyFilter filter) {
        return mongoTemplate.count(toQuery(filter), Policy.class);
    }

    @Override
    public Mono<Policy> update(Policy next, long expectedVersion) {
        Query current = query(where(ID).is(next.policyId()).and("version").is(expectedVersion));
        Update update = new Update()
                .set("name", next.name())
                .set("description", next.description())
                .set("scope", next.scope())
                .set("category", next.category())
                .set("effect", next.effect())
                .set("priority", next.priority())
                .set("subjectAttributes", next.subjectAttributes())
                .set("actionAttributes", next.actionAttributes())
                .set("resourceAttributes", next.resourceAttributes())
                .set("environmentAttributes", next.environmentAttributes())
                .set("active", next.active())
                .set("lastModifiedBy", next.lastModifiedBy())
                .set("updatedAt", next.updatedAt())
                .inc("version", 1);

        return mongoTemplate.findAndModify(current, update, FindAndModifyOptions.options().returnNew(true), Policy.class)
                .switchIfEmpty(Mono.defer(() -> mongoTemplate.exists(query(where(ID).is(next.policyId())), Policy.class)
                        .flatMap(exists -> Mono.error(exists
                                ? new PolicyVersionConflictException(next.policyId(), expectedVersion)
                                : new PolicyNotFoundException(next.policyId())))));
    }

    @Override
    public Mono<Boolean> delete(String policyId) {
        return mongoTemplate.remove(query(where(ID).is(policyId)), Policy.class)
                .map(result -> result.getDeletedCount() > 0);
    }

    @Override
    public Mono<Void> incrementCounters(String policyId, long evaluations, long allows, long denies) {
        Update update = new Update()
                .inc("evaluationCount", evaluations)
                .inc("allowCount", allows)
                .inc("denyCount", denies);
        return mongoTemplate.updateFirst(query(where(ID).is(policyId)), update, Policy.class)
                .doOnNext(result -> {
                    if (result.getMatchedCount() == 0) {
                        log.debug("Counter update skipped, policy {} no longer exists", policyId);
                    }
                })
                .then();
    }

    private Query toQuery(PolicyFilter filter) {
        Query query = new Query();
        if (filter.scope() != null) {
            query.addCriteria(where("scope").is(filter.scope()));
        }
        if (filter.category() != null) {
            query.addCriteria(where("category").is(filter.category()));
        }
        if (filter.active() != null) {
            query.addCriteria(where("active").is(filter.active()));
        }
        return query;
    }
}
