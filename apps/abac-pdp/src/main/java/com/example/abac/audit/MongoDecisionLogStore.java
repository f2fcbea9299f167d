package com.example.abac.audit;

import com.example.abac.policy.model.PolicyEffect;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

import static org.springframework.data.mongodb.core.aggregation.Aggregation.group;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.match;
import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoDB implementation of DecisionLogStore, collection {@code abac_decision_logs}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "abac.store", havingValue = "mongo")
public class MongoDecisionLogStore implements DecisionLogStore {

    private static final String CREATED_AT = "createdAt";
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, CREATED_AT);

    private final ReactiveMongoTemplate mongoTemplate;

    public MongoDecisionLogStore(ReactiveMongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
        log.info("Using MongoDB decision log store");
    }

    @Override
    public Mono<DecisionLogEntry> save(DecisionLogEntry entry) {
        return mongoTemplate.insert(entry);
    }

    @Override
    public Flux<DecisionLogEntry> find(AuditLogFilter filter, Pageable pageable) {
        Query query = toQuery(filter).with(NEWEST_FIRST);
        if (pageable.isPaged()) {
            query.skip(pageable.getOffset()).limit(pageable.getPageSize());
        }
        return mongoTemplate.find(query, DecisionLogEntry.class);
    }

    @Override
    public Mono<Long> count(AuditLogFilter filter) {
        return mongoTemplate.count(toQuery(filter), DecisionLogEntry.class);
    }

    @Override
    public Flux<DecisionSummary> summarize(Instant since) {
        Aggregation aggregation = Aggregation.newAggregation(
                match(where(CREATED_AT).gte(since)),
                group("decision")
                        .count().as("count")
                        .avg("evaluationTimeMs").as("averageEvaluationTimeMs"));

        return mongoTemplate.aggregate(aggregation, DecisionLogEntry.class, Document.class)
                .map(this::toSummary);
    }

    @Override
    public Flux<DecisionLogEntry> recentDenials(Instant since, int limit) {
        Query query = new Query(where("decision").is(PolicyEffect.DENY).and(CREATED_AT).gte(since))
                .with(NEWEST_FIRST)
                .limit(Math.max(0, limit));
        return mongoTemplate.find(query, DecisionLogEntry.class);
    }

    private DecisionSummary toSummary(Document document) {
        Number count = document.get("count", Number.class);
        Number average = document.get("averageEvaluationTimeMs", Number.class);
        return new DecisionSummary(
                PolicyEffect.valueOf(document.getString("_id")),
                count == null ? 0L : count.longValue(),
                average == null ? 0.0 : average.doubleValue());
    }

    private Query toQuery(AuditLogFilter filter) {
        Query query = new Query();
        if (filter.userId() != null) {
            query.addCriteria(where("userId").is(filter.userId()));
        }
        if (filter.decision() != null) {
            query.addCriteria(where("decision").is(filter.decision()));
        }
        if (filter.resourceType() != null) {
            query.addCriteria(where("resourceType").is(filter.resourceType()));
        }
        if (filter.action() != null) {
            query.addCriteria(where("action").is(filter.action()));
        }
        if (filter.policyId() != null) {
            query.addCriteria(where("appliedPolicies.policyId").is(filter.policyId()));
        }
        if (filter.from() != null || filter.to() != null) {
            Criteria createdAt = where(CREATED_AT);
            if (filter.from() != null) {
                createdAt = createdAt.gte(filter.from());
            }
            if (filter.to() != null) {
                createdAt = createdAt.lt(filter.to());
            }
            query.addCriteria(createdAt);
        }
        return query;
    }
}
