package com.lineguard.domain;

import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of LineItemValidationRepositoryCustom using a group aggregation.
 */
@Repository
@RequiredArgsConstructor
public class LineItemValidationRepositoryImpl implements LineItemValidationRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Map<String, Long> countUsageByCanonicalItemSince(Instant since) {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(where("canonicalItemId").ne(null).and("createdAt").gte(since)),
                Aggregation.group("canonicalItemId").count().as("usage"));
        AggregationResults<Document> results =
                mongoTemplate.aggregate(aggregation, LineItemValidation.class, Document.class);
        Map<String, Long> usage = new HashMap<>();
        for (Document row : results.getMappedResults()) {
            Number count = row.get("usage", Number.class);
            usage.put(row.getString("_id"), count == null ? 0L : count.longValue());
        }
        return usage;
    }
}
