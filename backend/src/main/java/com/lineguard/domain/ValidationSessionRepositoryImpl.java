package com.lineguard.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of ValidationSessionRepositoryCustom using MongoTemplate.findAndModify, find and remove.
 */
@Repository
@RequiredArgsConstructor
public class ValidationSessionRepositoryImpl implements ValidationSessionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public long nextExecutionOrder(String sessionId) {
        ValidationSession updated = mongoTemplate.findAndModify(
                new Query(where("_id").is(sessionId)),
                new Update().inc("executionSequence", 1),
                FindAndModifyOptions.options().returnNew(true),
                ValidationSession.class);
        if (updated == null) {
            throw new IllegalStateException("Validation session not found: " + sessionId);
        }
        return updated.getExecutionSequence();
    }

    @Override
    public ValidationSession patchMetadata(String sessionId, String notes, SessionStatus overallStatus, Long executionTimeMs) {
        Update update = new Update().set("updatedAt", Instant.now());
        if (notes != null) {
            update.set("notes", notes);
        }
        if (overallStatus != null) {
            update.set("overallStatus", overallStatus);
        }
        if (executionTimeMs != null) {
            update.set("executionTimeMs", executionTimeMs);
        }
        return mongoTemplate.findAndModify(
                new Query(where("_id").is(sessionId)),
                update,
                FindAndModifyOptions.options().returnNew(true),
                ValidationSession.class);
    }

    @Override
    public ValidationSession complete(String sessionId, SessionStatus overallStatus, long executionTimeMs,
                                      List<FailedLine> failedLines) {
        Update update = new Update()
                .set("updatedAt", Instant.now())
                .set("overallStatus", overallStatus)
                .set("executionTimeMs", executionTimeMs)
                .set("failedLines", failedLines != null ? failedLines : List.of());
        return mongoTemplate.findAndModify(
                new Query(where("_id").is(sessionId)),
                update,
                FindAndModifyOptions.options().returnNew(true),
                ValidationSession.class);
    }

    @Override
    public ValidationHistoryPage findHistory(ValidationHistoryQuery query) {
        List<Criteria> filters = new ArrayList<>();
        if (query.startDate() != null || query.endDate() != null) {
            Criteria created = where("createdAt");
            if (query.startDate() != null) {
                created = created.gte(query.startDate());
            }
            if (query.endDate() != null) {
                created = created.lte(query.endDate());
            }
            filters.add(created);
        }
        if (query.status() != null) {
            filters.add(where("overallStatus").is(query.status()));
        }
        if (query.serviceLine() != null && !query.serviceLine().isBlank()) {
            filters.add(where("serviceLineName").regex(Pattern.quote(query.serviceLine().strip()), "i"));
        }
        if (query.itemName() != null && !query.itemName().isBlank()) {
            List<String> sessionIds = mongoTemplate.findDistinct(
                    new Query(where("itemName").regex(Pattern.quote(query.itemName().strip()), "i")),
                    "sessionId", LineItemValidation.class, String.class);
            filters.add(where("_id").in(sessionIds));
        }
        Query filtered = filters.isEmpty()
                ? new Query()
                : new Query(new Criteria().andOperator(filters.toArray(new Criteria[0])));
        long total = mongoTemplate.count(filtered, ValidationSession.class);

        Sort.Direction direction = query.ascending() ? Sort.Direction.ASC : Sort.Direction.DESC;
        ValidationHistoryQuery.SortField sortBy = query.sortBy() != null ? query.sortBy() : ValidationHistoryQuery.SortField.DATE;
        Query page = Query.of(filtered)
                .with(Sort.by(direction, sortBy.property()).and(Sort.by(direction, "_id")))
                .skip(query.offset())
                .limit(query.limit());
        return new ValidationHistoryPage(mongoTemplate.find(page, ValidationSession.class), total, query.limit(), query.offset());
    }

    @Override
    public long deleteSessionCascade(String sessionId) {
        Query bySession = new Query(where("sessionId").is(sessionId));
        long removed = mongoTemplate.remove(bySession, AgentExecution.class).getDeletedCount();
        removed += mongoTemplate.remove(bySession, ValidationExplanation.class).getDeletedCount();
        removed += mongoTemplate.remove(bySession, LineItemValidation.class).getDeletedCount();
        removed += mongoTemplate.remove(new Query(where("_id").is(sessionId)), ValidationSession.class).getDeletedCount();
        return removed;
    }
}
