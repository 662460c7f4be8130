package com.lineguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface LineItemValidationRepository extends MongoRepository<LineItemValidation, String>, LineItemValidationRepositoryCustom {

    List<LineItemValidation> findBySessionIdOrderByItemIndexAsc(String sessionId);

    Optional<LineItemValidation> findBySessionIdAndItemIndex(String sessionId, int itemIndex);

    List<LineItemValidation> findByCanonicalItemIdAndCreatedAtAfter(String canonicalItemId, Instant since);
}
