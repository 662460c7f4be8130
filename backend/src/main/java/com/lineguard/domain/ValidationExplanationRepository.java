package com.lineguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ValidationExplanationRepository extends MongoRepository<ValidationExplanation, String> {

    List<ValidationExplanation> findBySessionIdOrderByItemIndexAscVersionAsc(String sessionId);

    Optional<ValidationExplanation> findFirstByLineItemValidationIdOrderByVersionDesc(String lineItemValidationId);
}
