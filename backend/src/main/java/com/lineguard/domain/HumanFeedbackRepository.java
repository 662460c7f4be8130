package com.lineguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface HumanFeedbackRepository extends MongoRepository<HumanFeedback, String> {

    List<HumanFeedback> findByLineItemValidationIdOrderByCreatedAtAsc(String lineItemValidationId);
}
