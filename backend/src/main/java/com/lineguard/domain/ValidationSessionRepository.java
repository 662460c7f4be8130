package com.lineguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface ValidationSessionRepository extends MongoRepository<ValidationSession, String>, ValidationSessionRepositoryCustom {

    Optional<ValidationSession> findByInvoiceId(String invoiceId);
}
