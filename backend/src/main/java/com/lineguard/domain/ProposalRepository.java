package com.lineguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ProposalRepository extends MongoRepository<Proposal, String> {

    Optional<Proposal> findByDedupKey(String dedupKey);

    List<Proposal> findByStatusOrderByCreatedAtDesc(ProposalStatus status);

    List<Proposal> findAllByOrderByCreatedAtDesc();
}
