package com.lineguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface CanonicalItemRepository extends MongoRepository<CanonicalItem, String> {

    Optional<CanonicalItem> findByNormalizedName(String normalizedName);

    List<CanonicalItem> findAllByOrderByPopularityDesc();
}
