package com.lineguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PriceBandRepository extends MongoRepository<PriceBand, String> {

    Optional<PriceBand> findFirstByCanonicalItemIdAndCurrencyOrderByUpdatedAtDesc(String canonicalItemId, String currency);

    List<PriceBand> findByCanonicalItemIdIn(Collection<String> canonicalItemIds);
}
