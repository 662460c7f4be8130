package com.lineguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ItemSynonymRepository extends MongoRepository<ItemSynonym, String> {

    List<ItemSynonym> findByNormalizedSynonym(String normalizedSynonym);

    List<ItemSynonym> findByCanonicalItemId(String canonicalItemId);
}
