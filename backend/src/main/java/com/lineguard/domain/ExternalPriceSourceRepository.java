package com.lineguard.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.math.BigDecimal;
import java.util.List;

public interface ExternalPriceSourceRepository extends MongoRepository<ExternalPriceSource, String>, ExternalPriceSourceRepositoryCustom {

    List<ExternalPriceSource> findByCanonicalItemIdAndCurrencyAndLastPriceGreaterThanOrderByCreatedAtDesc(
            String canonicalItemId, String currency, BigDecimal floor, Pageable pageable);
}
