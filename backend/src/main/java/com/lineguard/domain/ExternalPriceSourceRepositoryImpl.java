package com.lineguard.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.TextCriteria;
import org.springframework.data.mongodb.core.query.TextQuery;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of ExternalPriceSourceRepositoryCustom using the text index on itemName.
 */
@Repository
@RequiredArgsConstructor
public class ExternalPriceSourceRepositoryImpl implements ExternalPriceSourceRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<ExternalPriceSource> searchByItemName(String itemName, String currency, int limit) {
        if (itemName == null || itemName.isBlank()) {
            return List.of();
        }
        Query query = TextQuery.queryText(TextCriteria.forDefaultLanguage().matching(itemName))
                .sortByScore()
                .addCriteria(where("currency").is(currency).and("lastPrice").gt(BigDecimal.ZERO))
                .limit(limit);
        return mongoTemplate.find(query, ExternalPriceSource.class);
    }
}
