package com.lineguard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Expected unit-price range of a canonical item in one currency. minPrice &lt;= maxPrice is expected
 * but not enforced here: inverted rows come from bad seed data and are surfaced by the safety scan.
 */
@Document(collection = "price_bands")
@CompoundIndex(name = "item_currency", def = "{'canonicalItemId': 1, 'currency': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PriceBand {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String canonicalItemId;
    private BigDecimal minPrice;
    private BigDecimal maxPrice;
    private String currency;
    private String unit;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isInverted() {
        return minPrice != null && maxPrice != null && minPrice.compareTo(maxPrice) > 0;
    }
}
