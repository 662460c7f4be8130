package com.lineguard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.index.TextIndexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Vendor catalog price observation written by the scraping adapters. Read-only here.
 */
@Document(collection = "external_price_sources")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ExternalPriceSource {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String canonicalItemId;
    @TextIndexed
    private String itemName;
    private String vendor;
    private BigDecimal lastPrice;
    private String currency;
    private String sourceUrl;
    private Instant createdAt;
}
