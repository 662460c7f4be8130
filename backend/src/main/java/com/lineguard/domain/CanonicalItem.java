package com.lineguard.domain;

import com.lineguard.common.TextNormalizer;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Catalog entry line items are matched against. Populated by catalog seeding outside this service.
 */
@Document(collection = "canonical_items")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CanonicalItem {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String name;
    /** Normalized name; kept in sync by {@link #setName(String)}. */
    @Indexed(unique = true)
    private String normalizedName;
    private ItemType kind;
    private String defaultUnit;
    /** Usage-derived ranking; higher wins match ties. */
    private long popularity;
    private Instant createdAt;

    public void setName(String name) {
        this.name = name;
        this.normalizedName = TextNormalizer.normalize(name);
    }
}
