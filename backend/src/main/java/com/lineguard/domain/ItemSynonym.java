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
 * Alternate spelling of a canonical item. confidence weights synonym matches (0..1).
 */
@Document(collection = "item_synonyms")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ItemSynonym {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String canonicalItemId;
    private String synonym;
    @Indexed
    private String normalizedSynonym;
    private double confidence;
    private Instant createdAt;

    public void setSynonym(String synonym) {
        this.synonym = synonym;
        this.normalizedSynonym = TextNormalizer.normalize(synonym);
    }
}
