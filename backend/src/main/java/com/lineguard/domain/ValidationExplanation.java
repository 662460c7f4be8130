package com.lineguard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Three-level explanation of one decision. A re-validation appends a new version; older versions stay.
 */
@Document(collection = "validation_explanations")
@CompoundIndex(name = "line_version", def = "{'lineItemValidationId': 1, 'version': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ValidationExplanation {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String sessionId;
    private String lineItemValidationId;
    private int itemIndex;
    private int version;
    private ValidationDecision decision;
    private String summary;
    private String detailed;
    private String technical;
    private Instant generatedAt;
}
