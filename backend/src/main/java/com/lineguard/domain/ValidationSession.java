package com.lineguard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One invoice submission. Owns its agent executions, line item validations and explanations.
 * Never deleted by the pipeline.
 */
@Document(collection = "validation_sessions")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ValidationSession {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String invoiceId;
    @Indexed
    private Instant createdAt;
    private Instant updatedAt;
    private SessionStatus overallStatus;
    private Long executionTimeMs;
    private String serviceLineName;
    private String notes;
    private int lineCount;
    /** Lines that failed in the first run, by itemIndex. */
    private List<FailedLine> failedLines = new ArrayList<>();
    /** Last executionOrder handed out; advanced atomically with $inc. */
    private long executionSequence;
}
