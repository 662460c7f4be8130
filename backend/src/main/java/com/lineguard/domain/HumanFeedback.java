package com.lineguard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Reviewer decision on a line item, kept for audit.
 */
@Document(collection = "human_feedback")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class HumanFeedback {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String lineItemValidationId;
    private String sessionId;
    private FeedbackAction action;
    private String note;
    private List<String> proposalIds;
    private LineItemStatus previousStatus;
    private LineItemStatus newStatus;
    private Instant createdAt;
}
