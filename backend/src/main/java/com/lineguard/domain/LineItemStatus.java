package com.lineguard.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Line item lifecycle. ALLOW and REJECT are terminal; AWAITING_INGEST and AWAITING_INFO are holding
 * states that need an external action (catalog ingestion, human input).
 */
public enum LineItemStatus {
    NEW,
    AWAITING_MATCH,
    MATCHED,
    AWAITING_INGEST,
    ALLOW,
    NEEDS_REVIEW,
    REJECT,
    AWAITING_INFO;

    public boolean isTerminal() {
        return this == ALLOW || this == REJECT;
    }

    /** Statuses a re-validation or a human decision may start from. */
    public boolean isReviewable() {
        return this == NEEDS_REVIEW || this == AWAITING_INGEST || this == AWAITING_INFO;
    }

    public Set<LineItemStatus> allowedNext() {
        return switch (this) {
            case NEW -> EnumSet.of(AWAITING_MATCH);
            case AWAITING_MATCH -> EnumSet.of(MATCHED, AWAITING_INGEST);
            case MATCHED -> EnumSet.of(ALLOW, REJECT, NEEDS_REVIEW);
            case NEEDS_REVIEW, AWAITING_INFO -> EnumSet.of(ALLOW, REJECT, NEEDS_REVIEW, AWAITING_INFO);
            case AWAITING_INGEST -> EnumSet.of(AWAITING_MATCH, ALLOW, REJECT, NEEDS_REVIEW, AWAITING_INFO);
            case ALLOW, REJECT -> EnumSet.noneOf(LineItemStatus.class);
        };
    }

    public boolean canTransitionTo(LineItemStatus next) {
        return next != null && allowedNext().contains(next);
    }
}
