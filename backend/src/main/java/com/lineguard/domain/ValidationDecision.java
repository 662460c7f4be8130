package com.lineguard.domain;

/**
 * Per-item decision recorded on a LineItemValidation.
 */
public enum ValidationDecision {
    ALLOW,
    NEEDS_REVIEW,
    REJECT;

    public LineItemStatus toStatus() {
        return switch (this) {
            case ALLOW -> LineItemStatus.ALLOW;
            case NEEDS_REVIEW -> LineItemStatus.NEEDS_REVIEW;
            case REJECT -> LineItemStatus.REJECT;
        };
    }
}
