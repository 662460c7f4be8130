package com.lineguard.matching;

import com.lineguard.domain.LineItemStatus;

/**
 * Per-item batch match outcome. A blocked item (bad input) has success=false and no result.
 */
public record MatchOutcome(String lineItemId,
                           boolean success,
                           MatchResult matchResult,
                           LineItemStatus status,
                           String errorCode,
                           String reason) {

    public static MatchOutcome of(MatchResult result) {
        if (result.isMatch()) {
            return new MatchOutcome(result.lineItemId(), true, result, LineItemStatus.MATCHED, null, null);
        }
        return new MatchOutcome(result.lineItemId(), true, result, LineItemStatus.AWAITING_INGEST, null,
                "No catalog entry found; queued for catalog ingestion");
    }

    public static MatchOutcome blocked(String lineItemId, String errorCode, String reason) {
        return new MatchOutcome(lineItemId, false, null, null, errorCode, reason);
    }
}
