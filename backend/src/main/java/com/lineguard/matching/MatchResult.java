package com.lineguard.matching;

import com.lineguard.domain.MatchMethod;

/**
 * Outcome of matching one item name. canonicalItemId null means no catalog entry was found.
 */
public record MatchResult(String lineItemId,
                          String canonicalItemId,
                          String canonicalName,
                          double confidence,
                          MatchMethod method) {

    public static MatchResult miss(String lineItemId) {
        return new MatchResult(lineItemId, null, null, 0.0, MatchMethod.NONE);
    }

    static MatchResult of(MatchCandidate candidate) {
        return new MatchResult(null, candidate.canonicalItemId(), candidate.canonicalName(),
                candidate.confidence(), candidate.method());
    }

    public boolean isMatch() {
        return canonicalItemId != null;
    }

    public MatchResult withLineItemId(String id) {
        return new MatchResult(id, canonicalItemId, canonicalName, confidence, method);
    }
}
