package com.lineguard.matching;

import com.lineguard.domain.MatchMethod;

/**
 * Canonical item proposed by one strategy, with the popularity used to break confidence ties.
 */
public record MatchCandidate(String canonicalItemId,
                             String canonicalName,
                             double confidence,
                             long popularity,
                             MatchMethod method) {
}
