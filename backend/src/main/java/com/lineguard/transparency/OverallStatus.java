package com.lineguard.transparency;

import com.lineguard.domain.SessionStatus;
import com.lineguard.domain.ValidationDecision;

import java.util.Collection;

/**
 * Rolls line item decisions up to a session status: any REJECT wins, then anything needing review or
 * failed, then ALLOW. A session whose every item failed is ERROR.
 */
public final class OverallStatus {

    private OverallStatus() {
    }

    /**
     * @param decisions decisions of items that completed; failed items are counted separately
     */
    public static SessionStatus of(Collection<ValidationDecision> decisions, int failed) {
        if (decisions.isEmpty()) {
            return failed > 0 ? SessionStatus.ERROR : SessionStatus.PENDING;
        }
        if (decisions.stream().anyMatch(d -> d == ValidationDecision.REJECT)) {
            return SessionStatus.REJECT;
        }
        if (failed > 0 || decisions.stream().anyMatch(d -> d == null || d == ValidationDecision.NEEDS_REVIEW)) {
            return SessionStatus.NEEDS_REVIEW;
        }
        return SessionStatus.ALLOW;
    }
}
