package com.lineguard.pipeline;

import java.util.List;

/**
 * Outcome of the rule-based screening that precedes catalog matching. Only REJECTED changes the final
 * decision; APPROVED and NEEDS_REVIEW are kept in the trace for reviewers. blacklistedTerm is set when a
 * blacklisted term caused the rejection.
 */
public record PreValidationResult(Verdict verdict, double score, List<String> reasons, String blacklistedTerm) {

    public enum Verdict {
        APPROVED,
        REJECTED,
        NEEDS_REVIEW
    }

    static PreValidationResult rejected(String reason) {
        return new PreValidationResult(Verdict.REJECTED, PreValidator.REJECT_SCORE, List.of(reason), null);
    }

    static PreValidationResult blacklisted(String term) {
        return new PreValidationResult(Verdict.REJECTED, PreValidator.REJECT_SCORE,
                List.of("Blacklisted term: " + term), term);
    }

    public boolean isRejected() {
        return verdict == Verdict.REJECTED;
    }
}
