package com.lineguard.matching;

import java.util.List;

/**
 * Batch match results in input order plus counts.
 */
public record MatchBatchResult(boolean success, List<MatchOutcome> results, Summary summary) {

    public record Summary(int total, int matched, int missed, int blocked, long durationMs) {
    }

    static MatchBatchResult of(List<MatchOutcome> results, long durationMs) {
        int matched = 0;
        int missed = 0;
        int blocked = 0;
        for (MatchOutcome outcome : results) {
            if (!outcome.success()) {
                blocked++;
            } else if (outcome.matchResult().isMatch()) {
                matched++;
            } else {
                missed++;
            }
        }
        return new MatchBatchResult(blocked == 0, results,
                new Summary(results.size(), matched, missed, blocked, durationMs));
    }
}
