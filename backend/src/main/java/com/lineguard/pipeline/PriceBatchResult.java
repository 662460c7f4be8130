package com.lineguard.pipeline;

import java.util.List;

/**
 * Batch price check. results has the length and order of the request; success is true only when every
 * item was checked. avgConfidence is the mean over items that produced a result.
 */
public record PriceBatchResult(boolean success, List<PriceCheckOutcome> results, Summary summary) {

    public record Summary(int total, int passed, int failed, double avgConfidence) {
    }

    static PriceBatchResult of(List<PriceCheckOutcome> results) {
        int passed = (int) results.stream().filter(PriceCheckOutcome::valid).count();
        double avgConfidence = results.stream()
                .filter(PriceCheckOutcome::success)
                .mapToDouble(o -> o.result().confidence())
                .average()
                .orElse(0.0);
        boolean success = results.stream().allMatch(PriceCheckOutcome::success);
        return new PriceBatchResult(success, results,
                new Summary(results.size(), passed, results.size() - passed, avgConfidence));
    }
}
