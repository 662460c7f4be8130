package com.lineguard.pipeline;

import com.lineguard.domain.SessionStatus;
import com.lineguard.domain.ValidationDecision;

import java.util.List;

/**
 * Result of one invoice validation. replayed is true when the invoice had already been validated and the
 * stored outcome was returned without running the pipeline again.
 */
public record InvoiceValidationResult(String sessionId,
                                      String invoiceId,
                                      boolean success,
                                      SessionStatus overallStatus,
                                      Long executionTimeMs,
                                      List<LineResult> lines,
                                      Summary summary,
                                      boolean replayed) {

    public record Summary(int total, int allow, int needsReview, int reject, int failed) {

        static Summary of(List<LineResult> lines) {
            int allow = 0;
            int review = 0;
            int reject = 0;
            int failed = 0;
            for (LineResult line : lines) {
                if (!line.success()) {
                    failed++;
                } else if (line.decision() == ValidationDecision.ALLOW) {
                    allow++;
                } else if (line.decision() == ValidationDecision.REJECT) {
                    reject++;
                } else {
                    review++;
                }
            }
            return new Summary(lines.size(), allow, review, reject, failed);
        }
    }
}
