package com.lineguard.pricing;

import com.lineguard.domain.PriceValidationMethod;

import java.math.BigDecimal;

/**
 * Outcome of checking one unit price. expectedRange is null for no_reference; confidence is in [0, 1] and
 * variancePercent is never negative.
 */
public record PriceValidationResult(boolean valid,
                                    BigDecimal variancePercent,
                                    double confidence,
                                    PriceValidationMethod method,
                                    ExpectedRange expectedRange,
                                    String currency,
                                    int sampleCount,
                                    String proposalId) {

    public static PriceValidationResult noReference(String currency) {
        return new PriceValidationResult(false, BigDecimal.ZERO.setScale(2), 0.0,
                PriceValidationMethod.NO_REFERENCE, null, currency, 0, null);
    }

    public PriceValidationResult withProposalId(String id) {
        return new PriceValidationResult(valid, variancePercent, confidence, method, expectedRange, currency, sampleCount, id);
    }
}
