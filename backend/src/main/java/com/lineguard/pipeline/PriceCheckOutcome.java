package com.lineguard.pipeline;

import com.lineguard.pricing.PriceValidationResult;

/**
 * Per-item price check result; a failed item carries errorCode and reason instead of a result.
 */
public record PriceCheckOutcome(String lineItemId,
                                boolean success,
                                PriceValidationResult result,
                                String errorCode,
                                String reason) {

    static PriceCheckOutcome of(String lineItemId, PriceValidationResult result) {
        return new PriceCheckOutcome(lineItemId, true, result, null, null);
    }

    static PriceCheckOutcome failed(String lineItemId, String errorCode, String reason) {
        return new PriceCheckOutcome(lineItemId, false, null, errorCode, reason);
    }

    public boolean valid() {
        return success && result.valid();
    }
}
