package com.lineguard.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lineguard.pipeline.PriceCheckOutcome;
import com.lineguard.pricing.ExpectedRange;
import com.lineguard.pricing.PriceValidationResult;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PriceValidationResponse(
        String lineItemId,
        boolean success,
        @JsonProperty("isValid") boolean isValid,
        ValidationResultBody validationResult,
        String errorCode,
        String reason
) {

    public record ValidationResultBody(String method,
                                       ExpectedRange expectedRange,
                                       BigDecimal variancePercent,
                                       double confidence,
                                       String currency,
                                       int sampleCount,
                                       String proposalId) {
    }

    public static PriceValidationResponse of(String lineItemId, PriceValidationResult r) {
        return new PriceValidationResponse(lineItemId, true, r.valid(), body(r), null, null);
    }

    public static PriceValidationResponse of(PriceCheckOutcome outcome) {
        if (!outcome.success()) {
            return new PriceValidationResponse(outcome.lineItemId(), false, false, null, outcome.errorCode(), outcome.reason());
        }
        return of(outcome.lineItemId(), outcome.result());
    }

    private static ValidationResultBody body(PriceValidationResult r) {
        return new ValidationResultBody(r.method().wireName(), r.expectedRange(), r.variancePercent(),
                r.confidence(), r.currency(), r.sampleCount(), r.proposalId());
    }
}
