package com.lineguard.pipeline;

import com.lineguard.domain.FailedLine;
import com.lineguard.domain.LineItemStatus;
import com.lineguard.domain.LineItemValidation;
import com.lineguard.domain.ValidationDecision;

import java.util.List;

/**
 * Outcome for one invoice line. lineId is the stored line item validation id, used by feedback and
 * re-validation; it is null for lines that failed before anything was stored.
 */
public record LineResult(int itemIndex,
                         String lineItemId,
                         String lineId,
                         boolean success,
                         LineItemStatus status,
                         ValidationDecision decision,
                         Double confidence,
                         List<String> riskFactors,
                         String canonicalItemId,
                         String reason,
                         String errorCode,
                         List<String> errors) {

    public static LineResult of(LineItemValidation v) {
        return new LineResult(v.getItemIndex(), v.getLineItemId(), v.getId(), true, v.getStatus(), v.getDecision(),
                v.getDecision() != null ? v.getConfidence() : null, List.copyOf(v.getRiskFactors()),
                v.getCanonicalItemId(), v.getPrimaryReason(), null, List.of());
    }

    static LineResult invalid(int itemIndex, String lineItemId, List<String> errors) {
        return new LineResult(itemIndex, lineItemId, null, false, null, null, null, List.of(), null,
                "Line item failed input validation", PipelineException.INVALID_INPUT, List.copyOf(errors));
    }

    static LineResult failed(int itemIndex, String lineItemId, String errorCode, String reason) {
        return new LineResult(itemIndex, lineItemId, null, false, null, null, null, List.of(), null,
                reason, errorCode, List.of());
    }

    static LineResult failed(FailedLine failure) {
        return new LineResult(failure.getItemIndex(), failure.getLineItemId(), null, false, null, null, null, List.of(),
                null, failure.getReason(), failure.getErrorCode(),
                failure.getErrors() != null ? List.copyOf(failure.getErrors()) : List.of());
    }
}
