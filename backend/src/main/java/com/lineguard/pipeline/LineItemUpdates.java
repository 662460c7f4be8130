package com.lineguard.pipeline;

import com.lineguard.domain.LineItemValidation;
import com.lineguard.pricing.PriceValidationResult;
import com.lineguard.transparency.Snapshots;

import java.util.ArrayList;
import java.util.Map;

/**
 * Copies stage outcomes onto the stored line item and renders them as trace snapshots.
 */
final class LineItemUpdates {

    private LineItemUpdates() {
    }

    static void applyPrice(LineItemValidation v, PriceValidationResult result) {
        LineItemValidation.PriceCheck check = new LineItemValidation.PriceCheck();
        check.setMethod(result.method());
        check.setValid(result.valid());
        if (result.expectedRange() != null) {
            check.setExpectedMin(result.expectedRange().min());
            check.setExpectedMax(result.expectedRange().max());
        }
        check.setVariancePercent(result.variancePercent());
        check.setConfidence(result.confidence());
        check.setProposalId(result.proposalId());
        v.setPricing(check);
        v.setCurrency(result.currency());
    }

    static void applyDecision(LineItemValidation v, DecisionOutcome outcome) {
        v.setDecision(outcome.decision());
        v.setConfidence(outcome.confidence());
        v.setRiskFactors(new ArrayList<>(outcome.riskFactors()));
        v.setPrimaryReason(outcome.primaryReason());
    }

    static Map<String, Object> priceSnapshot(PriceValidationResult r) {
        return Snapshots.of(
                "method", r.method().wireName(),
                "valid", r.valid(),
                "variancePercent", r.variancePercent(),
                "expectedMin", r.expectedRange() != null ? r.expectedRange().min() : null,
                "expectedMax", r.expectedRange() != null ? r.expectedRange().max() : null,
                "currency", r.currency(),
                "sampleCount", r.sampleCount(),
                "proposalId", r.proposalId());
    }

    static Map<String, Object> decisionSnapshot(DecisionOutcome o) {
        return Snapshots.of(
                "decision", o.decision(),
                "confidence", o.confidence(),
                "riskFactors", o.riskFactors(),
                "primaryReason", o.primaryReason());
    }

    static Map<String, Object> preValidationSnapshot(PreValidationResult r) {
        return Snapshots.of(
                "verdict", r.verdict(),
                "score", r.score(),
                "reasons", r.reasons(),
                "blacklistedTerm", r.blacklistedTerm());
    }

    static Map<String, Object> decisionInputSnapshot(LineItemValidation v, DecisionInput input) {
        return Snapshots.of(
                "matched", input.matched(),
                "matchConfidence", input.matchConfidence(),
                "unitPrice", input.unitPrice(),
                "quantity", input.quantity(),
                "priceMethod", input.price() != null ? input.price().method().wireName() : null,
                "priceValid", input.price() != null ? input.price().valid() : null,
                "classificationScore", input.classification() != null ? input.classification().score() : null,
                "additionalContext", input.additionalContext(),
                "ruleId", input.rule() != null ? input.rule().getId() : null,
                "preValidation", input.preValidation() != null ? input.preValidation().verdict() : null,
                "attempt", v.getRevalidationAttempts());
    }
}
