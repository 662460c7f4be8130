package com.lineguard.pipeline;

import com.lineguard.domain.AgentRule;
import com.lineguard.domain.AgentRuleRepository;
import com.lineguard.domain.PriceValidationMethod;
import com.lineguard.domain.RuleDecision;
import com.lineguard.domain.RuleScope;
import com.lineguard.domain.ValidationDecision;
import com.lineguard.pricing.PriceValidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Final decision for a line item. {@link #decide(DecisionInput)} is a pure function of its input and the
 * pipeline properties, so the same input always yields the same outcome.
 */
@Component
@RequiredArgsConstructor
public class DecisionPolicy {

    static final double REJECT_CONFIDENCE = 0.95;
    static final double OUT_OF_RANGE_CONFIDENCE = 0.7;
    static final double NO_REFERENCE_CONFIDENCE = 0.8;
    static final double UNMATCHED_CONFIDENCE = 0.5;

    private final PipelineProperties properties;
    private final AgentRuleRepository agentRuleRepository;

    /**
     * Newest active ITEM-scope operator rule for the canonical item.
     */
    public Optional<AgentRule> itemRule(String canonicalItemId) {
        if (canonicalItemId == null) {
            return Optional.empty();
        }
        return agentRuleRepository
                .findByActiveTrueAndScopeTypeAndScopeValueOrderByCreatedAtDesc(RuleScope.ITEM, canonicalItemId)
                .stream()
                .findFirst();
    }

    public DecisionOutcome decide(DecisionInput input) {
        if (input.rule() != null) {
            boolean deny = input.rule().getDecision() == RuleDecision.DENY;
            String reason = input.rule().getReason() != null ? input.rule().getReason() : "operator rule";
            return new DecisionOutcome(deny ? ValidationDecision.REJECT : ValidationDecision.ALLOW, 1.0,
                    List.of(deny ? RiskFactors.RULE_DENY : RiskFactors.RULE_ALLOW),
                    (deny ? "Denied by rule: " : "Allowed by rule: ") + reason);
        }

        PreValidationResult screening = input.preValidation();
        if (screening != null && screening.isRejected()) {
            return new DecisionOutcome(ValidationDecision.REJECT, REJECT_CONFIDENCE,
                    List.of(RiskFactors.PRE_VALIDATION_REJECTED),
                    "Rejected by pre-validation: " + String.join("; ", screening.reasons()));
        }

        List<String> risks = new ArrayList<>();
        ValidationDecision decision;
        double confidence;
        String reason;

        PriceValidationResult price = input.price();
        if (!input.matched()) {
            decision = ValidationDecision.NEEDS_REVIEW;
            confidence = UNMATCHED_CONFIDENCE;
            risks.add(RiskFactors.NO_CANONICAL_MATCH);
            reason = "No catalog match for the item";
        } else if (price == null || price.method() == PriceValidationMethod.NO_REFERENCE) {
            decision = ValidationDecision.NEEDS_REVIEW;
            confidence = NO_REFERENCE_CONFIDENCE;
            risks.add(RiskFactors.NO_PRICE_REFERENCE);
            reason = "No price reference for the item";
        } else if (price.valid()) {
            decision = ValidationDecision.ALLOW;
            confidence = Math.min(input.matchConfidence(), price.confidence());
            reason = "Price within the expected range";
        } else if (price.method() == PriceValidationMethod.CANONICAL && exceedsMax(input.unitPrice(), price)) {
            decision = ValidationDecision.REJECT;
            confidence = REJECT_CONFIDENCE;
            risks.add(RiskFactors.PRICE_EXCEEDS_MAX);
            reason = "Price far above the band maximum";
        } else if (price.method() == PriceValidationMethod.CANONICAL && belowMin(input.unitPrice(), price)) {
            decision = ValidationDecision.REJECT;
            confidence = REJECT_CONFIDENCE;
            risks.add(RiskFactors.PRICE_BELOW_MIN);
            reason = "Price far below the band minimum";
        } else {
            decision = ValidationDecision.NEEDS_REVIEW;
            confidence = OUT_OF_RANGE_CONFIDENCE;
            risks.add(RiskFactors.PRICE_OUT_OF_RANGE);
            reason = "Price outside the expected range";
        }

        if (input.quantity() != null && input.quantity().compareTo(BigDecimal.valueOf(properties.getMaxQuantity())) > 0) {
            risks.add(RiskFactors.QUANTITY_OVER_LIMIT);
            if (decision == ValidationDecision.ALLOW) {
                decision = ValidationDecision.NEEDS_REVIEW;
                confidence = OUT_OF_RANGE_CONFIDENCE;
                reason = "Quantity above " + properties.getMaxQuantity();
            }
        }

        ClassificationScore classification = input.classification();
        if (classification != null) {
            String risk = null;
            if (!classification.available()) {
                risk = RiskFactors.CLASSIFICATION_UNAVAILABLE;
            } else if (classification.score() < properties.getMinClassificationScore()) {
                risk = RiskFactors.LOW_CLASSIFICATION_SCORE;
            }
            if (risk != null) {
                risks.add(risk);
                if (decision == ValidationDecision.ALLOW) {
                    decision = ValidationDecision.NEEDS_REVIEW;
                    confidence = OUT_OF_RANGE_CONFIDENCE;
                    reason = risk.equals(RiskFactors.LOW_CLASSIFICATION_SCORE)
                            ? "Classification score below " + properties.getMinClassificationScore()
                            : "Classification unavailable";
                }
            }
        }

        String context = input.additionalContext();
        if (context != null && !context.isBlank() && decision != ValidationDecision.REJECT) {
            if (risks.size() <= 1) {
                decision = ValidationDecision.ALLOW;
                confidence = Math.max(confidence, properties.getContextApprovalConfidence());
                reason = risks.isEmpty()
                        ? "Approved with reviewer context"
                        : "Reviewer context resolves " + risks.get(0);
            } else {
                reason = reason + "; reviewer context given but " + risks.size() + " risk factors remain";
            }
        }
        return new DecisionOutcome(decision, clamp(confidence), List.copyOf(risks), reason);
    }

    private boolean exceedsMax(BigDecimal unitPrice, PriceValidationResult price) {
        BigDecimal limit = price.expectedRange().max().multiply(BigDecimal.valueOf(properties.getRejectAboveMaxFactor()));
        return unitPrice.compareTo(limit) > 0;
    }

    private boolean belowMin(BigDecimal unitPrice, PriceValidationResult price) {
        BigDecimal limit = price.expectedRange().min().multiply(BigDecimal.valueOf(properties.getRejectBelowMinFactor()));
        return unitPrice.compareTo(limit) < 0;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
