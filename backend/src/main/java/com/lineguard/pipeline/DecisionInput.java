package com.lineguard.pipeline;

import com.lineguard.domain.AgentRule;
import com.lineguard.pricing.PriceValidationResult;

import java.math.BigDecimal;

/**
 * Everything a decision depends on. price is null for unmatched items; classification is null when the
 * classification stage did not run; rule is the newest active ITEM-scope rule for the canonical item, if any;
 * preValidation is null when screening did not run (re-validation, or screening disabled).
 */
public record DecisionInput(boolean matched,
                            double matchConfidence,
                            BigDecimal unitPrice,
                            BigDecimal quantity,
                            PriceValidationResult price,
                            ClassificationScore classification,
                            String additionalContext,
                            AgentRule rule,
                            PreValidationResult preValidation) {

    public DecisionInput(boolean matched, double matchConfidence, BigDecimal unitPrice, BigDecimal quantity,
                         PriceValidationResult price, ClassificationScore classification, String additionalContext,
                         AgentRule rule) {
        this(matched, matchConfidence, unitPrice, quantity, price, classification, additionalContext, rule, null);
    }
}
