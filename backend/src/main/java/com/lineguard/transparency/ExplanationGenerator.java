package com.lineguard.transparency;

import com.lineguard.domain.LineItemValidation;
import com.lineguard.domain.MatchMethod;
import com.lineguard.domain.ValidationExplanation;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Template explanations at three levels: summary for reviewers, detailed for analysts, technical for
 * engineers. Built only from what the line item recorded, so regenerating for an unchanged item gives
 * the same text.
 */
@Component
public class ExplanationGenerator {

    public ValidationExplanation generate(LineItemValidation item) {
        ValidationExplanation explanation = new ValidationExplanation();
        explanation.setSessionId(item.getSessionId());
        explanation.setLineItemValidationId(item.getId());
        explanation.setItemIndex(item.getItemIndex());
        explanation.setDecision(item.getDecision());
        explanation.setSummary(summary(item));
        explanation.setDetailed(detailed(item));
        explanation.setTechnical(technical(item));
        return explanation;
    }

    String summary(LineItemValidation item) {
        String name = item.getItemName();
        return switch (item.getDecision()) {
            case ALLOW -> "'" + name + "' is approved: " + reasonOr(item, "it matches the catalog and its price is in the expected range") + ".";
            case REJECT -> "'" + name + "' is rejected: " + reasonOr(item, "it failed validation") + ".";
            case NEEDS_REVIEW -> "'" + name + "' needs review: " + reasonOr(item, "it could not be approved automatically") + ".";
        };
    }

    String detailed(LineItemValidation item) {
        StringBuilder sb = new StringBuilder();
        if (item.getCanonicalItemId() == null) {
            sb.append("No catalog entry matched this item; it is queued for catalog ingestion. ");
        } else {
            sb.append("Matched to '").append(item.getCanonicalName()).append("' by ")
                    .append(describe(item.getMatchMethod())).append(" with ")
                    .append(percent(item.getMatchConfidence())).append(" confidence. ");
        }
        LineItemValidation.PriceCheck pricing = item.getPricing();
        if (pricing != null) {
            if (pricing.getExpectedMin() == null) {
                sb.append("No price reference was available for ").append(plain(item.getUnitPrice())).append(' ')
                        .append(item.getCurrency()).append(". ");
            } else {
                sb.append("Unit price ").append(plain(item.getUnitPrice())).append(' ').append(item.getCurrency())
                        .append(pricing.isValid() ? " is within " : " is outside ")
                        .append("the ").append(pricing.getMethod().wireName()).append(" range ")
                        .append(plain(pricing.getExpectedMin())).append("-").append(plain(pricing.getExpectedMax()))
                        .append(" (").append(plain(pricing.getVariancePercent())).append("% from midpoint). ");
            }
        }
        List<String> risks = item.getRiskFactors();
        if (risks != null && !risks.isEmpty()) {
            sb.append("Risk factors: ").append(String.join(", ", risks)).append(". ");
        }
        if (item.getAdditionalContext() != null && !item.getAdditionalContext().isBlank()) {
            sb.append("Reviewer context was considered: \"").append(item.getAdditionalContext().strip()).append("\".");
        }
        return sb.toString().strip();
    }

    String technical(LineItemValidation item) {
        LineItemValidation.PriceCheck pricing = item.getPricing();
        return String.format(Locale.ROOT,
                "decision=%s confidence=%.2f status=%s match.method=%s match.confidence=%s canonicalItemId=%s "
                        + "price.method=%s price.valid=%s price.variancePercent=%s price.confidence=%s "
                        + "classification.score=%s riskFactors=%s revalidationAttempts=%d",
                item.getDecision(), item.getConfidence(), item.getStatus(), item.getMatchMethod(),
                item.getMatchConfidence(), item.getCanonicalItemId(),
                pricing != null ? pricing.getMethod().wireName() : "skipped",
                pricing != null ? pricing.isValid() : null,
                pricing != null ? plain(pricing.getVariancePercent()) : null,
                pricing != null ? pricing.getConfidence() : null,
                item.getClassificationScore(), item.getRiskFactors(), item.getRevalidationAttempts());
    }

    private static String reasonOr(LineItemValidation item, String fallback) {
        String reason = item.getPrimaryReason();
        return reason == null || reason.isBlank() ? fallback : reason;
    }

    private static String describe(MatchMethod method) {
        if (method == null) {
            return "unknown method";
        }
        return switch (method) {
            case EXACT -> "exact name";
            case SYNONYM -> "synonym";
            case FUZZY -> "fuzzy name similarity";
            case NONE -> "no match";
        };
    }

    private static String percent(Double value) {
        return value == null ? "unknown" : Math.round(value * 100) + "%";
    }

    private static String plain(BigDecimal value) {
        return value == null ? "?" : value.stripTrailingZeros().toPlainString();
    }
}
