package com.lineguard.transparency;

import com.lineguard.domain.LineItemStatus;
import com.lineguard.domain.LineItemValidation;
import com.lineguard.domain.MatchMethod;
import com.lineguard.domain.PriceValidationMethod;
import com.lineguard.domain.ValidationDecision;
import com.lineguard.domain.ValidationExplanation;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExplanationGeneratorTest {

    private final ExplanationGenerator generator = new ExplanationGenerator();

    private static LineItemValidation matchedItem() {
        LineItemValidation item = new LineItemValidation();
        item.setId("l1");
        item.setSessionId("s1");
        item.setItemIndex(2);
        item.setItemName("Hex bolt M8");
        item.setUnitPrice(new BigDecimal("0.50"));
        item.setCurrency("USD");
        item.setCanonicalItemId("c1");
        item.setCanonicalName("Hex Bolt M8");
        item.setMatchMethod(MatchMethod.SYNONYM);
        item.setMatchConfidence(0.95);
        LineItemValidation.PriceCheck pricing = new LineItemValidation.PriceCheck();
        pricing.setMethod(PriceValidationMethod.CANONICAL);
        pricing.setValid(true);
        pricing.setExpectedMin(new BigDecimal("0.40"));
        pricing.setExpectedMax(new BigDecimal("0.60"));
        pricing.setVariancePercent(new BigDecimal("0.00"));
        pricing.setConfidence(0.9);
        item.setPricing(pricing);
        item.setStatus(LineItemStatus.ALLOW);
        item.setDecision(ValidationDecision.ALLOW);
        item.setConfidence(0.9);
        return item;
    }

    @Test
    void allowedItemExplainsMatchAndPrice() {
        ValidationExplanation explanation = generator.generate(matchedItem());

        assertThat(explanation.getLineItemValidationId()).isEqualTo("l1");
        assertThat(explanation.getItemIndex()).isEqualTo(2);
        assertThat(explanation.getSummary()).startsWith("'Hex bolt M8' is approved");
        assertThat(explanation.getDetailed())
                .contains("Matched to 'Hex Bolt M8' by synonym with 95% confidence")
                .contains("is within the canonical range 0.4-0.6");
        assertThat(explanation.getTechnical()).contains("decision=ALLOW").contains("price.method=canonical");
    }

    @Test
    void unmatchedItemMentionsIngestionAndRisks() {
        LineItemValidation item = matchedItem();
        item.setCanonicalItemId(null);
        item.setPricing(null);
        item.setDecision(ValidationDecision.NEEDS_REVIEW);
        item.setPrimaryReason("No catalog match");
        item.setRiskFactors(new ArrayList<>(List.of("NO_CANONICAL_MATCH")));

        ValidationExplanation explanation = generator.generate(item);

        assertThat(explanation.getSummary()).isEqualTo("'Hex bolt M8' needs review: No catalog match.");
        assertThat(explanation.getDetailed()).contains("queued for catalog ingestion").contains("NO_CANONICAL_MATCH");
        assertThat(explanation.getTechnical()).contains("price.method=skipped");
    }

    @Test
    void sameItemGivesSameText() {
        LineItemValidation item = matchedItem();
        assertThat(generator.generate(item).getDetailed()).isEqualTo(generator.generate(item).getDetailed());
    }
}
