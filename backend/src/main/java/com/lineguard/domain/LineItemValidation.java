package com.lineguard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Current state of one line item within a session: input snapshot, match, price check, decision and the
 * re-validation attempt counter. statusHistory holds every status the item passed through, in order.
 */
@Document(collection = "line_item_validations")
@CompoundIndexes({
        @CompoundIndex(name = "session_item", def = "{'sessionId': 1, 'itemIndex': 1}", unique = true),
        @CompoundIndex(name = "canonical_created", def = "{'canonicalItemId': 1, 'createdAt': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LineItemValidation {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Version
    private Long version;
    private String sessionId;
    private int itemIndex;
    private String lineItemId;
    private String itemName;
    private String itemDescription;
    private ItemType itemType;
    private BigDecimal quantity;
    private BigDecimal unitPrice;
    private String currency;
    private String unit;

    private String canonicalItemId;
    private String canonicalName;
    private MatchMethod matchMethod;
    private Double matchConfidence;
    private PriceCheck pricing;
    private Double classificationScore;

    private LineItemStatus status;
    private List<LineItemStatus> statusHistory = new ArrayList<>();
    private ValidationDecision decision;
    private double confidence;
    private List<String> riskFactors = new ArrayList<>();
    private String primaryReason;

    private int revalidationAttempts;
    private String additionalContext;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Moves to next, recording it in statusHistory.
     *
     * @throws IllegalStateException if the lifecycle does not allow current -> next
     */
    public void advanceTo(LineItemStatus next) {
        if (status == null) {
            if (next != LineItemStatus.NEW) {
                throw new IllegalStateException("Line item must start in NEW, got " + next);
            }
        } else if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal line item transition " + status + " -> " + next);
        }
        status = next;
        statusHistory.add(next);
    }

    /**
     * Price check outcome embedded in the line item.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class PriceCheck {
        private PriceValidationMethod method;
        private boolean valid;
        private BigDecimal expectedMin;
        private BigDecimal expectedMax;
        private BigDecimal variancePercent;
        private double confidence;
        private String proposalId;
    }
}
