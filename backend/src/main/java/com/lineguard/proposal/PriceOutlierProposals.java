package com.lineguard.proposal;

import com.lineguard.domain.AnomalyClass;
import com.lineguard.domain.PriceValidationMethod;
import com.lineguard.domain.Proposal;
import com.lineguard.domain.ProposalType;
import com.lineguard.domain.TargetEntity;
import com.lineguard.pricing.PriceValidationResult;
import com.lineguard.pricing.PricingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Raises a band adjustment proposal when an invoice price sits far outside a canonical band.
 * The suggested band is the current one stretched to include the observed price.
 */
@Component
@RequiredArgsConstructor
public class PriceOutlierProposals {

    private final ProposalStore proposalStore;
    private final PricingProperties pricingProperties;

    public Optional<Proposal> proposeIfOutlier(String canonicalItemId, BigDecimal unitPrice,
                                               PriceValidationResult result, String sessionId) {
        if (canonicalItemId == null || result.method() != PriceValidationMethod.CANONICAL || result.valid()
                || result.variancePercent().doubleValue() <= pricingProperties.getProposalVariancePercent()) {
            return Optional.empty();
        }
        BigDecimal min = result.expectedRange().min();
        BigDecimal max = result.expectedRange().max();

        Proposal.ProposedChange change = new Proposal.ProposedChange();
        change.setCanonicalItemId(canonicalItemId);
        change.setCurrency(result.currency());
        change.setCurrentMin(min);
        change.setCurrentMax(max);
        change.setSuggestedMin(min.min(unitPrice));
        change.setSuggestedMax(max.max(unitPrice));

        Proposal proposal = new Proposal();
        proposal.setAnomalyClass(AnomalyClass.PRICE_OUTLIER);
        proposal.setType(ProposalType.PRICE_RANGE_ADJUST);
        proposal.setTargetEntity(TargetEntity.CANONICAL_ITEM);
        proposal.setTargetId(canonicalItemId);
        proposal.setProposedChange(change);
        proposal.setSessionId(sessionId);
        proposal.setReason("Observed unit price " + unitPrice.toPlainString() + " " + result.currency()
                + " is " + result.variancePercent().toPlainString() + "% from the band midpoint of ["
                + min.toPlainString() + ", " + max.toPlainString() + "]");
        return Optional.of(proposalStore.proposeIfAbsent(proposal).proposal());
    }
}
