package com.lineguard.proposal;

import com.lineguard.common.TextNormalizer;
import com.lineguard.domain.AgentRuleRepository;
import com.lineguard.domain.CanonicalItem;
import com.lineguard.domain.CanonicalItemRepository;
import com.lineguard.domain.ItemSynonymRepository;
import com.lineguard.domain.PriceBand;
import com.lineguard.domain.PriceBandRepository;
import com.lineguard.domain.Proposal;
import com.lineguard.domain.TargetEntity;
import com.lineguard.pricing.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Writes the catalog change of an approved proposal. Only ProposalService calls this, after a human approval.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProposalApplier {

    public static final String NOTHING_TO_APPLY = "NOTHING_TO_APPLY";

    private final PriceBandRepository priceBandRepository;
    private final CanonicalItemRepository canonicalItemRepository;
    private final ItemSynonymRepository itemSynonymRepository;
    private final AgentRuleRepository agentRuleRepository;
    private final PricingProperties pricingProperties;

    /**
     * @throws ProposalException NOTHING_TO_APPLY when the proposal carries no usable change
     */
    public void apply(Proposal proposal) {
        Proposal.ProposedChange change = proposal.getProposedChange();
        if (change == null) {
            throw new ProposalException(NOTHING_TO_APPLY, "Proposal " + proposal.getId() + " has no proposed change");
        }
        switch (proposal.getType()) {
            case PRICE_RANGE_ADJUST -> applyBand(proposal, change);
            case NEW_CANONICAL -> applyNewCanonical(proposal, change);
            case REMOVE_SYNONYM -> itemSynonymRepository.deleteById(requireValue(proposal, change.getSynonymId()));
            case RULE_CONSOLIDATION -> applyRuleConsolidation(proposal, change);
        }
        log.info("Applied proposal {} ({} on {} {})", proposal.getId(), proposal.getType(),
                proposal.getTargetEntity(), proposal.getTargetId());
    }

    private void applyBand(Proposal proposal, Proposal.ProposedChange change) {
        if (change.getSuggestedMin() == null || change.getSuggestedMax() == null
                || change.getSuggestedMin().compareTo(change.getSuggestedMax()) > 0) {
            throw new ProposalException(NOTHING_TO_APPLY, "Proposal " + proposal.getId() + " has no valid suggested range");
        }
        String currency = change.getCurrency() != null ? change.getCurrency() : pricingProperties.getDefaultCurrency();
        PriceBand band = proposal.getTargetEntity() == TargetEntity.PRICE_BAND
                ? priceBandRepository.findById(proposal.getTargetId()).orElseGet(PriceBand::new)
                : priceBandRepository.findFirstByCanonicalItemIdAndCurrencyOrderByUpdatedAtDesc(change.getCanonicalItemId(), currency)
                .orElseGet(PriceBand::new);
        Instant now = Instant.now();
        if (band.getId() == null) {
            band.setCanonicalItemId(change.getCanonicalItemId());
            band.setCurrency(currency);
            band.setCreatedAt(now);
        }
        band.setMinPrice(change.getSuggestedMin());
        band.setMaxPrice(change.getSuggestedMax());
        band.setUpdatedAt(now);
        priceBandRepository.save(band);
    }

    private void applyNewCanonical(Proposal proposal, Proposal.ProposedChange change) {
        String name = requireValue(proposal, change.getCanonicalName());
        CanonicalItem item = canonicalItemRepository.findByNormalizedName(TextNormalizer.normalize(name))
                .orElseGet(() -> {
                    CanonicalItem created = new CanonicalItem();
                    created.setName(name);
                    created.setCreatedAt(Instant.now());
                    return canonicalItemRepository.save(created);
                });
        itemSynonymRepository.findById(requireValue(proposal, change.getSynonymId())).ifPresent(synonym -> {
            synonym.setCanonicalItemId(item.getId());
            itemSynonymRepository.save(synonym);
        });
    }

    private void applyRuleConsolidation(Proposal proposal, Proposal.ProposedChange change) {
        String keep = requireValue(proposal, change.getKeepRuleId());
        if (change.getRuleIds() == null) {
            throw new ProposalException(NOTHING_TO_APPLY, "Proposal " + proposal.getId() + " lists no rules");
        }
        agentRuleRepository.findAllById(change.getRuleIds()).forEach(rule -> {
            if (!keep.equals(rule.getId()) && rule.isActive()) {
                rule.setActive(false);
                agentRuleRepository.save(rule);
            }
        });
    }

    private static String requireValue(Proposal proposal, String value) {
        if (value == null || value.isBlank()) {
            throw new ProposalException(NOTHING_TO_APPLY, "Proposal " + proposal.getId() + " is missing a required field");
        }
        return value;
    }
}
