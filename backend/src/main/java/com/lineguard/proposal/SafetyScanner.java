package com.lineguard.proposal;

import com.lineguard.common.PriceStatistics;
import com.lineguard.domain.AgentRule;
import com.lineguard.domain.AgentRuleRepository;
import com.lineguard.domain.AnomalyClass;
import com.lineguard.domain.CanonicalItem;
import com.lineguard.domain.CanonicalItemRepository;
import com.lineguard.domain.ItemSynonym;
import com.lineguard.domain.ItemSynonymRepository;
import com.lineguard.domain.LineItemValidation;
import com.lineguard.domain.LineItemValidationRepository;
import com.lineguard.domain.PriceBand;
import com.lineguard.domain.PriceBandRepository;
import com.lineguard.domain.Proposal;
import com.lineguard.domain.ProposalType;
import com.lineguard.domain.RuleDecision;
import com.lineguard.domain.TargetEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only scan of catalog, band and rule data. Each detected anomaly becomes one proposal through
 * {@link ProposalStore}; nothing here writes catalog data. A failure in one detector is reported in
 * errors and the other detectors still run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SafetyScanner {

    private static final BigDecimal HALF = new BigDecimal("0.5");

    private final SafetyScanProperties properties;
    private final PriceBandRepository priceBandRepository;
    private final CanonicalItemRepository canonicalItemRepository;
    private final ItemSynonymRepository itemSynonymRepository;
    private final AgentRuleRepository agentRuleRepository;
    private final LineItemValidationRepository lineItemValidationRepository;
    private final ProposalStore proposalStore;

    /**
     * @throws SafetyScanDisabledException when lineguard.safety-scan.enabled is false
     */
    public SafetyScanReport scan() {
        if (!properties.isEnabled()) {
            throw new SafetyScanDisabledException();
        }
        Instant since = Instant.now().minus(Duration.ofDays(properties.getUsageWindowDays()));
        ScanState state = new ScanState();

        Map<String, Long> usage = Map.of();
        try {
            usage = lineItemValidationRepository.countUsageByCanonicalItemSince(since);
        } catch (DataAccessException e) {
            state.error("usage", e);
        }

        List<PriceBand> bands = null;
        try {
            bands = priceBandRepository.findAll();
        } catch (DataAccessException e) {
            state.error("price bands", e);
        }
        if (bands != null) {
            try {
                state.bandsFixed = scanBandAnomalies(bands, usage, since, state);
            } catch (DataAccessException e) {
                state.error("band anomalies", e);
            }
            try {
                state.bandsMissing = scanMissingBands(bands, usage, since, state);
            } catch (DataAccessException e) {
                state.error("missing bands", e);
            }
        } else {
            // without the band list every used item would look band-less
            state.errors.add("band anomalies: skipped, price bands unavailable");
            state.errors.add("missing bands: skipped, price bands unavailable");
        }
        try {
            state.orphans = scanOrphanSynonyms(state);
        } catch (DataAccessException e) {
            state.error("orphan synonyms", e);
        }
        try {
            state.conflicts = scanConflictingRules(state);
        } catch (DataAccessException e) {
            state.error("conflicting rules", e);
        }

        log.info("Safety scan: {} band anomalies, {} missing bands, {} orphan synonyms, {} rule conflicts; {} new proposals, {} errors",
                state.bandsFixed, state.bandsMissing, state.orphans, state.conflicts, state.created, state.errors.size());
        return new SafetyScanReport(
                new SafetyScanReport.Issues(state.bandsFixed, state.bandsMissing, state.orphans, state.conflicts),
                List.copyOf(state.warnings), List.copyOf(state.errors), state.created, Instant.now());
    }

    private int scanBandAnomalies(List<PriceBand> bands, Map<String, Long> usage, Instant since, ScanState state) {
        int detected = 0;
        for (PriceBand band : bands) {
            if (band.getMinPrice() == null || band.getMaxPrice() == null) {
                continue;
            }
            boolean inverted = band.isInverted();
            long used = usage.getOrDefault(band.getCanonicalItemId(), 0L);
            boolean zeroMinWithUsage = band.getMinPrice().signum() == 0 && used > 0;
            if (!inverted && !zeroMinWithUsage) {
                continue;
            }
            detected++;
            List<BigDecimal> prices = recentPrices(band.getCanonicalItemId(), band.getCurrency(), since);
            BigDecimal suggestedMin;
            BigDecimal suggestedMax;
            if (prices.size() >= 3) {
                suggestedMin = PriceStatistics.percentile(prices, 0.05);
                suggestedMax = PriceStatistics.percentile(prices, 0.95);
            } else if (inverted) {
                suggestedMin = band.getMaxPrice();
                suggestedMax = band.getMinPrice();
            } else {
                suggestedMin = band.getMaxPrice().multiply(HALF);
                suggestedMax = band.getMaxPrice();
            }
            Proposal.ProposedChange change = new Proposal.ProposedChange();
            change.setCanonicalItemId(band.getCanonicalItemId());
            change.setCurrency(band.getCurrency());
            change.setCurrentMin(band.getMinPrice());
            change.setCurrentMax(band.getMaxPrice());
            change.setSuggestedMin(suggestedMin);
            change.setSuggestedMax(suggestedMax);
            change.setUsageCount(used);
            String reason = inverted
                    ? "Price band min " + band.getMinPrice().toPlainString() + " is above max " + band.getMaxPrice().toPlainString()
                    : "Price band min is 0 while the item was used " + used + " times in the last " + properties.getUsageWindowDays() + " days";
            propose(state, AnomalyClass.BAND_ANOMALY, ProposalType.PRICE_RANGE_ADJUST, TargetEntity.PRICE_BAND, band.getId(), change, reason);
        }
        return detected;
    }

    private int scanMissingBands(List<PriceBand> bands, Map<String, Long> usage, Instant since, ScanState state) {
        Set<String> banded = bands.stream().map(PriceBand::getCanonicalItemId).filter(Objects::nonNull).collect(Collectors.toSet());
        List<String> candidates = usage.entrySet().stream()
                .filter(e -> e.getValue() >= properties.getMissingBandUsageThreshold())
                .map(Map.Entry::getKey)
                .filter(id -> !banded.contains(id))
                .sorted()
                .toList();
        if (candidates.isEmpty()) {
            return 0;
        }
        Map<String, CanonicalItem> items = new LinkedHashMap<>();
        canonicalItemRepository.findAllById(candidates).forEach(item -> items.put(item.getId(), item));

        int detected = 0;
        for (String canonicalItemId : candidates) {
            CanonicalItem item = items.get(canonicalItemId);
            if (item == null) {
                continue;
            }
            detected++;
            long used = usage.get(canonicalItemId);
            List<BigDecimal> prices = recentPrices(canonicalItemId, null, since);
            Proposal.ProposedChange change = new Proposal.ProposedChange();
            change.setCanonicalItemId(canonicalItemId);
            change.setCanonicalName(item.getName());
            change.setUsageCount(used);
            if (prices.size() >= properties.getMinSamplesForSuggestion()) {
                change.setSuggestedMin(PriceStatistics.percentile(prices, 0.10));
                change.setSuggestedMax(PriceStatistics.percentile(prices, 0.90));
                change.setCurrency(dominantCurrency(canonicalItemId, since));
            }
            propose(state, AnomalyClass.MISSING_BAND, ProposalType.PRICE_RANGE_ADJUST, TargetEntity.CANONICAL_ITEM,
                    canonicalItemId, change, "'" + item.getName() + "' was used " + used + " times without a price band");
        }
        return detected;
    }

    private int scanOrphanSynonyms(ScanState state) {
        List<ItemSynonym> synonyms = itemSynonymRepository.findAll();
        Set<String> referenced = synonyms.stream().map(ItemSynonym::getCanonicalItemId).filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Set<String> existing = new HashSet<>();
        canonicalItemRepository.findAllById(referenced).forEach(item -> existing.add(item.getId()));

        int detected = 0;
        for (ItemSynonym synonym : synonyms) {
            if (synonym.getCanonicalItemId() != null && existing.contains(synonym.getCanonicalItemId())) {
                continue;
            }
            detected++;
            Proposal.ProposedChange change = new Proposal.ProposedChange();
            change.setSynonymId(synonym.getId());
            change.setCanonicalItemId(synonym.getCanonicalItemId());
            change.setCanonicalName(synonym.getSynonym());
            if (synonym.getConfidence() >= properties.getOrphanHighConfidence()) {
                propose(state, AnomalyClass.ORPHAN_SYNONYM, ProposalType.NEW_CANONICAL, TargetEntity.ITEM_SYNONYM,
                        synonym.getId(), change, "Synonym '" + synonym.getSynonym() + "' points at missing canonical item "
                                + synonym.getCanonicalItemId() + "; create it");
            } else {
                state.warnings.add("Low-confidence orphan synonym '" + synonym.getSynonym() + "' (" + synonym.getConfidence() + ")");
                propose(state, AnomalyClass.ORPHAN_SYNONYM, ProposalType.REMOVE_SYNONYM, TargetEntity.ITEM_SYNONYM,
                        synonym.getId(), change, "Synonym '" + synonym.getSynonym() + "' points at missing canonical item "
                                + synonym.getCanonicalItemId() + " and has low confidence; remove it");
            }
        }
        return detected;
    }

    private int scanConflictingRules(ScanState state) {
        Map<String, List<AgentRule>> byScope = agentRuleRepository.findByActiveTrue().stream()
                .collect(Collectors.groupingBy(AgentRule::scopeKey, LinkedHashMap::new, Collectors.toList()));
        int detected = 0;
        for (Map.Entry<String, List<AgentRule>> entry : byScope.entrySet()) {
            Set<RuleDecision> decisions = entry.getValue().stream().map(AgentRule::getDecision).collect(Collectors.toSet());
            if (!(decisions.contains(RuleDecision.ALLOW) && decisions.contains(RuleDecision.DENY))) {
                continue;
            }
            detected++;
            AgentRule newest = entry.getValue().stream()
                    .max(Comparator.comparing(AgentRule::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                    .orElseThrow();
            Proposal.ProposedChange change = new Proposal.ProposedChange();
            change.setScopeKey(entry.getKey());
            change.setRuleIds(entry.getValue().stream().map(AgentRule::getId).sorted().toList());
            change.setKeepRuleId(newest.getId());
            propose(state, AnomalyClass.CONFLICTING_RULE, ProposalType.RULE_CONSOLIDATION, TargetEntity.AGENT_RULE_SCOPE,
                    entry.getKey(), change, entry.getValue().size() + " active rules in scope " + entry.getKey()
                            + " both allow and deny; keep the newest (" + newest.getDecision() + ")");
        }
        return detected;
    }

    private void propose(ScanState state, AnomalyClass anomalyClass, ProposalType type, TargetEntity targetEntity,
                         String targetId, Proposal.ProposedChange change, String reason) {
        Proposal proposal = new Proposal();
        proposal.setAnomalyClass(anomalyClass);
        proposal.setType(type);
        proposal.setTargetEntity(targetEntity);
        proposal.setTargetId(targetId);
        proposal.setProposedChange(change);
        proposal.setReason(reason);
        if (proposalStore.proposeIfAbsent(proposal).created()) {
            state.created++;
        }
    }

    /** Sorted unit prices of recent line items; currency null means any. */
    private List<BigDecimal> recentPrices(String canonicalItemId, String currency, Instant since) {
        return lineItemValidationRepository.findByCanonicalItemIdAndCreatedAtAfter(canonicalItemId, since).stream()
                .filter(v -> currency == null || currency.equals(v.getCurrency()))
                .map(LineItemValidation::getUnitPrice)
                .filter(p -> p != null && p.signum() > 0)
                .sorted()
                .toList();
    }

    private String dominantCurrency(String canonicalItemId, Instant since) {
        return lineItemValidationRepository.findByCanonicalItemIdAndCreatedAtAfter(canonicalItemId, since).stream()
                .map(LineItemValidation::getCurrency)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(c -> c, Collectors.counting()))
                .entrySet().stream()
                .max(Map.Entry.<String, Long>comparingByValue().thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .orElse(null);
    }

    private static final class ScanState {
        private int bandsFixed;
        private int bandsMissing;
        private int orphans;
        private int conflicts;
        private int created;
        private final List<String> warnings = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();

        void error(String detector, DataAccessException e) {
            log.error("Safety scan step '{}' failed", detector, e);
            errors.add(detector + ": " + e.getMessage());
        }
    }
}
