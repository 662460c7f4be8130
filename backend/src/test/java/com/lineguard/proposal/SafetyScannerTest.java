package com.lineguard.proposal;

import com.lineguard.domain.AgentRule;
import com.lineguard.domain.AgentRuleRepository;
import com.lineguard.domain.AnomalyClass;
import com.lineguard.domain.CanonicalItem;
import com.lineguard.domain.CanonicalItemRepository;
import com.lineguard.domain.ItemSynonym;
import com.lineguard.domain.ItemSynonymRepository;
import com.lineguard.domain.LineItemValidationRepository;
import com.lineguard.domain.PriceBand;
import com.lineguard.domain.PriceBandRepository;
import com.lineguard.domain.Proposal;
import com.lineguard.domain.ProposalRepository;
import com.lineguard.domain.ProposalStatus;
import com.lineguard.domain.ProposalType;
import com.lineguard.domain.RuleDecision;
import com.lineguard.domain.RuleScope;
import com.lineguard.domain.TargetEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SafetyScannerTest {

    @Mock
    PriceBandRepository priceBandRepository;
    @Mock
    CanonicalItemRepository canonicalItemRepository;
    @Mock
    ItemSynonymRepository itemSynonymRepository;
    @Mock
    AgentRuleRepository agentRuleRepository;
    @Mock
    LineItemValidationRepository lineItemValidationRepository;
    @Mock
    ProposalRepository proposalRepository;

    SafetyScanProperties properties;
    SafetyScanner scanner;
    final Map<String, Proposal> stored = new LinkedHashMap<>();

    @BeforeEach
    void setUp() {
        properties = new SafetyScanProperties();
        scanner = new SafetyScanner(properties, priceBandRepository, canonicalItemRepository, itemSynonymRepository,
                agentRuleRepository, lineItemValidationRepository, new ProposalStore(proposalRepository));

        lenient().when(lineItemValidationRepository.countUsageByCanonicalItemSince(any())).thenReturn(Map.of());
        lenient().when(lineItemValidationRepository.findByCanonicalItemIdAndCreatedAtAfter(any(), any())).thenReturn(List.of());
        lenient().when(priceBandRepository.findAll()).thenReturn(List.of());
        lenient().when(itemSynonymRepository.findAll()).thenReturn(List.of());
        lenient().when(canonicalItemRepository.findAllById(any())).thenReturn(List.of());
        lenient().when(agentRuleRepository.findByActiveTrue()).thenReturn(List.of());

        lenient().when(proposalRepository.findByDedupKey(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(stored.get(inv.<String>getArgument(0))));
        lenient().when(proposalRepository.insert(any(Proposal.class))).thenAnswer(inv -> {
            Proposal p = inv.getArgument(0);
            p.setId("p" + (stored.size() + 1));
            stored.put(p.getDedupKey(), p);
            return p;
        });
    }

    private static PriceBand band(String id, String item, String min, String max) {
        PriceBand band = new PriceBand();
        band.setId(id);
        band.setCanonicalItemId(item);
        band.setMinPrice(new BigDecimal(min));
        band.setMaxPrice(new BigDecimal(max));
        band.setCurrency("USD");
        return band;
    }

    @Test
    @DisplayName("inverted band yields exactly one PENDING band-anomaly proposal and the band is untouched")
    void invertedBand() {
        PriceBand inverted = band("b1", "c1", "20", "5");
        when(priceBandRepository.findAll()).thenReturn(List.of(inverted));

        SafetyScanReport report = scanner.scan();

        assertThat(report.issues().bandsFixed()).isEqualTo(1);
        assertThat(report.proposalsCreated()).isEqualTo(1);
        assertThat(stored).hasSize(1);
        Proposal proposal = stored.values().iterator().next();
        assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.PENDING);
        assertThat(proposal.getAnomalyClass()).isEqualTo(AnomalyClass.BAND_ANOMALY);
        assertThat(proposal.getTargetEntity()).isEqualTo(TargetEntity.PRICE_BAND);
        assertThat(proposal.getTargetId()).isEqualTo("b1");
        assertThat(proposal.getReason()).contains("20").contains("5");
        assertThat(proposal.getProposedChange().getSuggestedMin()).isEqualByComparingTo("5");
        assertThat(proposal.getProposedChange().getSuggestedMax()).isEqualByComparingTo("20");

        assertThat(inverted.getMinPrice()).isEqualByComparingTo("20");
        assertThat(inverted.getMaxPrice()).isEqualByComparingTo("5");
        verify(priceBandRepository, never()).save(any());
    }

    @Test
    @DisplayName("second scan over unchanged data creates no proposals")
    void idempotent() {
        when(priceBandRepository.findAll()).thenReturn(List.of(band("b1", "c1", "20", "5")));

        scanner.scan();
        SafetyScanReport second = scanner.scan();

        assertThat(second.proposalsCreated()).isZero();
        assertThat(second.issues().bandsFixed()).isEqualTo(1);
        assertThat(stored).hasSize(1);
    }

    @Test
    @DisplayName("zero-min band is an anomaly only when the item is used")
    void zeroMinWithUsage() {
        when(priceBandRepository.findAll()).thenReturn(List.of(band("b1", "c1", "0", "10"), band("b2", "c2", "0", "10")));
        when(lineItemValidationRepository.countUsageByCanonicalItemSince(any())).thenReturn(Map.of("c1", 3L));

        SafetyScanReport report = scanner.scan();

        assertThat(report.issues().bandsFixed()).isEqualTo(1);
        Proposal proposal = stored.values().iterator().next();
        assertThat(proposal.getTargetId()).isEqualTo("b1");
        assertThat(proposal.getProposedChange().getSuggestedMin()).isEqualByComparingTo("5");
        assertThat(proposal.getProposedChange().getSuggestedMax()).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("heavily used item without a band gets a missing-band proposal")
    void missingBand() {
        CanonicalItem item = new CanonicalItem();
        item.setId("c7");
        item.setName("Copper Wire");
        when(lineItemValidationRepository.countUsageByCanonicalItemSince(any())).thenReturn(Map.of("c7", 25L, "c8", 2L));
        when(canonicalItemRepository.findAllById(List.of("c7"))).thenReturn(List.of(item));

        SafetyScanReport report = scanner.scan();

        assertThat(report.issues().bandsMissing()).isEqualTo(1);
        Proposal proposal = stored.values().iterator().next();
        assertThat(proposal.getAnomalyClass()).isEqualTo(AnomalyClass.MISSING_BAND);
        assertThat(proposal.getTargetEntity()).isEqualTo(TargetEntity.CANONICAL_ITEM);
        assertThat(proposal.getProposedChange().getUsageCount()).isEqualTo(25L);
        assertThat(proposal.getProposedChange().getSuggestedMin()).isNull();
    }

    @Test
    @DisplayName("orphan synonyms propose NEW_CANONICAL or REMOVE_SYNONYM by confidence")
    void orphanSynonyms() {
        ItemSynonym strong = new ItemSynonym();
        strong.setId("s1");
        strong.setCanonicalItemId("gone");
        strong.setSynonym("PVC Tube");
        strong.setConfidence(0.9);
        ItemSynonym weak = new ItemSynonym();
        weak.setId("s2");
        weak.setCanonicalItemId("gone");
        weak.setSynonym("tubey");
        weak.setConfidence(0.3);
        when(itemSynonymRepository.findAll()).thenReturn(List.of(strong, weak));

        SafetyScanReport report = scanner.scan();

        assertThat(report.issues().orphans()).isEqualTo(2);
        assertThat(report.warnings()).hasSize(1);
        assertThat(new ArrayList<>(stored.values())).extracting(Proposal::getType)
                .containsExactly(ProposalType.NEW_CANONICAL, ProposalType.REMOVE_SYNONYM);
    }

    @Test
    @DisplayName("ALLOW and DENY rules in one scope propose consolidation keeping the newest")
    void conflictingRules() {
        AgentRule allow = rule("r1", RuleDecision.ALLOW, Instant.parse("2024-01-01T00:00:00Z"));
        AgentRule deny = rule("r2", RuleDecision.DENY, Instant.parse("2024-02-01T00:00:00Z"));
        when(agentRuleRepository.findByActiveTrue()).thenReturn(List.of(allow, deny));

        SafetyScanReport report = scanner.scan();

        assertThat(report.issues().conflicts()).isEqualTo(1);
        Proposal proposal = stored.values().iterator().next();
        assertThat(proposal.getType()).isEqualTo(ProposalType.RULE_CONSOLIDATION);
        assertThat(proposal.getTargetId()).isEqualTo("ITEM:c1");
        assertThat(proposal.getProposedChange().getKeepRuleId()).isEqualTo("r2");
        assertThat(proposal.getProposedChange().getRuleIds()).containsExactly("r1", "r2");
    }

    @Test
    @DisplayName("a failing detector is reported and the others still run")
    void detectorFailureCollected() {
        when(itemSynonymRepository.findAll()).thenThrow(new DataAccessResourceFailureException("synonyms down"));
        when(priceBandRepository.findAll()).thenReturn(List.of(band("b1", "c1", "20", "5")));

        SafetyScanReport report = scanner.scan();

        assertThat(report.errors()).hasSize(1);
        assertThat(report.errors().get(0)).startsWith("orphan synonyms");
        assertThat(report.issues().bandsFixed()).isEqualTo(1);
    }

    @Test
    @DisplayName("unreadable price bands skip both band detectors instead of proposing missing bands")
    void bandReadFailureSkipsBandDetectors() {
        when(priceBandRepository.findAll()).thenThrow(new DataAccessResourceFailureException("bands down"));
        when(lineItemValidationRepository.countUsageByCanonicalItemSince(any())).thenReturn(Map.of("c1", 50L));

        SafetyScanReport report = scanner.scan();

        assertThat(report.issues().bandsFixed()).isZero();
        assertThat(report.issues().bandsMissing()).isZero();
        assertThat(report.proposalsCreated()).isZero();
        assertThat(stored).isEmpty();
        assertThat(report.errors()).containsExactly(
                "price bands: bands down",
                "band anomalies: skipped, price bands unavailable",
                "missing bands: skipped, price bands unavailable");
        verify(canonicalItemRepository, never()).findAllById(any());
    }

    @Test
    @DisplayName("disabled scan fails fast with SAFETY_SCAN_DISABLED")
    void disabled() {
        properties.setEnabled(false);

        assertThatThrownBy(() -> scanner.scan())
                .isInstanceOf(SafetyScanDisabledException.class)
                .satisfies(e -> assertThat(((SafetyScanDisabledException) e).getErrorCode())
                        .isEqualTo(SafetyScanDisabledException.SAFETY_SCAN_DISABLED));
        verify(priceBandRepository, never()).findAll();
    }

    private static AgentRule rule(String id, RuleDecision decision, Instant createdAt) {
        AgentRule rule = new AgentRule();
        rule.setId(id);
        rule.setScopeType(RuleScope.ITEM);
        rule.setScopeValue("c1");
        rule.setDecision(decision);
        rule.setActive(true);
        rule.setCreatedAt(createdAt);
        return rule;
    }
}
