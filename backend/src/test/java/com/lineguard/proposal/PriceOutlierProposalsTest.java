package com.lineguard.proposal;

import com.lineguard.domain.AnomalyClass;
import com.lineguard.domain.PriceValidationMethod;
import com.lineguard.domain.Proposal;
import com.lineguard.domain.TargetEntity;
import com.lineguard.pricing.ExpectedRange;
import com.lineguard.pricing.PriceValidationResult;
import com.lineguard.pricing.PricingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PriceOutlierProposalsTest {

    @Mock
    ProposalStore proposalStore;

    PriceOutlierProposals outliers;

    @BeforeEach
    void setUp() {
        outliers = new PriceOutlierProposals(proposalStore, new PricingProperties());
    }

    private static PriceValidationResult canonical(boolean valid, String variance) {
        return new PriceValidationResult(valid, new BigDecimal(variance), 0.9, PriceValidationMethod.CANONICAL,
                new ExpectedRange(new BigDecimal("5"), new BigDecimal("15")), "USD", 0, null);
    }

    @Test
    @DisplayName("canonical price far outside the band proposes a stretched band")
    void proposesStretchedBand() {
        when(proposalStore.proposeIfAbsent(any(Proposal.class)))
                .thenAnswer(inv -> new ProposalStore.Proposed(inv.getArgument(0), true));

        Optional<Proposal> proposal = outliers.proposeIfOutlier("c1", new BigDecimal("40"), canonical(false, "300.00"), "s1");

        assertThat(proposal).isPresent();
        ArgumentCaptor<Proposal> captor = ArgumentCaptor.forClass(Proposal.class);
        verify(proposalStore).proposeIfAbsent(captor.capture());
        Proposal p = captor.getValue();
        assertThat(p.getAnomalyClass()).isEqualTo(AnomalyClass.PRICE_OUTLIER);
        assertThat(p.getTargetEntity()).isEqualTo(TargetEntity.CANONICAL_ITEM);
        assertThat(p.getTargetId()).isEqualTo("c1");
        assertThat(p.getSessionId()).isEqualTo("s1");
        assertThat(p.getProposedChange().getSuggestedMin()).isEqualByComparingTo("5");
        assertThat(p.getProposedChange().getSuggestedMax()).isEqualByComparingTo("40");
    }

    @Test
    @DisplayName("variance at the threshold or a valid price proposes nothing")
    void belowThreshold() {
        assertThat(outliers.proposeIfOutlier("c1", new BigDecimal("12"), canonical(false, "20.00"), "s1")).isEmpty();
        assertThat(outliers.proposeIfOutlier("c1", new BigDecimal("12"), canonical(true, "20.00"), "s1")).isEmpty();
        verify(proposalStore, never()).proposeIfAbsent(any());
    }

    @Test
    @DisplayName("non-canonical methods never propose")
    void nonCanonical() {
        assertThat(outliers.proposeIfOutlier("c1", new BigDecimal("12"), PriceValidationResult.noReference("USD"), "s1")).isEmpty();
        verify(proposalStore, never()).proposeIfAbsent(any());
    }
}
