package com.lineguard.proposal;

import com.lineguard.domain.AnomalyClass;
import com.lineguard.domain.Proposal;
import com.lineguard.domain.ProposalRepository;
import com.lineguard.domain.ProposalStatus;
import com.lineguard.domain.ProposalType;
import com.lineguard.domain.TargetEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProposalStoreTest {

    private static final String KEY = "PRICE_BAND:b1:BAND_ANOMALY";

    @Mock
    ProposalRepository proposalRepository;

    @InjectMocks
    ProposalStore proposalStore;

    private static Proposal candidate() {
        Proposal p = new Proposal();
        p.setAnomalyClass(AnomalyClass.BAND_ANOMALY);
        p.setType(ProposalType.PRICE_RANGE_ADJUST);
        p.setTargetEntity(TargetEntity.PRICE_BAND);
        p.setTargetId("b1");
        p.setReason("inverted");
        return p;
    }

    @Test
    @DisplayName("new key inserts a PENDING proposal with its dedup key")
    void insertsNew() {
        when(proposalRepository.findByDedupKey(KEY)).thenReturn(Optional.empty());
        when(proposalRepository.insert(any(Proposal.class))).thenAnswer(inv -> inv.getArgument(0));

        ProposalStore.Proposed result = proposalStore.proposeIfAbsent(candidate());

        assertThat(result.created()).isTrue();
        assertThat(result.proposal().getDedupKey()).isEqualTo(KEY);
        assertThat(result.proposal().getStatus()).isEqualTo(ProposalStatus.PENDING);
        assertThat(result.proposal().getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("existing proposal for the key is returned whatever its status")
    void returnsExisting() {
        Proposal denied = candidate();
        denied.setStatus(ProposalStatus.DENIED);
        when(proposalRepository.findByDedupKey(KEY)).thenReturn(Optional.of(denied));

        ProposalStore.Proposed result = proposalStore.proposeIfAbsent(candidate());

        assertThat(result.created()).isFalse();
        assertThat(result.proposal()).isSameAs(denied);
        verify(proposalRepository, never()).insert(any(Proposal.class));
    }

    @Test
    @DisplayName("losing an insert race returns the winner")
    void insertRace() {
        Proposal winner = candidate();
        winner.setId("p1");
        when(proposalRepository.findByDedupKey(KEY)).thenReturn(Optional.empty(), Optional.of(winner));
        when(proposalRepository.insert(any(Proposal.class))).thenThrow(new DuplicateKeyException("dup"));

        ProposalStore.Proposed result = proposalStore.proposeIfAbsent(candidate());

        assertThat(result.created()).isFalse();
        assertThat(result.proposal().getId()).isEqualTo("p1");
    }
}
