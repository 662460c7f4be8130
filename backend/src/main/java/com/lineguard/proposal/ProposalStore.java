package com.lineguard.proposal;

import com.lineguard.domain.Proposal;
import com.lineguard.domain.ProposalRepository;
import com.lineguard.domain.ProposalStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Creates proposals keyed by (targetEntity, targetId, anomalyClass). An existing proposal for the key is
 * returned whatever its status, so repeated detection of the same anomaly never duplicates it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProposalStore {

    private final ProposalRepository proposalRepository;

    public Proposed proposeIfAbsent(Proposal candidate) {
        String key = Proposal.dedupKey(candidate.getTargetEntity(), candidate.getTargetId(), candidate.getAnomalyClass());
        Proposal existing = proposalRepository.findByDedupKey(key).orElse(null);
        if (existing != null) {
            return new Proposed(existing, false);
        }
        candidate.setDedupKey(key);
        candidate.setStatus(ProposalStatus.PENDING);
        candidate.setCreatedAt(Instant.now());
        try {
            Proposal saved = proposalRepository.insert(candidate);
            log.info("Proposal {} created: {} {} for {} {}", saved.getId(), saved.getType(), saved.getAnomalyClass(),
                    saved.getTargetEntity(), saved.getTargetId());
            return new Proposed(saved, true);
        } catch (DuplicateKeyException e) {
            return proposalRepository.findByDedupKey(key)
                    .map(p -> new Proposed(p, false))
                    .orElseThrow(() -> e);
        }
    }

    public record Proposed(Proposal proposal, boolean created) {
    }
}
