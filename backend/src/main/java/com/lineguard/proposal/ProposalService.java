package com.lineguard.proposal;

import com.lineguard.domain.Proposal;
import com.lineguard.domain.ProposalRepository;
import com.lineguard.domain.ProposalStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Human decisions on proposals. PENDING is the only status a decision can start from. An approved proposal
 * is applied immediately unless lineguard.proposals.dry-run is on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProposalService {

    public static final String PROPOSAL_NOT_FOUND = "PROPOSAL_NOT_FOUND";
    public static final String PROPOSAL_ALREADY_DECIDED = "PROPOSAL_ALREADY_DECIDED";

    private final ProposalRepository proposalRepository;
    private final ProposalApplier proposalApplier;
    private final ProposalProperties properties;

    public List<Proposal> list(ProposalStatus status) {
        return status == null
                ? proposalRepository.findAllByOrderByCreatedAtDesc()
                : proposalRepository.findByStatusOrderByCreatedAtDesc(status);
    }

    /**
     * @throws ProposalException PROPOSAL_NOT_FOUND, PROPOSAL_ALREADY_DECIDED, or NOTHING_TO_APPLY from the applier
     */
    public Proposal approve(String proposalId, String note) {
        Proposal proposal = decide(proposalId, ProposalStatus.APPROVED, note);
        if (properties.isDryRun()) {
            log.info("Proposal {} approved in dry-run; catalog unchanged", proposalId);
            return proposal;
        }
        proposalApplier.apply(proposal);
        proposal.setApplied(true);
        proposal.setAppliedAt(Instant.now());
        return proposalRepository.save(proposal);
    }

    /**
     * @throws ProposalException PROPOSAL_NOT_FOUND or PROPOSAL_ALREADY_DECIDED
     */
    public Proposal deny(String proposalId, String note) {
        return decide(proposalId, ProposalStatus.DENIED, note);
    }

    private Proposal decide(String proposalId, ProposalStatus status, String note) {
        Proposal proposal = proposalRepository.findById(proposalId)
                .orElseThrow(() -> new ProposalException(PROPOSAL_NOT_FOUND, "Proposal not found: " + proposalId));
        if (proposal.getStatus() != ProposalStatus.PENDING) {
            throw new ProposalException(PROPOSAL_ALREADY_DECIDED,
                    "Proposal " + proposalId + " is already " + proposal.getStatus());
        }
        proposal.setStatus(status);
        proposal.setDecidedAt(Instant.now());
        proposal.setDecisionNote(note);
        try {
            Proposal saved = proposalRepository.save(proposal);
            log.info("Proposal {} {}", proposalId, status);
            return saved;
        } catch (OptimisticLockingFailureException e) {
            throw new ProposalException(PROPOSAL_ALREADY_DECIDED, "Proposal " + proposalId + " was decided concurrently");
        }
    }
}
