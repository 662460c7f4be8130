package com.lineguard.api.dto;

import com.lineguard.domain.AnomalyClass;
import com.lineguard.domain.Proposal;
import com.lineguard.domain.ProposalStatus;
import com.lineguard.domain.ProposalType;
import com.lineguard.domain.TargetEntity;

import java.time.Instant;

public record ProposalResponse(String id,
                               AnomalyClass anomalyClass,
                               ProposalType type,
                               TargetEntity targetEntity,
                               String targetId,
                               Proposal.ProposedChange proposedChange,
                               String reason,
                               ProposalStatus status,
                               String sessionId,
                               Instant createdAt,
                               Instant decidedAt,
                               String decisionNote,
                               boolean applied) {

    public static ProposalResponse of(Proposal p) {
        return new ProposalResponse(p.getId(), p.getAnomalyClass(), p.getType(), p.getTargetEntity(), p.getTargetId(),
                p.getProposedChange(), p.getReason(), p.getStatus(), p.getSessionId(), p.getCreatedAt(),
                p.getDecidedAt(), p.getDecisionNote(), p.isApplied());
    }
}
