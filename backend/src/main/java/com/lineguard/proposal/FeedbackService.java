package com.lineguard.proposal;

import com.lineguard.domain.ExecutionStatus;
import com.lineguard.domain.FeedbackAction;
import com.lineguard.domain.HumanFeedback;
import com.lineguard.domain.LineItemStatus;
import com.lineguard.domain.LineItemValidation;
import com.lineguard.domain.PipelineStage;
import com.lineguard.domain.ValidationDecision;
import com.lineguard.transparency.Snapshots;
import com.lineguard.transparency.StageRecord;
import com.lineguard.transparency.TransparencyRecorder;
import com.lineguard.transparency.ValidationNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies a reviewer decision to a line item waiting for one. The pipeline never waits on this; a decision
 * arrives as its own call, is recorded as a human_review execution and a {@link HumanFeedback} row, and
 * decides the proposals it names.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedbackService {

    private final TransparencyRecorder recorder;
    private final ProposalService proposalService;

    /**
     * @throws ValidationNotFoundException LINE_NOT_FOUND for an unknown lineId
     * @throws FeedbackException           INVALID_TRANSITION when the line is not awaiting review,
     *                                     CONCURRENT_UPDATE when it changed meanwhile
     */
    public FeedbackResult apply(FeedbackDecision decision) {
        if (decision.lineId() == null || decision.lineId().isBlank() || decision.action() == null) {
            throw new FeedbackException(FeedbackException.INVALID_INPUT, "lineId and action are required");
        }
        LineItemValidation line = recorder.findLineItemById(decision.lineId())
                .orElseThrow(() -> new ValidationNotFoundException(ValidationNotFoundException.LINE_NOT_FOUND,
                        "No line item " + decision.lineId()));
        LineItemStatus previous = line.getStatus();
        if (previous == null || !previous.isReviewable()) {
            throw new FeedbackException(FeedbackException.INVALID_TRANSITION,
                    "Line item " + line.getId() + " is " + previous + " and not awaiting review");
        }

        Instant start = Instant.now();
        LineItemStatus next = switch (decision.action()) {
            case APPROVE -> LineItemStatus.ALLOW;
            case DENY -> LineItemStatus.REJECT;
            case REQUEST_INFO -> LineItemStatus.AWAITING_INFO;
        };
        line.advanceTo(next);
        if (decision.action() != FeedbackAction.REQUEST_INFO) {
            line.setDecision(next == LineItemStatus.ALLOW ? ValidationDecision.ALLOW : ValidationDecision.REJECT);
            line.setConfidence(1.0);
            line.setPrimaryReason(reviewerReason(decision));
        }
        LineItemValidation saved;
        try {
            saved = recorder.updateLineItemState(line);
        } catch (OptimisticLockingFailureException e) {
            throw new FeedbackException(FeedbackException.CONCURRENT_UPDATE,
                    "Line item " + line.getId() + " was updated concurrently; reload and retry");
        }

        List<String> proposalIds = decision.proposals() != null ? decision.proposals() : List.of();
        HumanFeedback feedback = new HumanFeedback();
        feedback.setLineItemValidationId(saved.getId());
        feedback.setSessionId(saved.getSessionId());
        feedback.setAction(decision.action());
        feedback.setNote(decision.note());
        feedback.setProposalIds(proposalIds);
        feedback.setPreviousStatus(previous);
        feedback.setNewStatus(next);
        feedback.setCreatedAt(start);
        recorder.recordHumanFeedback(feedback);

        List<String> failures = decideProposals(decision.action(), proposalIds, decision.note());
        recorder.recordExecution(saved.getSessionId(), new StageRecord(PipelineStage.HUMAN_REVIEW, saved.getItemIndex(),
                start, Instant.now(),
                Snapshots.of("action", decision.action(), "note", decision.note(), "proposals", proposalIds),
                Snapshots.of("previousStatus", previous, "newStatus", next, "proposalFailures", failures),
                1.0, ExecutionStatus.COMPLETED, null));
        recorder.refreshOverallStatus(saved.getSessionId());
        log.info("Feedback {} applied to line item {}: {} -> {}", decision.action(), saved.getId(), previous, next);

        String message = "Line item " + saved.getId() + " moved from " + previous + " to " + next;
        if (failures.isEmpty()) {
            return new FeedbackResult(true, message);
        }
        return new FeedbackResult(false, message + "; proposals not decided: " + String.join("; ", failures));
    }

    private List<String> decideProposals(FeedbackAction action, List<String> proposalIds, String note) {
        List<String> failures = new ArrayList<>();
        if (action == FeedbackAction.REQUEST_INFO) {
            return failures;
        }
        for (String proposalId : proposalIds) {
            try {
                if (action == FeedbackAction.APPROVE) {
                    proposalService.approve(proposalId, note);
                } else {
                    proposalService.deny(proposalId, note);
                }
            } catch (ProposalException e) {
                log.warn("Proposal {} not decided with feedback: {}", proposalId, e.getMessage());
                failures.add(proposalId + " (" + e.getErrorCode() + ")");
            }
        }
        return failures;
    }

    private static String reviewerReason(FeedbackDecision decision) {
        String verb = decision.action() == FeedbackAction.APPROVE ? "Approved" : "Denied";
        return decision.note() == null || decision.note().isBlank()
                ? verb + " by reviewer"
                : verb + " by reviewer: " + decision.note().strip();
    }
}
