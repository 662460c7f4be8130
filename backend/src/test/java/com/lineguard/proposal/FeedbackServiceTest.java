package com.lineguard.proposal;

import com.lineguard.domain.FeedbackAction;
import com.lineguard.domain.HumanFeedback;
import com.lineguard.domain.LineItemStatus;
import com.lineguard.domain.LineItemValidation;
import com.lineguard.domain.PipelineStage;
import com.lineguard.domain.ValidationDecision;
import com.lineguard.transparency.AuditWriteException;
import com.lineguard.transparency.StageRecord;
import com.lineguard.transparency.TransparencyRecorder;
import com.lineguard.transparency.ValidationNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedbackServiceTest {

    @Mock
    TransparencyRecorder recorder;
    @Mock
    ProposalService proposalService;

    @InjectMocks
    FeedbackService feedbackService;

    LineItemValidation line;

    @BeforeEach
    void setUp() {
        line = new LineItemValidation();
        line.setId("l1");
        line.setSessionId("s1");
        line.setItemIndex(0);
        line.advanceTo(LineItemStatus.NEW);
        line.advanceTo(LineItemStatus.AWAITING_MATCH);
        line.advanceTo(LineItemStatus.MATCHED);
        line.advanceTo(LineItemStatus.NEEDS_REVIEW);
        line.setDecision(ValidationDecision.NEEDS_REVIEW);
    }

    @Test
    @DisplayName("approve moves NEEDS_REVIEW to ALLOW and records the review")
    void approve() {
        when(recorder.findLineItemById("l1")).thenReturn(Optional.of(line));
        when(recorder.updateLineItemState(line)).thenReturn(line);

        FeedbackResult result = feedbackService.apply(
                new FeedbackDecision("l1", FeedbackAction.APPROVE, "known vendor", List.of()));

        assertThat(result.success()).isTrue();
        assertThat(result.message()).contains("NEEDS_REVIEW").contains("ALLOW");
        assertThat(line.getStatus()).isEqualTo(LineItemStatus.ALLOW);
        assertThat(line.getDecision()).isEqualTo(ValidationDecision.ALLOW);
        assertThat(line.getConfidence()).isEqualTo(1.0);
        assertThat(line.getPrimaryReason()).isEqualTo("Approved by reviewer: known vendor");

        ArgumentCaptor<HumanFeedback> feedback = ArgumentCaptor.forClass(HumanFeedback.class);
        verify(recorder).recordHumanFeedback(feedback.capture());
        assertThat(feedback.getValue().getPreviousStatus()).isEqualTo(LineItemStatus.NEEDS_REVIEW);
        assertThat(feedback.getValue().getNewStatus()).isEqualTo(LineItemStatus.ALLOW);

        ArgumentCaptor<StageRecord> stage = ArgumentCaptor.forClass(StageRecord.class);
        verify(recorder).recordExecution(eq("s1"), stage.capture());
        assertThat(stage.getValue().stage()).isEqualTo(PipelineStage.HUMAN_REVIEW);
        verify(recorder).refreshOverallStatus("s1");
    }

    @Test
    @DisplayName("request_info parks the item in AWAITING_INFO and keeps its decision")
    void requestInfo() {
        when(recorder.findLineItemById("l1")).thenReturn(Optional.of(line));
        when(recorder.updateLineItemState(line)).thenReturn(line);

        feedbackService.apply(new FeedbackDecision("l1", FeedbackAction.REQUEST_INFO, null, List.of("p1")));

        assertThat(line.getStatus()).isEqualTo(LineItemStatus.AWAITING_INFO);
        assertThat(line.getDecision()).isEqualTo(ValidationDecision.NEEDS_REVIEW);
        verify(proposalService, never()).approve(anyString(), any());
        verify(proposalService, never()).deny(anyString(), any());
    }

    @Test
    @DisplayName("deny decides the named proposals and reports the ones that failed")
    void denyWithProposals() {
        when(recorder.findLineItemById("l1")).thenReturn(Optional.of(line));
        when(recorder.updateLineItemState(line)).thenReturn(line);
        lenient().when(proposalService.deny("p2", null))
                .thenThrow(new ProposalException(ProposalService.PROPOSAL_ALREADY_DECIDED, "already DENIED"));

        FeedbackResult result = feedbackService.apply(
                new FeedbackDecision("l1", FeedbackAction.DENY, null, List.of("p1", "p2")));

        verify(proposalService).deny("p1", null);
        assertThat(line.getStatus()).isEqualTo(LineItemStatus.REJECT);
        assertThat(line.getPrimaryReason()).isEqualTo("Denied by reviewer");
        assertThat(result.success()).isFalse();
        assertThat(result.message()).contains("p2 (PROPOSAL_ALREADY_DECIDED)");
    }

    @Test
    @DisplayName("a failed feedback write surfaces as AuditWriteException before proposals are decided")
    void feedbackWriteFailure() {
        when(recorder.findLineItemById("l1")).thenReturn(Optional.of(line));
        when(recorder.updateLineItemState(line)).thenReturn(line);
        when(recorder.recordHumanFeedback(any()))
                .thenThrow(new AuditWriteException("Audit write failed: human feedback for line item l1", null));

        assertThatThrownBy(() -> feedbackService.apply(
                new FeedbackDecision("l1", FeedbackAction.APPROVE, null, List.of("p1"))))
                .isInstanceOf(AuditWriteException.class);
        verify(proposalService, never()).approve(anyString(), any());
    }

    @Test
    @DisplayName("a terminal line rejects feedback with INVALID_TRANSITION")
    void terminalLine() {
        line.advanceTo(LineItemStatus.ALLOW);
        when(recorder.findLineItemById("l1")).thenReturn(Optional.of(line));

        assertThatThrownBy(() -> feedbackService.apply(new FeedbackDecision("l1", FeedbackAction.DENY, null, null)))
                .isInstanceOf(FeedbackException.class)
                .satisfies(e -> assertThat(((FeedbackException) e).getErrorCode()).isEqualTo(FeedbackException.INVALID_TRANSITION));
        verify(recorder, never()).recordHumanFeedback(any());
    }

    @Test
    @DisplayName("unknown line id fails with LINE_NOT_FOUND")
    void unknownLine() {
        when(recorder.findLineItemById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> feedbackService.apply(new FeedbackDecision("nope", FeedbackAction.APPROVE, null, null)))
                .isInstanceOf(ValidationNotFoundException.class)
                .satisfies(e -> assertThat(((ValidationNotFoundException) e).getErrorCode())
                        .isEqualTo(ValidationNotFoundException.LINE_NOT_FOUND));
    }

    @Test
    @DisplayName("a stale line version surfaces as CONCURRENT_UPDATE")
    void concurrentUpdate() {
        when(recorder.findLineItemById("l1")).thenReturn(Optional.of(line));
        when(recorder.updateLineItemState(line)).thenThrow(new OptimisticLockingFailureException("stale"));

        assertThatThrownBy(() -> feedbackService.apply(new FeedbackDecision("l1", FeedbackAction.APPROVE, null, null)))
                .isInstanceOf(FeedbackException.class)
                .satisfies(e -> assertThat(((FeedbackException) e).getErrorCode()).isEqualTo(FeedbackException.CONCURRENT_UPDATE));
    }
}
