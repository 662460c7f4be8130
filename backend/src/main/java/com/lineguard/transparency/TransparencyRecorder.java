package com.lineguard.transparency;

import com.lineguard.domain.AgentExecution;
import com.lineguard.domain.AgentExecutionRepository;
import com.lineguard.domain.FailedLine;
import com.lineguard.domain.HumanFeedback;
import com.lineguard.domain.HumanFeedbackRepository;
import com.lineguard.domain.LineItemValidation;
import com.lineguard.domain.LineItemValidationRepository;
import com.lineguard.domain.SessionStatus;
import com.lineguard.domain.ValidationDecision;
import com.lineguard.domain.ValidationExplanation;
import com.lineguard.domain.ValidationExplanationRepository;
import com.lineguard.domain.ValidationHistoryPage;
import com.lineguard.domain.ValidationHistoryQuery;
import com.lineguard.domain.ValidationSession;
import com.lineguard.domain.ValidationSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.function.Supplier;

/**
 * Audit trail of validation sessions. Executions and explanations are insert-only; session metadata
 * (notes, status, timing) can be patched; line item state is updated under optimistic locking.
 * There is deliberately no delete here. Any storage failure becomes {@link AuditWriteException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransparencyRecorder {

    static final int DEFAULT_HISTORY_LIMIT = 20;
    static final int MAX_HISTORY_LIMIT = 100;

    private final ValidationSessionRepository sessionRepository;
    private final AgentExecutionRepository executionRepository;
    private final LineItemValidationRepository lineItemValidationRepository;
    private final ValidationExplanationRepository explanationRepository;
    private final HumanFeedbackRepository humanFeedbackRepository;

    /**
     * Creates the session for invoiceId, or returns the existing one with created=false.
     */
    public SessionStart recordSession(String invoiceId, String serviceLineName, String notes, int lineCount) {
        return write("session " + invoiceId, () -> {
            Optional<ValidationSession> existing = sessionRepository.findByInvoiceId(invoiceId);
            if (existing.isPresent()) {
                return new SessionStart(existing.get(), false);
            }
            ValidationSession session = new ValidationSession();
            session.setInvoiceId(invoiceId);
            session.setServiceLineName(serviceLineName);
            session.setNotes(notes);
            session.setLineCount(lineCount);
            session.setOverallStatus(SessionStatus.PENDING);
            Instant now = Instant.now();
            session.setCreatedAt(now);
            session.setUpdatedAt(now);
            try {
                ValidationSession saved = sessionRepository.insert(session);
                log.info("Validation session {} created for invoice {} ({} items)", saved.getId(), invoiceId, lineCount);
                return new SessionStart(saved, true);
            } catch (DuplicateKeyException e) {
                return new SessionStart(sessionRepository.findByInvoiceId(invoiceId).orElseThrow(() -> e), false);
            }
        });
    }

    /**
     * Appends a finished stage with the next executionOrder of the session.
     */
    public AgentExecution recordExecution(String sessionId, StageRecord stage) {
        return write("execution " + stage.stage() + " of session " + sessionId, () -> {
            long order = sessionRepository.nextExecutionOrder(sessionId);
            AgentExecution execution = new AgentExecution();
            execution.setSessionId(sessionId);
            execution.setItemIndex(stage.itemIndex());
            execution.setStageName(stage.stage());
            execution.setExecutionOrder(order);
            execution.setStartTime(stage.startTime());
            execution.setEndTime(stage.endTime());
            execution.setInputSnapshot(stage.input());
            execution.setOutputSnapshot(stage.output());
            execution.setConfidence(stage.confidence());
            execution.setStatus(stage.status());
            execution.setErrorMessage(stage.errorMessage());
            return executionRepository.insert(execution);
        });
    }

    /**
     * Inserts the line item of (sessionId, itemIndex), or returns the one already recorded.
     */
    public LineItemValidation recordLineItemValidation(LineItemValidation validation) {
        return write("line item " + validation.getItemIndex() + " of session " + validation.getSessionId(), () -> {
            Optional<LineItemValidation> existing =
                    lineItemValidationRepository.findBySessionIdAndItemIndex(validation.getSessionId(), validation.getItemIndex());
            if (existing.isPresent()) {
                return existing.get();
            }
            Instant now = Instant.now();
            validation.setCreatedAt(now);
            validation.setUpdatedAt(now);
            try {
                return lineItemValidationRepository.insert(validation);
            } catch (DuplicateKeyException e) {
                return lineItemValidationRepository
                        .findBySessionIdAndItemIndex(validation.getSessionId(), validation.getItemIndex())
                        .orElseThrow(() -> e);
            }
        });
    }

    /**
     * Persists changed line item state (status, decision, attempts).
     *
     * @throws OptimisticLockingFailureException when another writer updated the item first
     */
    public LineItemValidation updateLineItemState(LineItemValidation validation) {
        validation.setUpdatedAt(Instant.now());
        return write("line item state " + validation.getId(), () -> lineItemValidationRepository.save(validation));
    }

    /**
     * Appends an explanation as the next version for its line item.
     */
    public ValidationExplanation recordExplanation(ValidationExplanation explanation) {
        return write("explanation for line item " + explanation.getLineItemValidationId(), () -> {
            int version = explanationRepository
                    .findFirstByLineItemValidationIdOrderByVersionDesc(explanation.getLineItemValidationId())
                    .map(e -> e.getVersion() + 1)
                    .orElse(1);
            explanation.setVersion(version);
            explanation.setGeneratedAt(Instant.now());
            return explanationRepository.insert(explanation);
        });
    }

    /**
     * Appends a reviewer's decision on a line item.
     */
    public HumanFeedback recordHumanFeedback(HumanFeedback feedback) {
        return write("human feedback for line item " + feedback.getLineItemValidationId(),
                () -> humanFeedbackRepository.insert(feedback));
    }

    /**
     * Stores the first run's status and timing together with the lines that failed, so a later
     * idempotent submission can report them again.
     */
    public ValidationSession completeSession(String sessionId, SessionStatus status, long executionTimeMs,
                                             List<FailedLine> failedLines) {
        return write("session completion " + sessionId,
                () -> sessionRepository.complete(sessionId, status, executionTimeMs, failedLines));
    }

    /**
     * Recomputes the session status from its stored line items after a re-validation or a human decision.
     * Lines that failed input validation have no stored row and still count as failed.
     */
    public ValidationSession refreshOverallStatus(String sessionId) {
        List<LineItemValidation> stored = lineItemValidationRepository.findBySessionIdOrderByItemIndexAsc(sessionId);
        List<ValidationDecision> decisions = stored.stream().map(LineItemValidation::getDecision).toList();
        Set<Integer> storedIndexes = stored.stream().map(LineItemValidation::getItemIndex).collect(Collectors.toSet());
        int unstoredFailures = sessionRepository.findById(sessionId)
                .map(session -> (int) session.getFailedLines().stream()
                        .filter(f -> !storedIndexes.contains(f.getItemIndex()))
                        .count())
                .orElse(0);
        SessionStatus status = OverallStatus.of(decisions, unstoredFailures);
        return write("session status " + sessionId, () -> sessionRepository.patchMetadata(sessionId, null, status, null));
    }

    /**
     * Pages through sessions. Limit is clamped to 1..100 (0 or less means the default of 20);
     * a negative offset starts at the first session.
     */
    public ValidationHistoryPage getValidationHistory(ValidationHistoryQuery query) {
        int limit = query.limit() <= 0 ? DEFAULT_HISTORY_LIMIT : Math.min(query.limit(), MAX_HISTORY_LIMIT);
        int offset = Math.max(0, query.offset());
        return sessionRepository.findHistory(new ValidationHistoryQuery(query.startDate(), query.endDate(),
                query.status(), query.serviceLine(), query.itemName(), query.sortBy(), query.ascending(), limit, offset));
    }

    /**
     * @throws ValidationNotFoundException VALIDATION_NOT_FOUND when no session exists for invoiceId
     */
    public ValidationSession patchSessionMetadata(String invoiceId, String notes, SessionStatus status) {
        ValidationSession session = findSession(invoiceId)
                .orElseThrow(() -> new ValidationNotFoundException(ValidationNotFoundException.VALIDATION_NOT_FOUND,
                        "No validation session for invoice " + invoiceId));
        ValidationSession patched = write("session metadata " + session.getId(),
                () -> sessionRepository.patchMetadata(session.getId(), notes, status, null));
        log.info("Session {} metadata patched (status={}, notes {})", session.getId(), status, notes != null ? "set" : "unchanged");
        return patched;
    }

    public Optional<ValidationSession> findSession(String invoiceId) {
        return sessionRepository.findByInvoiceId(invoiceId);
    }

    public Optional<LineItemValidation> findLineItem(String sessionId, int itemIndex) {
        return lineItemValidationRepository.findBySessionIdAndItemIndex(sessionId, itemIndex);
    }

    public Optional<LineItemValidation> findLineItemById(String lineItemValidationId) {
        return lineItemValidationRepository.findById(lineItemValidationId);
    }

    public Optional<ValidationTrace> getValidationTrace(String invoiceId) {
        return sessionRepository.findByInvoiceId(invoiceId).map(session -> new ValidationTrace(
                session,
                executionRepository.findBySessionIdOrderByExecutionOrderAsc(session.getId()),
                lineItemValidationRepository.findBySessionIdOrderByItemIndexAsc(session.getId()),
                explanationRepository.findBySessionIdOrderByItemIndexAscVersionAsc(session.getId())));
    }

    private static <T> T write(String what, Supplier<T> action) {
        try {
            return action.get();
        } catch (OptimisticLockingFailureException e) {
            throw e;
        } catch (DataAccessException | IllegalStateException e) {
            log.error("Audit write failed: {}", what, e);
            throw new AuditWriteException("Audit write failed: " + what, e);
        }
    }

    public record SessionStart(ValidationSession session, boolean created) {
    }
}
