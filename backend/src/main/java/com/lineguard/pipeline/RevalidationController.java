package com.lineguard.pipeline;

import com.lineguard.common.TextNormalizer;
import com.lineguard.domain.LineItemStatus;
import com.lineguard.domain.LineItemValidation;
import com.lineguard.domain.PipelineStage;
import com.lineguard.domain.ValidationDecision;
import com.lineguard.domain.ValidationSession;
import com.lineguard.pricing.PriceValidationResult;
import com.lineguard.transparency.ExplanationGenerator;
import com.lineguard.transparency.Snapshots;
import com.lineguard.transparency.TransparencyRecorder;
import com.lineguard.transparency.ValidationNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Re-validates one line item with reviewer-supplied context. Only the stages whose input changed run, at most
 * {@code maxStagesPerRevalidation} of them. The attempt counter lives on the line item, so a pass can be
 * repeated only a bounded number of times; an item still needing review at the bound parks in AWAITING_INFO.
 * Unchanged context never changes the decision.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RevalidationController {

    private final TransparencyRecorder recorder;
    private final PriceValidationService priceValidationService;
    private final DecisionPolicy decisionPolicy;
    private final ExplanationGenerator explanationGenerator;
    private final StageRunner stages;
    private final PipelineProperties properties;

    public RevalidationResult revalidate(String invoiceId, int itemIndex, String additionalContext) {
        if (additionalContext == null || additionalContext.isBlank()) {
            throw new RevalidationException(RevalidationException.INVALID_INPUT, "additionalContext is required");
        }
        ValidationSession session = recorder.findSession(invoiceId)
                .orElseThrow(() -> new ValidationNotFoundException(ValidationNotFoundException.VALIDATION_NOT_FOUND,
                        "No validation session for invoice " + invoiceId));
        LineItemValidation v = recorder.findLineItem(session.getId(), itemIndex)
                .orElseThrow(() -> new ValidationNotFoundException(ValidationNotFoundException.LINE_NOT_FOUND,
                        "No line " + itemIndex + " in invoice " + invoiceId));

        LineItemStatus status = v.getStatus();
        if (status.isTerminal()) {
            throw new RevalidationException(RevalidationException.ALREADY_TERMINAL, "Line item is already " + status);
        }
        if (!status.isReviewable()) {
            throw new RevalidationException(RevalidationException.INVALID_TRANSITION, "Line item is still " + status);
        }
        int max = properties.getMaxRevalidationAttempts();
        if (v.getRevalidationAttempts() >= max) {
            throw new RevalidationException(RevalidationException.REVALIDATION_LIMIT_REACHED,
                    "Line item used all " + max + " re-validation attempts");
        }

        String context = additionalContext.strip();
        StageBudget budget = new StageBudget(properties.getMaxStagesPerRevalidation());
        v.setRevalidationAttempts(v.getRevalidationAttempts() + 1);
        boolean atBound = v.getRevalidationAttempts() >= max;

        if (sameContext(context, v.getAdditionalContext())) {
            budget.consume(PipelineStage.CONTEXT_CHECK);
            stages.skip(session.getId(), itemIndex, PipelineStage.CONTEXT_CHECK,
                    Snapshots.of("attempt", v.getRevalidationAttempts(), "additionalContext", context),
                    Snapshots.of("decision", v.getDecision(), "reason", "additional context unchanged"));
            if (atBound && v.getDecision() == ValidationDecision.NEEDS_REVIEW) {
                v.advanceTo(LineItemStatus.AWAITING_INFO);
            }
            LineItemValidation saved = save(v);
            recorder.refreshOverallStatus(session.getId());
            log.info("Re-validation of line {} in invoice {} skipped: context unchanged (attempt {})",
                    itemIndex, invoiceId, saved.getRevalidationAttempts());
            return new RevalidationResult(LineResult.of(saved), budget.used(), saved.getRevalidationAttempts());
        }

        v.setAdditionalContext(context);
        boolean matched = v.getCanonicalItemId() != null;
        PriceValidationResult price = null;
        if (matched) {
            budget.consume(PipelineStage.PRICE_VALIDATION);
            price = stages.run(session.getId(), itemIndex, PipelineStage.PRICE_VALIDATION,
                    Snapshots.of("canonicalItemId", v.getCanonicalItemId(), "unitPrice", v.getUnitPrice(), "currency", v.getCurrency()),
                    () -> priceValidationService.checkMatched(v.getCanonicalItemId(), v.getUnitPrice(), v.getCurrency(), session.getId()),
                    LineItemUpdates::priceSnapshot,
                    PriceValidationResult::confidence);
            LineItemUpdates.applyPrice(v, price);
        }

        ClassificationScore classification = v.getClassificationScore() != null
                ? ClassificationScore.of(v.getClassificationScore(), "recorded")
                : null;
        DecisionInput input = new DecisionInput(matched, Objects.requireNonNullElse(v.getMatchConfidence(), 0.0),
                v.getUnitPrice(), v.getQuantity(), price, classification, context,
                decisionPolicy.itemRule(v.getCanonicalItemId()).orElse(null));
        budget.consume(PipelineStage.FINAL_DECISION);
        DecisionOutcome outcome = stages.run(session.getId(), itemIndex, PipelineStage.FINAL_DECISION,
                LineItemUpdates.decisionInputSnapshot(v, input),
                () -> decisionPolicy.decide(input),
                LineItemUpdates::decisionSnapshot,
                DecisionOutcome::confidence);
        LineItemUpdates.applyDecision(v, outcome);

        LineItemStatus next = outcome.decision().toStatus();
        if (next == LineItemStatus.NEEDS_REVIEW && atBound) {
            next = LineItemStatus.AWAITING_INFO;
        }
        v.advanceTo(next);
        LineItemValidation saved = save(v);

        budget.consume(PipelineStage.EXPLANATION);
        stages.run(session.getId(), itemIndex, PipelineStage.EXPLANATION,
                Snapshots.of("lineItemValidationId", saved.getId(), "decision", saved.getDecision()),
                () -> recorder.recordExplanation(explanationGenerator.generate(saved)),
                e -> Snapshots.of("explanationId", e.getId(), "version", e.getVersion(), "summary", e.getSummary()),
                e -> null);
        recorder.refreshOverallStatus(session.getId());
        log.info("Re-validated line {} in invoice {}: {} -> {} in {} stages (attempt {})",
                itemIndex, invoiceId, status, saved.getStatus(), budget.used(), saved.getRevalidationAttempts());
        return new RevalidationResult(LineResult.of(saved), budget.used(), saved.getRevalidationAttempts());
    }

    private LineItemValidation save(LineItemValidation v) {
        try {
            return recorder.updateLineItemState(v);
        } catch (OptimisticLockingFailureException e) {
            throw new RevalidationException(RevalidationException.CONCURRENT_UPDATE,
                    "Line item " + v.getId() + " was updated concurrently; reload and retry");
        }
    }

    private static boolean sameContext(String context, String previous) {
        return previous != null && TextNormalizer.normalize(context).equals(TextNormalizer.normalize(previous));
    }
}
