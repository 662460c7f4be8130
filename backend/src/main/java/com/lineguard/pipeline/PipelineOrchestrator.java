package com.lineguard.pipeline;

import com.lineguard.common.OrderedBatch;
import com.lineguard.config.AsyncConfig;
import com.lineguard.domain.FailedLine;
import com.lineguard.domain.LineItemStatus;
import com.lineguard.domain.LineItemValidation;
import com.lineguard.domain.PipelineStage;
import com.lineguard.domain.SessionStatus;
import com.lineguard.domain.ValidationDecision;
import com.lineguard.domain.ValidationSession;
import com.lineguard.matching.CatalogMatcher;
import com.lineguard.matching.MatchResult;
import com.lineguard.matching.MatchingException;
import com.lineguard.pricing.PriceValidationException;
import com.lineguard.pricing.PriceValidationResult;
import com.lineguard.transparency.AuditWriteException;
import com.lineguard.transparency.ExplanationGenerator;
import com.lineguard.transparency.OverallStatus;
import com.lineguard.transparency.Snapshots;
import com.lineguard.transparency.TransparencyRecorder;
import com.lineguard.transparency.ValidationTrace;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Runs an invoice through pre-validation, matching, classification, price validation, decision and explanation.
 * Items are processed concurrently and independently; every stage is appended to the session trace.
 */
@Service
@Slf4j
public class PipelineOrchestrator {

    static final String NOT_RECORDED = "NOT_RECORDED";

    private final PreValidator preValidator;
    private final CatalogMatcher catalogMatcher;
    private final PriceValidationService priceValidationService;
    private final ItemClassifier itemClassifier;
    private final DecisionPolicy decisionPolicy;
    private final ExplanationGenerator explanationGenerator;
    private final TransparencyRecorder recorder;
    private final StageRunner stages;
    private final Validator validator;
    private final PipelineProperties properties;
    private final Executor executor;

    public PipelineOrchestrator(PreValidator preValidator,
                                CatalogMatcher catalogMatcher,
                                PriceValidationService priceValidationService,
                                ItemClassifier itemClassifier,
                                DecisionPolicy decisionPolicy,
                                ExplanationGenerator explanationGenerator,
                                TransparencyRecorder recorder,
                                StageRunner stages,
                                Validator validator,
                                PipelineProperties properties,
                                @Qualifier(AsyncConfig.PIPELINE_EXECUTOR) Executor executor) {
        this.preValidator = preValidator;
        this.catalogMatcher = catalogMatcher;
        this.priceValidationService = priceValidationService;
        this.itemClassifier = itemClassifier;
        this.decisionPolicy = decisionPolicy;
        this.explanationGenerator = explanationGenerator;
        this.recorder = recorder;
        this.stages = stages;
        this.validator = validator;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Validates all items of an invoice. An invoice already validated is returned from storage.
     *
     * @throws PipelineException     INVALID_INPUT without invoiceId
     * @throws PriceValidationException EMPTY_BATCH or BATCH_TOO_LARGE for the item count
     * @throws AuditWriteException   when the session itself cannot be recorded
     */
    public InvoiceValidationResult validateInvoice(InvoiceSubmission submission) {
        if (submission.invoiceId() == null || submission.invoiceId().isBlank()) {
            throw new PipelineException(PipelineException.INVALID_INPUT, "invoiceId is required");
        }
        List<LineItem> items = submission.items();
        if (items == null || items.isEmpty()) {
            throw new PriceValidationException(PriceValidationService.EMPTY_BATCH, "items must contain at least one entry");
        }
        if (items.size() > properties.getMaxBatchItems()) {
            throw new PriceValidationException(PriceValidationService.BATCH_TOO_LARGE,
                    "items must contain at most " + properties.getMaxBatchItems() + " entries, got " + items.size());
        }

        long start = System.currentTimeMillis();
        TransparencyRecorder.SessionStart started = recorder.recordSession(
                submission.invoiceId(), submission.serviceLineName(), submission.notes(), items.size());
        ValidationSession session = started.session();
        if (!started.created() && session.getOverallStatus() != SessionStatus.PENDING) {
            log.info("Invoice {} already validated in session {}; returning stored result", submission.invoiceId(), session.getId());
            return replay(session);
        }

        List<Integer> indexes = IntStream.range(0, items.size()).boxed().toList();
        List<LineResult> lines = OrderedBatch.mapInOrder(indexes,
                index -> processItem(session.getId(), index, items.get(index)),
                (index, ex) -> failedLine(index, items.get(index), ex),
                executor);

        List<ValidationDecision> decisions = lines.stream().filter(LineResult::success).map(LineResult::decision).toList();
        List<FailedLine> failedLines = lines.stream()
                .filter(l -> !l.success())
                .map(l -> FailedLine.of(l.itemIndex(), l.lineItemId(), l.errorCode(), l.reason(), l.errors()))
                .toList();
        int failed = failedLines.size();
        SessionStatus overall = OverallStatus.of(decisions, failed);
        long elapsed = System.currentTimeMillis() - start;
        recorder.completeSession(session.getId(), overall, elapsed, failedLines);
        log.info("Invoice {} validated in {} ms: {} ({} items, {} failed)",
                submission.invoiceId(), elapsed, overall, lines.size(), failed);
        return new InvoiceValidationResult(session.getId(), submission.invoiceId(), failed == 0, overall, elapsed,
                lines, InvoiceValidationResult.Summary.of(lines), false);
    }

    LineResult processItem(String sessionId, int index, LineItem item) {
        Set<ConstraintViolation<LineItem>> violations = validator.validate(item);
        if (!violations.isEmpty()) {
            List<String> errors = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .toList();
            return LineResult.invalid(index, item.lineItemId(), errors);
        }

        LineItemValidation created = newValidation(sessionId, index, item);
        created.advanceTo(LineItemStatus.NEW);
        created.advanceTo(LineItemStatus.AWAITING_MATCH);
        LineItemValidation v = recorder.recordLineItemValidation(created);
        if (v.getStatus() != LineItemStatus.AWAITING_MATCH) {
            return LineResult.of(v);
        }

        PreValidationResult screening = null;
        if (preValidator.isEnabled()) {
            screening = stages.run(sessionId, index, PipelineStage.PRE_VALIDATION,
                    Snapshots.of("itemName", item.name(), "itemDescription", item.description()),
                    () -> preValidator.check(item.name(), item.description()),
                    LineItemUpdates::preValidationSnapshot,
                    PreValidationResult::score);
        }
        boolean preRejected = screening != null && screening.isRejected();

        MatchResult match = stages.run(sessionId, index, PipelineStage.ITEM_MATCHING,
                Snapshots.of("itemName", item.name(), "itemDescription", item.description()),
                () -> catalogMatcher.match(item.name(), item.description()).withLineItemId(item.lineItemId()),
                m -> Snapshots.of("canonicalItemId", m.canonicalItemId(), "canonicalName", m.canonicalName(),
                        "method", m.method(), "confidence", m.confidence()),
                MatchResult::confidence);
        v.setCanonicalItemId(match.canonicalItemId());
        v.setCanonicalName(match.canonicalName());
        v.setMatchMethod(match.method());
        v.setMatchConfidence(match.confidence());
        v.advanceTo(match.isMatch() ? LineItemStatus.MATCHED : LineItemStatus.AWAITING_INGEST);

        ClassificationScore classification = null;
        PriceValidationResult price = null;
        if (match.isMatch() && !preRejected) {
            if (properties.isLlmEnabled()) {
                classification = stages.run(sessionId, index, PipelineStage.CLASSIFICATION,
                        Snapshots.of("itemName", item.name(), "type", item.type()),
                        () -> itemClassifier.classify(item),
                        c -> Snapshots.of("score", c.score(), "available", c.available(), "source", c.source()),
                        ClassificationScore::score);
                v.setClassificationScore(classification.score());
            }
            price = stages.run(sessionId, index, PipelineStage.PRICE_VALIDATION,
                    Snapshots.of("canonicalItemId", match.canonicalItemId(), "unitPrice", item.unitPrice(), "currency", item.currency()),
                    () -> priceValidationService.checkMatched(match.canonicalItemId(), item.unitPrice(), item.currency(), sessionId),
                    LineItemUpdates::priceSnapshot,
                    PriceValidationResult::confidence);
            LineItemUpdates.applyPrice(v, price);
        }

        DecisionInput input = new DecisionInput(match.isMatch(), match.confidence(), item.unitPrice(), item.quantity(),
                price, classification, null, decisionPolicy.itemRule(match.canonicalItemId()).orElse(null), screening);
        DecisionOutcome outcome = stages.run(sessionId, index, PipelineStage.FINAL_DECISION,
                LineItemUpdates.decisionInputSnapshot(v, input),
                () -> decisionPolicy.decide(input),
                LineItemUpdates::decisionSnapshot,
                DecisionOutcome::confidence);
        LineItemUpdates.applyDecision(v, outcome);
        // unmatched items stay AWAITING_INGEST for catalog ingestion unless rejected outright
        if (match.isMatch() || outcome.decision() == ValidationDecision.REJECT) {
            v.advanceTo(outcome.decision().toStatus());
        }
        LineItemValidation saved = recorder.updateLineItemState(v);

        stages.run(sessionId, index, PipelineStage.EXPLANATION,
                Snapshots.of("lineItemValidationId", saved.getId(), "decision", saved.getDecision()),
                () -> recorder.recordExplanation(explanationGenerator.generate(saved)),
                e -> Snapshots.of("explanationId", e.getId(), "version", e.getVersion(), "summary", e.getSummary()),
                e -> null);
        return LineResult.of(saved);
    }

    /**
     * Rebuilds the result of the first run: every item index appears once, from the failure recorded on the
     * session for lines that failed, otherwise from the stored line item. success is that of the first run.
     */
    private InvoiceValidationResult replay(ValidationSession session) {
        Map<Integer, LineItemValidation> stored = recorder.getValidationTrace(session.getInvoiceId())
                .map(ValidationTrace::lineItems)
                .orElse(List.of())
                .stream()
                .collect(Collectors.toMap(LineItemValidation::getItemIndex, Function.identity(), (a, b) -> a));
        Map<Integer, FailedLine> failures = session.getFailedLines().stream()
                .collect(Collectors.toMap(FailedLine::getItemIndex, Function.identity(), (a, b) -> a));
        int count = Stream.of(stored.keySet(), failures.keySet())
                .flatMap(Set::stream)
                .mapToInt(i -> i + 1)
                .reduce(session.getLineCount(), Math::max);

        List<LineResult> lines = new ArrayList<>(count);
        for (int index = 0; index < count; index++) {
            LineItemValidation v = stored.get(index);
            FailedLine failure = failures.get(index);
            if (failure != null) {
                lines.add(LineResult.failed(failure));
            } else if (v != null) {
                lines.add(LineResult.of(v));
            } else {
                lines.add(LineResult.failed(index, null, NOT_RECORDED, "No outcome stored for this line"));
            }
        }
        return new InvoiceValidationResult(session.getId(), session.getInvoiceId(), failures.isEmpty(), session.getOverallStatus(),
                session.getExecutionTimeMs(), lines, InvoiceValidationResult.Summary.of(lines), true);
    }

    private static LineResult failedLine(int index, LineItem item, Throwable ex) {
        String code;
        if (ex instanceof AuditWriteException audit) {
            code = audit.getErrorCode();
        } else if (ex instanceof MatchingException me) {
            code = me.getErrorCode();
        } else if (ex instanceof PriceValidationException pve) {
            code = pve.getErrorCode();
        } else {
            code = "STAGE_FAILED";
            log.warn("Line {} failed: {}", index, ex.toString());
        }
        return LineResult.failed(index, item != null ? item.lineItemId() : null, code, Objects.toString(ex.getMessage(), code));
    }

    private static LineItemValidation newValidation(String sessionId, int index, LineItem item) {
        LineItemValidation v = new LineItemValidation();
        v.setSessionId(sessionId);
        v.setItemIndex(index);
        v.setLineItemId(item.lineItemId());
        v.setItemName(item.name());
        v.setItemDescription(item.description());
        v.setItemType(item.type());
        v.setQuantity(item.quantity());
        v.setUnitPrice(item.unitPrice());
        v.setCurrency(item.currency() != null ? item.currency().toUpperCase() : null);
        v.setUnit(item.unit());
        v.setRiskFactors(new ArrayList<>());
        return v;
    }
}
