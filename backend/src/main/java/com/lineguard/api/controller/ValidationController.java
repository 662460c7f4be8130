package com.lineguard.api.controller;

import com.lineguard.api.dto.RevalidateRequest;
import com.lineguard.api.dto.RevalidateResponse;
import com.lineguard.api.dto.SessionPatchRequest;
import com.lineguard.api.dto.SessionResponse;
import com.lineguard.api.dto.TraceResponse;
import com.lineguard.api.dto.ValidationHistoryResponse;
import com.lineguard.domain.SessionStatus;
import com.lineguard.domain.ValidationHistoryQuery;
import com.lineguard.pipeline.InvoiceSubmission;
import com.lineguard.pipeline.InvoiceValidationResult;
import com.lineguard.pipeline.PipelineOrchestrator;
import com.lineguard.pipeline.RevalidationController;
import com.lineguard.transparency.TransparencyRecorder;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

/**
 * Invoice validation: submit, list past sessions, re-validate one line, read the trace, patch session metadata.
 */
@RestController
@RequestMapping("/api/v1/validations")
@RequiredArgsConstructor
public class ValidationController {

    private final PipelineOrchestrator pipelineOrchestrator;
    private final RevalidationController revalidationController;
    private final TransparencyRecorder transparencyRecorder;

    @PostMapping
    public ResponseEntity<InvoiceValidationResult> validate(@Valid @RequestBody InvoiceSubmission submission) {
        return ResponseEntity.ok(pipelineOrchestrator.validateInvoice(submission));
    }

    /**
     * Session history. Dates are ISO-8601 instants; sortBy is date, executionTime or status;
     * sortOrder asc or desc (default desc).
     */
    @GetMapping
    public ResponseEntity<ValidationHistoryResponse> history(
            @RequestParam(required = false) Instant startDate,
            @RequestParam(required = false) Instant endDate,
            @RequestParam(required = false) SessionStatus status,
            @RequestParam(required = false) String serviceLine,
            @RequestParam(required = false) String itemName,
            @RequestParam(defaultValue = "date") String sortBy,
            @RequestParam(defaultValue = "desc") String sortOrder,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        ValidationHistoryQuery query = new ValidationHistoryQuery(startDate, endDate, status, serviceLine, itemName,
                sortField(sortBy), ascending(sortOrder), limit, offset);
        return ResponseEntity.ok(ValidationHistoryResponse.of(transparencyRecorder.getValidationHistory(query)));
    }

    @PostMapping("/{invoiceId}/lines/{itemIndex}/revalidate")
    public ResponseEntity<RevalidateResponse> revalidate(@PathVariable String invoiceId,
                                                         @PathVariable int itemIndex,
                                                         @Valid @RequestBody RevalidateRequest request) {
        return ResponseEntity.ok(RevalidateResponse.of(
                revalidationController.revalidate(invoiceId, itemIndex, request.additionalContext())));
    }

    @GetMapping("/{invoiceId}/trace")
    public ResponseEntity<TraceResponse> trace(@PathVariable String invoiceId) {
        return transparencyRecorder.getValidationTrace(invoiceId)
                .map(t -> ResponseEntity.ok(TraceResponse.of(t)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PatchMapping("/{invoiceId}")
    public ResponseEntity<SessionResponse> patch(@PathVariable String invoiceId,
                                                 @Valid @RequestBody SessionPatchRequest request) {
        return ResponseEntity.ok(SessionResponse.of(
                transparencyRecorder.patchSessionMetadata(invoiceId, request.notes(), request.overallStatus())));
    }

    private static ValidationHistoryQuery.SortField sortField(String sortBy) {
        return switch (sortBy) {
            case "date" -> ValidationHistoryQuery.SortField.DATE;
            case "executionTime" -> ValidationHistoryQuery.SortField.EXECUTION_TIME;
            case "status" -> ValidationHistoryQuery.SortField.STATUS;
            default -> throw new ServerWebInputException("sortBy must be date, executionTime or status");
        };
    }

    private static boolean ascending(String sortOrder) {
        if ("asc".equalsIgnoreCase(sortOrder)) {
            return true;
        }
        if ("desc".equalsIgnoreCase(sortOrder)) {
            return false;
        }
        throw new ServerWebInputException("sortOrder must be asc or desc");
    }
}
