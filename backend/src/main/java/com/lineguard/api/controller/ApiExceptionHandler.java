package com.lineguard.api.controller;

import com.lineguard.api.dto.ErrorBody;
import com.lineguard.matching.MatchingException;
import com.lineguard.pipeline.PipelineException;
import com.lineguard.pipeline.RevalidationException;
import com.lineguard.pricing.PriceValidationException;
import com.lineguard.proposal.FeedbackException;
import com.lineguard.proposal.ProposalException;
import com.lineguard.proposal.SafetyScanDisabledException;
import com.lineguard.transparency.AuditWriteException;
import com.lineguard.transparency.ValidationNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

/**
 * Maps service error codes to HTTP status with an {@link ErrorBody}: input errors 400, not found 404,
 * state conflicts 409, disabled scan 503, audit failures 500.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        List<String> details = ex.getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .sorted()
                .toList();
        String message = details.isEmpty() ? "Validation failed" : details.get(0);
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_INPUT", message, details));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleUnreadable(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_INPUT", "Malformed request: " + ex.getReason()));
    }

    @ExceptionHandler(MatchingException.class)
    public ResponseEntity<ErrorBody> handleMatching(MatchingException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(PriceValidationException.class)
    public ResponseEntity<ErrorBody> handlePricing(PriceValidationException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorBody> handlePipeline(PipelineException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(RevalidationException.class)
    public ResponseEntity<ErrorBody> handleRevalidation(RevalidationException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(FeedbackException.class)
    public ResponseEntity<ErrorBody> handleFeedback(FeedbackException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ProposalException.class)
    public ResponseEntity<ErrorBody> handleProposal(ProposalException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ValidationNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(ValidationNotFoundException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(SafetyScanDisabledException.class)
    public ResponseEntity<ErrorBody> handleScanDisabled(SafetyScanDisabledException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(AuditWriteException.class)
    public ResponseEntity<ErrorBody> handleAudit(AuditWriteException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    static HttpStatus statusFor(String errorCode) {
        return switch (errorCode) {
            case "INVALID_INPUT", "INVALID_PRICE", "EMPTY_BATCH", "BATCH_TOO_LARGE" -> HttpStatus.BAD_REQUEST;
            case "VALIDATION_NOT_FOUND", "LINE_NOT_FOUND", "PROPOSAL_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "ALREADY_TERMINAL", "REVALIDATION_LIMIT_REACHED", "INVALID_TRANSITION", "CONCURRENT_UPDATE",
                 "PROPOSAL_ALREADY_DECIDED", "NOTHING_TO_APPLY" -> HttpStatus.CONFLICT;
            case "SAFETY_SCAN_DISABLED" -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ErrorBody> respond(String errorCode, String message) {
        HttpStatus status = statusFor(errorCode);
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", errorCode, message);
        } else {
            log.debug("Request rejected with {}: {}", errorCode, message);
        }
        return ResponseEntity.status(status).body(ErrorBody.of(errorCode, message));
    }
}
