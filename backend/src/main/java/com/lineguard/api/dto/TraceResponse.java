package com.lineguard.api.dto;

import com.lineguard.domain.AgentExecution;
import com.lineguard.domain.LineItemValidation;
import com.lineguard.domain.ValidationExplanation;
import com.lineguard.transparency.ValidationTrace;

import java.util.List;

/**
 * GET /api/v1/validations/{invoiceId}/trace: executions by executionOrder, line items by itemIndex,
 * explanations by item and version.
 */
public record TraceResponse(SessionResponse session,
                            List<AgentExecution> executions,
                            List<LineItemValidation> lineItems,
                            List<ValidationExplanation> explanations) {

    public static TraceResponse of(ValidationTrace trace) {
        return new TraceResponse(SessionResponse.of(trace.session()), trace.executions(), trace.lineItems(), trace.explanations());
    }
}
