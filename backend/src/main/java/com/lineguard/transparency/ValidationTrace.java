package com.lineguard.transparency;

import com.lineguard.domain.AgentExecution;
import com.lineguard.domain.LineItemValidation;
import com.lineguard.domain.ValidationExplanation;
import com.lineguard.domain.ValidationSession;

import java.util.List;

/**
 * Everything recorded for one invoice: executions by executionOrder, line items by itemIndex,
 * explanations by (itemIndex, version).
 */
public record ValidationTrace(ValidationSession session,
                              List<AgentExecution> executions,
                              List<LineItemValidation> lineItems,
                              List<ValidationExplanation> explanations) {
}
