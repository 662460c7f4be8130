package com.lineguard.pipeline;

import com.lineguard.domain.ValidationDecision;

import java.util.List;

public record DecisionOutcome(ValidationDecision decision,
                              double confidence,
                              List<String> riskFactors,
                              String primaryReason) {
}
