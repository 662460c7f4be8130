package com.lineguard.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stage names written to agent_executions.
 */
public enum PipelineStage {
    PRE_VALIDATION("pre_validation"),
    ITEM_MATCHING("item_matching"),
    CLASSIFICATION("classification"),
    PRICE_VALIDATION("price_validation"),
    FINAL_DECISION("final_decision"),
    EXPLANATION("explanation"),
    CONTEXT_CHECK("context_check"),
    HUMAN_REVIEW("human_review");

    private final String stageName;

    PipelineStage(String stageName) {
        this.stageName = stageName;
    }

    @JsonValue
    public String stageName() {
        return stageName;
    }
}
