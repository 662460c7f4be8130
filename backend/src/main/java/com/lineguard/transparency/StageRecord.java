package com.lineguard.transparency;

import com.lineguard.domain.ExecutionStatus;
import com.lineguard.domain.PipelineStage;

import java.time.Instant;
import java.util.Map;

/**
 * A finished stage, ready to be appended to the session trace.
 */
public record StageRecord(PipelineStage stage,
                          Integer itemIndex,
                          Instant startTime,
                          Instant endTime,
                          Map<String, Object> input,
                          Map<String, Object> output,
                          Double confidence,
                          ExecutionStatus status,
                          String errorMessage) {
}
