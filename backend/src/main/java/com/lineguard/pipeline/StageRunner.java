package com.lineguard.pipeline;

import com.lineguard.domain.ExecutionStatus;
import com.lineguard.domain.PipelineStage;
import com.lineguard.transparency.AuditWriteException;
import com.lineguard.transparency.StageRecord;
import com.lineguard.transparency.TransparencyRecorder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Times one pipeline stage and appends it to the session trace. The execution is written after the work
 * finishes, so every stored execution has an end time; a failed stage is recorded as FAILED and rethrown.
 */
@Component
@RequiredArgsConstructor
public class StageRunner {

    private final TransparencyRecorder recorder;

    public <T> T run(String sessionId,
                     Integer itemIndex,
                     PipelineStage stage,
                     Map<String, Object> input,
                     Supplier<T> work,
                     Function<T, Map<String, Object>> output,
                     Function<T, Double> confidence) {
        Instant start = Instant.now();
        T result;
        try {
            result = work.get();
        } catch (RuntimeException e) {
            try {
                recorder.recordExecution(sessionId, new StageRecord(stage, itemIndex, start, Instant.now(),
                        input, Map.of(), null, ExecutionStatus.FAILED, e.getMessage()));
            } catch (AuditWriteException auditFailure) {
                auditFailure.addSuppressed(e);
                throw auditFailure;
            }
            throw e;
        }
        recorder.recordExecution(sessionId, new StageRecord(stage, itemIndex, start, Instant.now(),
                input, output.apply(result), confidence.apply(result), ExecutionStatus.COMPLETED, null));
        return result;
    }

    /**
     * Records a stage that was considered and deliberately not run.
     */
    public void skip(String sessionId, Integer itemIndex, PipelineStage stage,
                     Map<String, Object> input, Map<String, Object> output) {
        Instant now = Instant.now();
        recorder.recordExecution(sessionId, new StageRecord(stage, itemIndex, now, now,
                input, output, null, ExecutionStatus.SKIPPED, null));
    }
}
