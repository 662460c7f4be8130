package com.lineguard.pipeline;

import com.lineguard.domain.PipelineStage;

/**
 * Upper bound on stage executions within one re-validation pass.
 */
final class StageBudget {

    private final int max;
    private int used;

    StageBudget(int max) {
        this.max = max;
    }

    void consume(PipelineStage stage) {
        if (used >= max) {
            throw new IllegalStateException("Stage budget of " + max + " exhausted before " + stage.stageName());
        }
        used++;
    }

    int used() {
        return used;
    }
}
