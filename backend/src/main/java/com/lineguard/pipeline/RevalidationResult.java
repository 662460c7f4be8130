package com.lineguard.pipeline;

/**
 * @param stagesRun stage executions recorded by this pass, never more than the configured bound
 * @param attempts  re-validation attempts used by the line item so far
 */
public record RevalidationResult(LineResult line, int stagesRun, int attempts) {
}
