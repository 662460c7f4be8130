package com.lineguard.domain;

import java.util.List;

/**
 * Atomic session operations that derived queries cannot express.
 */
public interface ValidationSessionRepositoryCustom {

    /**
     * Atomically increments the session's execution sequence and returns the new value.
     *
     * @throws IllegalStateException if the session does not exist
     */
    long nextExecutionOrder(String sessionId);

    /**
     * Sets the given non-null metadata fields and updatedAt without touching the execution sequence.
     *
     * @return the updated session, or null if it does not exist
     */
    ValidationSession patchMetadata(String sessionId, String notes, SessionStatus overallStatus, Long executionTimeMs);

    /**
     * Records the outcome of the first run: status, timing and the lines that failed.
     *
     * @return the updated session, or null if it does not exist
     */
    ValidationSession complete(String sessionId, SessionStatus overallStatus, long executionTimeMs, List<FailedLine> failedLines);

    /**
     * Sessions matching the query, sorted by its field with the id as tie-break.
     */
    ValidationHistoryPage findHistory(ValidationHistoryQuery query);

    /**
     * Administrative removal of a session with its executions, line item validations and explanations.
     * Not used by the pipeline.
     *
     * @return number of documents removed, session included
     */
    long deleteSessionCascade(String sessionId);
}
