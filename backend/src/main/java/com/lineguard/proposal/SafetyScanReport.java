package com.lineguard.proposal;

import java.time.Instant;
import java.util.List;

/**
 * Result of one safety scan. Issue counts are detections; proposalsCreated counts only new proposals,
 * so a repeat scan over unchanged data reports the same issues and zero created.
 */
public record SafetyScanReport(Issues issues,
                               List<String> warnings,
                               List<String> errors,
                               int proposalsCreated,
                               Instant scannedAt) {

    public record Issues(int bandsFixed, int bandsMissing, int orphans, int conflicts) {
    }
}
