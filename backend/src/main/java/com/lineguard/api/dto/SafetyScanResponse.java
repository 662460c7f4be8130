package com.lineguard.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lineguard.proposal.SafetyScanReport;

import java.time.Instant;
import java.util.List;

/**
 * POST /api/v1/safety-scan response; issue keys are snake_case on the wire.
 */
public record SafetyScanResponse(Issues issues,
                                 List<String> warnings,
                                 List<String> errors,
                                 int proposalsCreated,
                                 Instant scannedAt) {

    public record Issues(@JsonProperty("bands_fixed") int bandsFixed,
                         @JsonProperty("bands_missing") int bandsMissing,
                         @JsonProperty("orphans") int orphans,
                         @JsonProperty("conflicts") int conflicts) {
    }

    public static SafetyScanResponse of(SafetyScanReport report) {
        SafetyScanReport.Issues i = report.issues();
        return new SafetyScanResponse(new Issues(i.bandsFixed(), i.bandsMissing(), i.orphans(), i.conflicts()),
                report.warnings(), report.errors(), report.proposalsCreated(), report.scannedAt());
    }
}
