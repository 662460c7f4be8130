package com.lineguard.api.dto;

import com.lineguard.domain.SessionStatus;
import com.lineguard.domain.ValidationSession;

import java.time.Instant;

public record SessionResponse(String sessionId,
                              String invoiceId,
                              String serviceLineName,
                              String notes,
                              SessionStatus overallStatus,
                              Long executionTimeMs,
                              int lineCount,
                              Instant createdAt,
                              Instant updatedAt) {

    public static SessionResponse of(ValidationSession s) {
        return new SessionResponse(s.getId(), s.getInvoiceId(), s.getServiceLineName(), s.getNotes(),
                s.getOverallStatus(), s.getExecutionTimeMs(), s.getLineCount(), s.getCreatedAt(), s.getUpdatedAt());
    }
}
