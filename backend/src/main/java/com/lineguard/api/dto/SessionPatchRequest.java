package com.lineguard.api.dto;

import com.lineguard.domain.SessionStatus;
import jakarta.validation.constraints.Size;

/**
 * PATCH /api/v1/validations/{invoiceId}. Null fields are left unchanged.
 */
public record SessionPatchRequest(@Size(max = 2000) String notes, SessionStatus overallStatus) {
}
