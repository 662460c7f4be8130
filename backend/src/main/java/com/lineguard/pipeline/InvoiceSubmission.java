package com.lineguard.pipeline;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * An invoice to validate. Items are validated one by one by the orchestrator, not as part of this record.
 */
public record InvoiceSubmission(
        @NotBlank(message = "is required") @Size(max = 200) String invoiceId,
        @Size(max = 200) String serviceLineName,
        @Size(max = 2000) String notes,
        List<LineItem> items
) {
}
