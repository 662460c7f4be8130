package com.lineguard.proposal;

import com.lineguard.domain.FeedbackAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * A reviewer's decision on one line item, optionally deciding the proposals raised for it.
 *
 * @param lineId    id of the stored line item validation
 * @param proposals proposal ids approved with APPROVE or denied with DENY; ignored for REQUEST_INFO
 */
public record FeedbackDecision(
        @NotBlank(message = "is required") String lineId,
        @NotNull(message = "is required") FeedbackAction action,
        @Size(max = 2000) String note,
        @Size(max = 50) List<String> proposals
) {
}
