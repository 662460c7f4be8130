package com.lineguard.pipeline;

import com.lineguard.domain.ItemType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Invoice line as submitted. Constraints are checked per item so one bad line does not fail the invoice.
 */
public record LineItem(
        @NotBlank(message = "is required") String lineItemId,
        @NotBlank(message = "is required") @ItemName @Size(max = 500) String name,
        @Size(max = 2000) String description,
        @NotNull(message = "is required") @Positive(message = "must be positive") BigDecimal quantity,
        @NotNull(message = "is required") @Positive(message = "must be positive") BigDecimal unitPrice,
        @Pattern(regexp = "[A-Za-z]{3}", message = "must be an ISO 4217 code") String currency,
        @NotBlank(message = "is required") String unit,
        @NotNull(message = "is required") ItemType type
) {
}
