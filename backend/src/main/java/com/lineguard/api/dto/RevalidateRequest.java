package com.lineguard.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RevalidateRequest(@NotBlank(message = "is required") @Size(max = 4000) String additionalContext) {
}
