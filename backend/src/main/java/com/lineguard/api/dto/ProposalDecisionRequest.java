package com.lineguard.api.dto;

import jakarta.validation.constraints.Size;

public record ProposalDecisionRequest(@Size(max = 2000) String note) {
}
