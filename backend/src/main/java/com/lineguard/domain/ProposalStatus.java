package com.lineguard.domain;

public enum ProposalStatus {
    PENDING,
    APPROVED,
    DENIED
}
