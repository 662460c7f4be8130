package com.lineguard.domain;

public enum SessionStatus {
    PENDING,
    ALLOW,
    NEEDS_REVIEW,
    REJECT,
    ERROR
}
