package com.lineguard.domain;

public enum ExecutionStatus {
    COMPLETED,
    FAILED,
    SKIPPED
}
