package com.lineguard.domain;

public enum FeedbackAction {
    APPROVE,
    DENY,
    REQUEST_INFO
}
