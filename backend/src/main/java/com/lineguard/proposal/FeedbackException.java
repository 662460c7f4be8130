package com.lineguard.proposal;

import lombok.Getter;

@Getter
public class FeedbackException extends RuntimeException {

    public static final String INVALID_TRANSITION = "INVALID_TRANSITION";
    public static final String CONCURRENT_UPDATE = "CONCURRENT_UPDATE";
    public static final String INVALID_INPUT = "INVALID_INPUT";

    private final String errorCode;

    public FeedbackException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
