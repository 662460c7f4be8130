package com.lineguard.pipeline;

import lombok.Getter;

@Getter
public class RevalidationException extends RuntimeException {

    public static final String ALREADY_TERMINAL = "ALREADY_TERMINAL";
    public static final String REVALIDATION_LIMIT_REACHED = "REVALIDATION_LIMIT_REACHED";
    public static final String INVALID_TRANSITION = "INVALID_TRANSITION";
    public static final String CONCURRENT_UPDATE = "CONCURRENT_UPDATE";
    public static final String INVALID_INPUT = "INVALID_INPUT";

    private final String errorCode;

    public RevalidationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
