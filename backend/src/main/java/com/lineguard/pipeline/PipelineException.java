package com.lineguard.pipeline;

import lombok.Getter;

/**
 * Request-level pipeline failure; per-item problems are reported in the results instead.
 */
@Getter
public class PipelineException extends RuntimeException {

    public static final String INVALID_INPUT = "INVALID_INPUT";

    private final String errorCode;

    public PipelineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
