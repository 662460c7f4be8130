package com.lineguard.pricing;

import lombok.Getter;

@Getter
public class PriceValidationException extends RuntimeException {

    private final String errorCode;

    public PriceValidationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
