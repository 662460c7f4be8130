package com.lineguard.transparency;

import lombok.Getter;

@Getter
public class ValidationNotFoundException extends RuntimeException {

    public static final String VALIDATION_NOT_FOUND = "VALIDATION_NOT_FOUND";
    public static final String LINE_NOT_FOUND = "LINE_NOT_FOUND";

    private final String errorCode;

    public ValidationNotFoundException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
