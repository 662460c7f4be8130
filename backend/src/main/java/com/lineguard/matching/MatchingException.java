package com.lineguard.matching;

import lombok.Getter;

/**
 * Input errors from the catalog matcher. errorCode is one of the CatalogMatcher constants.
 */
@Getter
public class MatchingException extends RuntimeException {

    private final String errorCode;

    public MatchingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
