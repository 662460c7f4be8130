package com.lineguard.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reference used to judge a unit price.
 */
public enum PriceValidationMethod {
    CANONICAL("canonical"),
    EXTERNAL("external"),
    NO_REFERENCE("no_reference");

    private final String wireName;

    PriceValidationMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
