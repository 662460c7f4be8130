package com.lineguard.domain;

/**
 * How a line item name was resolved to a canonical item. NONE marks a miss.
 */
public enum MatchMethod {
    EXACT,
    SYNONYM,
    FUZZY,
    NONE
}
