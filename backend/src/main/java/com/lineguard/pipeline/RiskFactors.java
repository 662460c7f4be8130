package com.lineguard.pipeline;

/**
 * Risk factor codes attached to line item decisions.
 */
public final class RiskFactors {

    public static final String NO_CANONICAL_MATCH = "NO_CANONICAL_MATCH";
    public static final String NO_PRICE_REFERENCE = "NO_PRICE_REFERENCE";
    public static final String PRICE_OUT_OF_RANGE = "PRICE_OUT_OF_RANGE";
    public static final String PRICE_EXCEEDS_MAX = "PRICE_EXCEEDS_MAX";
    public static final String PRICE_BELOW_MIN = "PRICE_BELOW_MIN";
    public static final String QUANTITY_OVER_LIMIT = "QUANTITY_OVER_LIMIT";
    public static final String LOW_CLASSIFICATION_SCORE = "LOW_CLASSIFICATION_SCORE";
    public static final String CLASSIFICATION_UNAVAILABLE = "CLASSIFICATION_UNAVAILABLE";
    public static final String RULE_DENY = "RULE_DENY";
    public static final String RULE_ALLOW = "RULE_ALLOW";
    public static final String PRE_VALIDATION_REJECTED = "PRE_VALIDATION_REJECTED";

    private RiskFactors() {
    }
}
