package com.lineguard.domain;

/**
 * Data anomaly that produced a proposal. Part of the proposal dedup key.
 */
public enum AnomalyClass {
    BAND_ANOMALY,
    MISSING_BAND,
    ORPHAN_SYNONYM,
    CONFLICTING_RULE,
    PRICE_OUTLIER
}
