package com.lineguard.proposal;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Safety scan configuration. Documented in application.yml under lineguard.safety-scan.
 */
@ConfigurationProperties(prefix = "lineguard.safety-scan")
@Getter
@Setter
public class SafetyScanProperties {

    /**
     * Operational switch. When false a scan request fails fast with SAFETY_SCAN_DISABLED.
     */
    private boolean enabled = true;

    /**
     * Line items created within this many days count as usage.
     */
    private int usageWindowDays = 90;

    /**
     * Usage count at which an item without a price band is reported.
     */
    private long missingBandUsageThreshold = 20;

    /**
     * Observed prices needed before a missing-band proposal carries a suggested range.
     */
    private int minSamplesForSuggestion = 5;

    /**
     * Orphan synonyms at or above this weight propose a new canonical item; below it, removal.
     */
    private double orphanHighConfidence = 0.8;
}
