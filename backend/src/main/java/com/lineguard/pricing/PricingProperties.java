package com.lineguard.pricing;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Price validation configuration. Documented in application.yml under lineguard.pricing.
 */
@ConfigurationProperties(prefix = "lineguard.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * Currency assumed when a request omits it.
     */
    private String defaultCurrency = "USD";

    /**
     * Confidence reported when a canonical price band was used.
     */
    private double canonicalConfidence = 0.90;

    /**
     * Variance (percent from the external range midpoint) still accepted when only vendor data exists.
     * 30 is the 20% review threshold widened by half for provisional ranges.
     */
    private double externalTolerancePercent = 30.0;

    /**
     * Maximum vendor observations aggregated per lookup.
     */
    private int externalSampleLimit = 20;

    /**
     * Canonical-band variance above which a PRICE_RANGE_ADJUST proposal is raised.
     */
    private double proposalVariancePercent = 20.0;
}
