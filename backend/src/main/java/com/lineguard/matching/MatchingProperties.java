package com.lineguard.matching;

import com.lineguard.domain.MatchMethod;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog matcher tuning. Documented in application.yml under lineguard.matching.
 */
@ConfigurationProperties(prefix = "lineguard.matching")
@Getter
@Setter
public class MatchingProperties {

    /**
     * Strategies tried in order; the first one that yields a candidate decides. NONE is ignored.
     */
    private List<MatchMethod> strategies = new ArrayList<>(List.of(MatchMethod.EXACT, MatchMethod.SYNONYM, MatchMethod.FUZZY));

    /**
     * Confidence reported for an exact normalized-name hit.
     */
    private double exactConfidence = 0.98;

    /**
     * Minimum token-set similarity for a non-identical synonym to count.
     */
    private double synonymMinSimilarity = 0.85;

    /**
     * Minimum token-set similarity against canonical names for a fuzzy match.
     */
    private double fuzzyThreshold = 0.86;

    /**
     * Upper bound on fuzzy confidence so fuzzy hits never outrank exact ones.
     */
    private double fuzzyConfidenceCap = 0.95;
}
