package com.lineguard.pipeline;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline behaviour switches and decision thresholds. Documented in application.yml under lineguard.pipeline.
 * Injected into the orchestrator and the re-validation controller; nothing reads the environment directly.
 */
@ConfigurationProperties(prefix = "lineguard.pipeline")
@Getter
@Setter
public class PipelineProperties {

    /**
     * Run the classification stage (external scoring service) for matched items.
     */
    private boolean llmEnabled = false;

    /**
     * Maximum items per invoice or batch request.
     */
    private int maxBatchItems = 50;

    /**
     * Re-validation attempts per line item before it parks in AWAITING_INFO.
     */
    private int maxRevalidationAttempts = 2;

    /**
     * Upper bound on stage executions in one re-validation pass.
     */
    private int maxStagesPerRevalidation = 3;

    /**
     * Quantities above this are flagged QUANTITY_OVER_LIMIT.
     */
    private int maxQuantity = 1000;

    /**
     * A canonical-band price above maxPrice times this factor is rejected outright.
     */
    private double rejectAboveMaxFactor = 1.5;

    /**
     * A canonical-band price below minPrice times this factor is rejected outright.
     */
    private double rejectBelowMinFactor = 0.5;

    /**
     * Classification scores below this are flagged LOW_CLASSIFICATION_SCORE.
     */
    private double minClassificationScore = 0.5;

    /**
     * Floor for the confidence of an ALLOW reached through reviewer context.
     */
    private double contextApprovalConfidence = 0.85;

    /**
     * Rule-based screening that runs before catalog matching.
     */
    private PreValidation preValidation = new PreValidation();

    @Getter
    @Setter
    public static class PreValidation {

        /**
         * Run the pre_validation stage. When off, every item goes straight to matching.
         */
        private boolean enabled = true;

        /**
         * Normalized names shorter than this are rejected.
         */
        private int minNameLength = 2;

        /**
         * Labor, fees, tax and admin charges, placeholders and personal expenses. Matched as whole words
         * against name and description; a hit rejects the item.
         */
        private List<String> blacklistedTerms = new ArrayList<>(List.of(
                "helper", "labour", "labor", "technician", "worker", "employee", "consultant", "contractor",
                "specialist", "engineer", "supervisor",
                "fees", "fee", "charges", "charge", "visit", "trip", "mileage", "travel", "overtime", "hourly",
                "daily", "weekly", "monthly",
                "tax", "gst", "vat", "hst", "pst", "sales tax", "convenience", "processing", "handling",
                "administration", "admin",
                "misc", "miscellaneous", "other", "various", "n/a", "na", "tbd", "to be determined", "--", "---",
                "test", "testing",
                "food", "beverage", "coffee", "lunch", "dinner", "personal", "clothing", "uniform", "boots",
                "gloves", "helmet"));

        /**
         * Profanity; a whole-word hit rejects the item.
         */
        private List<String> inappropriateTerms = new ArrayList<>(List.of(
                "damn", "hell", "crap", "shit", "fuck", "ass", "bitch", "bastard"));

        /**
         * Standards, dimensions and materials (regular expressions). A hit approves with 0.9.
         */
        private List<String> allowlistPatterns = new ArrayList<>(List.of(
                "ansi\\s*\\d+", "nfpa\\s*\\d+", "astm\\s*[a-z]?\\d+", "ieee\\s*\\d+",
                "\\d+/\\d+\\s*inch", "\\d+\\.\\d+\\s*inch", "\\d+\\s*mm\\b", "\\d+\\s*cm\\b",
                "npt\\s*\\d+", "bsp\\s*\\d+", "\\d+\\s*ft\\b", "\\d+\\s*feet", "\\d+\\s*meter",
                "\\d+\\s*gauge", "\\d+\\s*awg",
                "\\bcopper\\b", "\\bsteel\\b", "\\baluminum\\b", "\\bpvc\\b", "\\babs\\b", "\\bhdpe\\b"));

        /**
         * Facilities-maintenance material words. Each hit adds 0.1 to an approval starting at 0.7, capped at 0.95.
         */
        private List<String> materialKeywords = new ArrayList<>(List.of(
                "pipe", "fitting", "valve", "gasket", "seal", "bolt", "screw", "nut", "washer", "clamp", "bracket",
                "mount", "plate", "wire", "cable", "conduit", "junction", "outlet", "switch", "breaker", "fuse",
                "transformer", "motor", "pump", "fan", "filter", "screen", "grate", "drain", "vent", "duct",
                "insulation", "sealant", "adhesive", "tape", "rope", "chain", "tool", "wrench", "drill", "bit",
                "blade", "hammer", "fastener", "anchor", "stud", "beam", "post", "panel"));

        /**
         * A name consisting of just one of these words is too vague to validate.
         */
        private List<String> genericTerms = new ArrayList<>(List.of(
                "item", "thing", "stuff", "product", "material", "component", "part", "piece", "unit", "element",
                "object", "device"));
    }
}
