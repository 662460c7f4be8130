package com.lineguard.pipeline;

/**
 * Opaque legitimacy score in [0, 1] from the classification service. available=false means neither a live
 * nor a cached score could be obtained.
 */
public record ClassificationScore(Double score, boolean available, String source) {

    public static ClassificationScore of(double score, String source) {
        return new ClassificationScore(Math.max(0.0, Math.min(1.0, score)), true, source);
    }

    public static ClassificationScore unavailable(String reason) {
        return new ClassificationScore(null, false, reason);
    }
}
