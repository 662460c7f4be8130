package com.lineguard.pipeline;

/**
 * Scores how plausible a line item is for the invoice's service line. Implementations never block past their
 * timeout and never throw for service failures; they fall back instead.
 */
public interface ItemClassifier {

    ClassificationScore classify(LineItem item);
}
