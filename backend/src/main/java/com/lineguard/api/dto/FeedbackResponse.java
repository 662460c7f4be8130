package com.lineguard.api.dto;

/**
 * POST /api/v1/feedback response. The feedback API is write-only; there is no read endpoint.
 */
public record FeedbackResponse(boolean success, String message) {
}
