package com.lineguard.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Standard error response body: error (code), message, timestamp (ISO 8601), and field-level details for
 * input errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorBody(String error, String message, Instant timestamp, List<String> details) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now(), null);
    }

    public static ErrorBody of(String error, String message, List<String> details) {
        return new ErrorBody(error, message, Instant.now(), details.isEmpty() ? null : details);
    }
}
