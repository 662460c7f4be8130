package com.lineguard.proposal;

public record FeedbackResult(boolean success, String message) {
}
