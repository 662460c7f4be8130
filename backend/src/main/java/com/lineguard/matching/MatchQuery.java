package com.lineguard.matching;

/**
 * One item of a batch match request.
 */
public record MatchQuery(String lineItemId, String itemName, String itemDescription, boolean forceMatcher) {
}
