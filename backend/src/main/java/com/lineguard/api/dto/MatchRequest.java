package com.lineguard.api.dto;

import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * POST /api/v1/items/match. Either a single item (itemName set) or a batch in items.
 */
public record MatchRequest(
        String lineItemId,
        @Size(max = 500) String itemName,
        @Size(max = 2000) String itemDescription,
        Boolean forceMatcher,
        @Size(max = 50, message = "must contain at most 50 entries") List<Item> items
) {

    public record Item(String lineItemId, String itemName, String itemDescription, Boolean forceMatcher) {
    }

    public boolean isBatch() {
        return items != null;
    }
}
