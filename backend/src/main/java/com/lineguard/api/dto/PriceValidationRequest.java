package com.lineguard.api.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * POST /api/v1/items/validate-price. Either one check or a batch in items; limits are enforced by the service.
 */
public record PriceValidationRequest(
        String lineItemId,
        String canonicalItemId,
        BigDecimal unitPrice,
        String currency,
        String itemName,
        List<Item> items
) {

    public record Item(String lineItemId, String canonicalItemId, BigDecimal unitPrice, String currency, String itemName) {
    }

    public boolean isBatch() {
        return items != null;
    }
}
