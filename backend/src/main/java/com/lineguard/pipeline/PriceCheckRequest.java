package com.lineguard.pipeline;

import java.math.BigDecimal;

/**
 * One price check. Without canonicalItemId the check falls back to vendor data found by itemName.
 */
public record PriceCheckRequest(String lineItemId,
                                String canonicalItemId,
                                BigDecimal unitPrice,
                                String currency,
                                String itemName) {
}
