package com.lineguard.domain;

import java.time.Instant;
import java.util.Map;

/**
 * Usage statistics over validated line items.
 */
public interface LineItemValidationRepositoryCustom {

    /**
     * Number of line items per canonical item created at or after since. Unmatched items are not counted.
     */
    Map<String, Long> countUsageByCanonicalItemSince(Instant since);
}
