package com.lineguard.domain;

import java.time.Instant;

/**
 * Filters and paging for the session history. Null filters are ignored; serviceLine and itemName match
 * case-insensitive substrings, itemName against the session's line items.
 */
public record ValidationHistoryQuery(Instant startDate,
                                     Instant endDate,
                                     SessionStatus status,
                                     String serviceLine,
                                     String itemName,
                                     SortField sortBy,
                                     boolean ascending,
                                     int limit,
                                     int offset) {

    public enum SortField {
        DATE("createdAt"),
        EXECUTION_TIME("executionTimeMs"),
        STATUS("overallStatus");

        private final String property;

        SortField(String property) {
            this.property = property;
        }

        public String property() {
            return property;
        }
    }
}
