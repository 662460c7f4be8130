package com.lineguard.domain;

import java.util.List;

/**
 * One page of sessions; total counts every session matching the filters.
 */
public record ValidationHistoryPage(List<ValidationSession> sessions, long total, int limit, int offset) {

    public boolean hasMore() {
        return total > (long) offset + sessions.size();
    }
}
