package com.lineguard.api.dto;

import com.lineguard.domain.ValidationHistoryPage;

import java.util.List;

public record ValidationHistoryResponse(List<SessionResponse> sessions,
                                        long total,
                                        int limit,
                                        int offset,
                                        boolean hasMore) {

    public static ValidationHistoryResponse of(ValidationHistoryPage page) {
        return new ValidationHistoryResponse(page.sessions().stream().map(SessionResponse::of).toList(),
                page.total(), page.limit(), page.offset(), page.hasMore());
    }
}
