package com.lineguard.api.dto;

import com.lineguard.pipeline.PriceBatchResult;

import java.util.List;

public record PriceValidationBatchResponse(boolean success,
                                           List<PriceValidationResponse> results,
                                           PriceBatchResult.Summary summary) {

    public static PriceValidationBatchResponse of(PriceBatchResult batch) {
        return new PriceValidationBatchResponse(batch.success(),
                batch.results().stream().map(PriceValidationResponse::of).toList(),
                batch.summary());
    }
}
