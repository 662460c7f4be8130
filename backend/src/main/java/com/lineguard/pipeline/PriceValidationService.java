package com.lineguard.pipeline;

import com.lineguard.common.OrderedBatch;
import com.lineguard.config.AsyncConfig;
import com.lineguard.pricing.PriceValidationException;
import com.lineguard.pricing.PriceValidationResult;
import com.lineguard.pricing.PriceValidator;
import com.lineguard.proposal.PriceOutlierProposals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Price checks for the pipeline and the price validation API. A canonical-band outlier raises a band
 * adjustment proposal whose id travels back with the result.
 */
@Service
@Slf4j
public class PriceValidationService {

    public static final String EMPTY_BATCH = "EMPTY_BATCH";
    public static final String BATCH_TOO_LARGE = "BATCH_TOO_LARGE";

    private final PriceValidator priceValidator;
    private final PriceOutlierProposals priceOutlierProposals;
    private final PipelineProperties properties;
    private final Executor executor;

    public PriceValidationService(PriceValidator priceValidator,
                                  PriceOutlierProposals priceOutlierProposals,
                                  PipelineProperties properties,
                                  @Qualifier(AsyncConfig.PIPELINE_EXECUTOR) Executor executor) {
        this.priceValidator = priceValidator;
        this.priceOutlierProposals = priceOutlierProposals;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Check for an item that already has a canonical match.
     */
    public PriceValidationResult checkMatched(String canonicalItemId, BigDecimal unitPrice, String currency, String sessionId) {
        PriceValidationResult result = priceValidator.validate(canonicalItemId, unitPrice, currency);
        return priceOutlierProposals.proposeIfOutlier(canonicalItemId, unitPrice, result, sessionId)
                .map(p -> result.withProposalId(p.getId()))
                .orElse(result);
    }

    public PriceValidationResult check(PriceCheckRequest request) {
        if (request.canonicalItemId() != null && !request.canonicalItemId().isBlank()) {
            return checkMatched(request.canonicalItemId(), request.unitPrice(), request.currency(), null);
        }
        return priceValidator.validateByName(request.itemName(), request.unitPrice(), request.currency());
    }

    /**
     * @throws PriceValidationException EMPTY_BATCH or BATCH_TOO_LARGE; per-item failures stay in the results
     */
    public PriceBatchResult checkBatch(List<PriceCheckRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new PriceValidationException(EMPTY_BATCH, "items must contain at least one entry");
        }
        if (requests.size() > properties.getMaxBatchItems()) {
            throw new PriceValidationException(BATCH_TOO_LARGE,
                    "items must contain at most " + properties.getMaxBatchItems() + " entries, got " + requests.size());
        }
        List<PriceCheckOutcome> outcomes = OrderedBatch.mapInOrder(requests,
                request -> PriceCheckOutcome.of(request.lineItemId(), check(request)),
                PriceValidationService::failed,
                executor);
        PriceBatchResult result = PriceBatchResult.of(outcomes);
        log.debug("Price batch of {} items: {} passed", result.summary().total(), result.summary().passed());
        return result;
    }

    private static PriceCheckOutcome failed(PriceCheckRequest request, Throwable ex) {
        if (ex instanceof PriceValidationException pve) {
            return PriceCheckOutcome.failed(request.lineItemId(), pve.getErrorCode(), pve.getMessage());
        }
        log.warn("Price check failed for line item {}: {}", request.lineItemId(), ex.toString());
        return PriceCheckOutcome.failed(request.lineItemId(), "PRICE_CHECK_FAILED", String.valueOf(ex.getMessage()));
    }
}
