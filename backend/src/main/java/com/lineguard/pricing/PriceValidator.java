package com.lineguard.pricing;

import com.lineguard.domain.PriceBand;
import com.lineguard.domain.PriceBandRepository;
import com.lineguard.domain.PriceValidationMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Checks a unit price against, in order: the canonical price band, a vendor-data aggregate, nothing
 * (no_reference, never valid). An inverted band is skipped as unusable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceValidator {

    public static final String INVALID_PRICE = "INVALID_PRICE";
    public static final String INVALID_INPUT = "INVALID_INPUT";

    private final PriceBandRepository priceBandRepository;
    private final ExternalPriceAggregator externalPriceAggregator;
    private final PricingProperties properties;

    /**
     * @throws PriceValidationException INVALID_INPUT without canonicalItemId, INVALID_PRICE for a non-positive price
     */
    public PriceValidationResult validate(String canonicalItemId, BigDecimal unitPrice, String currency) {
        if (canonicalItemId == null || canonicalItemId.isBlank()) {
            throw new PriceValidationException(INVALID_INPUT, "canonicalItemId is required");
        }
        return check(canonicalItemId, null, unitPrice, currency);
    }

    /**
     * Validation for an item that has no canonical match yet: vendor data found by name, or no_reference.
     */
    public PriceValidationResult validateByName(String itemName, BigDecimal unitPrice, String currency) {
        return check(null, itemName, unitPrice, currency);
    }

    private PriceValidationResult check(String canonicalItemId, String itemName, BigDecimal unitPrice, String currency) {
        requirePositive(unitPrice);
        String cur = currency == null || currency.isBlank() ? properties.getDefaultCurrency() : currency.strip().toUpperCase();

        if (canonicalItemId != null) {
            Optional<PriceBand> band = priceBandRepository.findFirstByCanonicalItemIdAndCurrencyOrderByUpdatedAtDesc(canonicalItemId, cur)
                    .filter(b -> b.getMinPrice() != null && b.getMaxPrice() != null);
            if (band.isPresent() && !band.get().isInverted()) {
                ExpectedRange range = new ExpectedRange(band.get().getMinPrice(), band.get().getMaxPrice());
                return new PriceValidationResult(range.contains(unitPrice), range.variancePercent(unitPrice),
                        properties.getCanonicalConfidence(), PriceValidationMethod.CANONICAL, range, cur, 1, null);
            }
            band.ifPresent(b -> log.warn("Ignoring inverted price band {} for item {}", b.getId(), canonicalItemId));
        }

        return externalPriceAggregator.aggregate(canonicalItemId, itemName, cur)
                .map(agg -> {
                    BigDecimal variance = agg.range().variancePercent(unitPrice);
                    boolean valid = agg.range().contains(unitPrice)
                            || variance.doubleValue() <= properties.getExternalTolerancePercent();
                    return new PriceValidationResult(valid, variance, agg.confidence(), PriceValidationMethod.EXTERNAL,
                            agg.range(), cur, agg.sampleCount(), null);
                })
                .orElseGet(() -> PriceValidationResult.noReference(cur));
    }

    private static void requirePositive(BigDecimal unitPrice) {
        if (unitPrice == null || unitPrice.signum() <= 0) {
            throw new PriceValidationException(INVALID_PRICE, "unitPrice must be a positive number");
        }
    }
}
