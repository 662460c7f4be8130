package com.lineguard.pricing;

import com.lineguard.common.PriceStatistics;
import com.lineguard.domain.ExternalPriceSource;
import com.lineguard.domain.ExternalPriceSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Builds a provisional price range from vendor observations: interquartile range with 4+ samples,
 * otherwise min..max. Observations linked to the canonical item are preferred over a name search.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExternalPriceAggregator {

    static final double MAX_CONFIDENCE = 0.8;

    private final ExternalPriceSourceRepository externalPriceSourceRepository;
    private final PricingProperties properties;

    /**
     * Returns empty when there is no usable vendor data or the vendor store is unreachable.
     */
    public Optional<ExternalAggregate> aggregate(String canonicalItemId, String itemName, String currency) {
        List<BigDecimal> prices;
        try {
            prices = samples(canonicalItemId, itemName, currency);
        } catch (DataAccessException e) {
            log.warn("External price lookup failed for {} / '{}': {}", canonicalItemId, itemName, e.getMessage());
            return Optional.empty();
        }
        if (prices.isEmpty()) {
            return Optional.empty();
        }
        List<BigDecimal> sorted = prices.stream().sorted().toList();
        ExpectedRange range = sorted.size() >= 4
                ? new ExpectedRange(PriceStatistics.percentile(sorted, 0.25), PriceStatistics.percentile(sorted, 0.75))
                : new ExpectedRange(sorted.get(0), sorted.get(sorted.size() - 1));
        return Optional.of(new ExternalAggregate(range, sorted.size(), confidence(sorted)));
    }

    private List<BigDecimal> samples(String canonicalItemId, String itemName, String currency) {
        int limit = Math.max(1, properties.getExternalSampleLimit());
        List<ExternalPriceSource> sources = List.of();
        if (canonicalItemId != null) {
            sources = externalPriceSourceRepository
                    .findByCanonicalItemIdAndCurrencyAndLastPriceGreaterThanOrderByCreatedAtDesc(
                            canonicalItemId, currency, BigDecimal.ZERO, PageRequest.of(0, limit));
        }
        if (sources.isEmpty() && itemName != null && !itemName.isBlank()) {
            sources = externalPriceSourceRepository.searchByItemName(itemName, currency, limit);
        }
        return sources.stream()
                .map(ExternalPriceSource::getLastPrice)
                .filter(p -> p != null && p.signum() > 0)
                .toList();
    }

    /**
     * More samples raise confidence, dispersion lowers it; capped at MAX_CONFIDENCE.
     */
    static double confidence(List<BigDecimal> prices) {
        double base = Math.min(0.3 + 0.05 * prices.size(), 0.7);
        double cv = PriceStatistics.coefficientOfVariation(prices);
        double adjusted = cv > 0.5 ? base - 0.1 : (cv < 0.1 ? base + 0.1 : base);
        return Math.max(0.0, Math.min(MAX_CONFIDENCE, adjusted));
    }

    public record ExternalAggregate(ExpectedRange range, int sampleCount, double confidence) {
    }
}
