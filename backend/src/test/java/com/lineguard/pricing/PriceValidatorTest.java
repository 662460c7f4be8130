package com.lineguard.pricing;

import com.lineguard.domain.PriceBand;
import com.lineguard.domain.PriceBandRepository;
import com.lineguard.domain.PriceValidationMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PriceValidatorTest {

    private static final String ITEM = "pvc-pipe";

    @Mock
    PriceBandRepository priceBandRepository;
    @Mock
    ExternalPriceAggregator externalPriceAggregator;

    PriceValidator validator;

    @BeforeEach
    void setUp() {
        validator = new PriceValidator(priceBandRepository, externalPriceAggregator, new PricingProperties());
    }

    private static PriceBand band(String min, String max) {
        PriceBand band = new PriceBand();
        band.setId("band-1");
        band.setCanonicalItemId(ITEM);
        band.setMinPrice(new BigDecimal(min));
        band.setMaxPrice(new BigDecimal(max));
        band.setCurrency("USD");
        band.setUpdatedAt(Instant.now());
        return band;
    }

    @Test
    @DisplayName("PVC Pipe at 10.00 inside [5.00, 15.00] is valid with zero variance")
    void pvcPipeWithinBand() {
        when(priceBandRepository.findFirstByCanonicalItemIdAndCurrencyOrderByUpdatedAtDesc(ITEM, "USD"))
                .thenReturn(Optional.of(band("5.00", "15.00")));

        PriceValidationResult result = validator.validate(ITEM, new BigDecimal("10.00"), "USD");

        assertThat(result.valid()).isTrue();
        assertThat(result.variancePercent()).isEqualByComparingTo("0");
        assertThat(result.method()).isEqualTo(PriceValidationMethod.CANONICAL);
        assertThat(result.confidence()).isEqualTo(0.90);
        assertThat(result.expectedRange().min()).isEqualByComparingTo("5.00");
        assertThat(result.expectedRange().max()).isEqualByComparingTo("15.00");
        verify(externalPriceAggregator, never()).aggregate(any(), any(), any());
    }

    @Test
    @DisplayName("price outside the band is invalid with variance from the midpoint")
    void outsideBand() {
        when(priceBandRepository.findFirstByCanonicalItemIdAndCurrencyOrderByUpdatedAtDesc(ITEM, "USD"))
                .thenReturn(Optional.of(band("5.00", "15.00")));

        PriceValidationResult result = validator.validate(ITEM, new BigDecimal("16"), "usd");

        assertThat(result.valid()).isFalse();
        assertThat(result.variancePercent()).isEqualByComparingTo("60.00");
        assertThat(result.currency()).isEqualTo("USD");
    }

    @Test
    @DisplayName("no band and no vendor data gives no_reference, invalid, zero confidence")
    void noReference() {
        when(priceBandRepository.findFirstByCanonicalItemIdAndCurrencyOrderByUpdatedAtDesc(ITEM, "USD")).thenReturn(Optional.empty());
        when(externalPriceAggregator.aggregate(ITEM, null, "USD")).thenReturn(Optional.empty());

        PriceValidationResult result = validator.validate(ITEM, new BigDecimal("10"), null);

        assertThat(result.valid()).isFalse();
        assertThat(result.method()).isEqualTo(PriceValidationMethod.NO_REFERENCE);
        assertThat(result.confidence()).isZero();
        assertThat(result.expectedRange()).isNull();
        assertThat(result.variancePercent().signum()).isZero();
    }

    @Test
    @DisplayName("inverted band is skipped in favour of vendor data")
    void invertedBandFallsThrough() {
        when(priceBandRepository.findFirstByCanonicalItemIdAndCurrencyOrderByUpdatedAtDesc(ITEM, "USD"))
                .thenReturn(Optional.of(band("20", "5")));
        when(externalPriceAggregator.aggregate(ITEM, null, "USD")).thenReturn(Optional.of(
                new ExternalPriceAggregator.ExternalAggregate(new ExpectedRange(new BigDecimal("8"), new BigDecimal("12")), 5, 0.6)));

        PriceValidationResult result = validator.validate(ITEM, new BigDecimal("12.5"), "USD");

        assertThat(result.method()).isEqualTo(PriceValidationMethod.EXTERNAL);
        assertThat(result.valid()).isTrue();
        assertThat(result.variancePercent()).isEqualByComparingTo("25.00");
        assertThat(result.sampleCount()).isEqualTo(5);
        assertThat(result.confidence()).isEqualTo(0.6);
    }

    @Test
    @DisplayName("vendor range beyond the tolerance is invalid")
    void externalBeyondTolerance() {
        when(priceBandRepository.findFirstByCanonicalItemIdAndCurrencyOrderByUpdatedAtDesc(ITEM, "USD")).thenReturn(Optional.empty());
        when(externalPriceAggregator.aggregate(ITEM, null, "USD")).thenReturn(Optional.of(
                new ExternalPriceAggregator.ExternalAggregate(new ExpectedRange(new BigDecimal("8"), new BigDecimal("12")), 5, 0.6)));

        PriceValidationResult result = validator.validate(ITEM, new BigDecimal("20"), "USD");

        assertThat(result.valid()).isFalse();
        assertThat(result.variancePercent()).isEqualByComparingTo("100.00");
    }

    @Test
    @DisplayName("validateByName uses vendor data found by name")
    void byName() {
        when(externalPriceAggregator.aggregate(null, "xsaxa", "USD")).thenReturn(Optional.empty());

        PriceValidationResult result = validator.validateByName("xsaxa", new BigDecimal("100"), "USD");

        assertThat(result.method()).isEqualTo(PriceValidationMethod.NO_REFERENCE);
        verify(priceBandRepository, never()).findFirstByCanonicalItemIdAndCurrencyOrderByUpdatedAtDesc(any(), any());
    }

    @Test
    @DisplayName("non-positive price is rejected with INVALID_PRICE")
    void invalidPrice() {
        assertThatThrownBy(() -> validator.validate(ITEM, BigDecimal.ZERO, "USD"))
                .isInstanceOf(PriceValidationException.class)
                .satisfies(e -> assertThat(((PriceValidationException) e).getErrorCode()).isEqualTo(PriceValidator.INVALID_PRICE));
        assertThatThrownBy(() -> validator.validate(ITEM, null, "USD"))
                .isInstanceOf(PriceValidationException.class);
    }

    @Test
    @DisplayName("missing canonical item id is rejected with INVALID_INPUT")
    void missingCanonicalId() {
        assertThatThrownBy(() -> validator.validate(" ", BigDecimal.TEN, "USD"))
                .isInstanceOf(PriceValidationException.class)
                .satisfies(e -> assertThat(((PriceValidationException) e).getErrorCode()).isEqualTo(PriceValidator.INVALID_INPUT));
    }
}
