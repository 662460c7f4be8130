package com.lineguard.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PriceStatisticsTest {

    private static List<BigDecimal> prices(String... values) {
        return Arrays.stream(values).map(BigDecimal::new).toList();
    }

    @Test
    @DisplayName("percentile interpolates between neighbours")
    void percentileInterpolates() {
        List<BigDecimal> sorted = prices("10", "20", "30", "40", "50");
        assertThat(PriceStatistics.percentile(sorted, 0.5)).isEqualByComparingTo("30");
        assertThat(PriceStatistics.percentile(sorted, 0.25)).isEqualByComparingTo("20");
        assertThat(PriceStatistics.percentile(sorted, 0.1)).isEqualByComparingTo("14.00");
        assertThat(PriceStatistics.percentile(sorted, 1.0)).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("percentile of one sample is that sample")
    void percentileSingle() {
        assertThat(PriceStatistics.percentile(prices("7.5"), 0.9)).isEqualByComparingTo("7.5");
    }

    @Test
    @DisplayName("percentile of empty sample is rejected")
    void percentileEmpty() {
        assertThatThrownBy(() -> PriceStatistics.percentile(List.of(), 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("mean and coefficient of variation")
    void meanAndCv() {
        List<BigDecimal> values = prices("10", "10", "10");
        assertThat(PriceStatistics.mean(values)).isEqualByComparingTo("10");
        assertThat(PriceStatistics.coefficientOfVariation(values)).isZero();
        assertThat(PriceStatistics.coefficientOfVariation(prices("5", "15"))).isCloseTo(0.5, within(1e-9));
        assertThat(PriceStatistics.coefficientOfVariation(prices("5"))).isZero();
    }
}
