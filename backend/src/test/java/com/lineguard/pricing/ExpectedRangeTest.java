package com.lineguard.pricing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class ExpectedRangeTest {

    private static ExpectedRange range(String min, String max) {
        return new ExpectedRange(new BigDecimal(min), new BigDecimal(max));
    }

    @Test
    @DisplayName("bounds are inclusive")
    void inclusiveBounds() {
        ExpectedRange r = range("5", "15");
        assertThat(r.contains(new BigDecimal("5"))).isTrue();
        assertThat(r.contains(new BigDecimal("15.00"))).isTrue();
        assertThat(r.contains(new BigDecimal("15.01"))).isFalse();
    }

    @Test
    @DisplayName("variance is never negative")
    void varianceNonNegative() {
        assertThat(range("5", "15").variancePercent(new BigDecimal("2"))).isEqualByComparingTo("80.00");
        assertThat(range("5", "15").variancePercent(new BigDecimal("18"))).isEqualByComparingTo("80.00");
    }

    @Test
    @DisplayName("zero midpoint gives 100 for a positive price")
    void zeroMidpoint() {
        assertThat(range("0", "0").variancePercent(new BigDecimal("3"))).isEqualByComparingTo("100");
        assertThat(range("0", "0").variancePercent(BigDecimal.ZERO)).isEqualByComparingTo("0");
    }
}
