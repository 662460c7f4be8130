package com.lineguard.pricing;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Inclusive [min, max] unit-price range.
 */
public record ExpectedRange(BigDecimal min, BigDecimal max) {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public BigDecimal midpoint() {
        return min.add(max).divide(TWO, MathContext.DECIMAL64);
    }

    public boolean contains(BigDecimal price) {
        return price.compareTo(min) >= 0 && price.compareTo(max) <= 0;
    }

    /**
     * |price - midpoint| / midpoint * 100, two decimals, never negative. A zero midpoint gives 0 for a zero
     * price and 100 otherwise.
     */
    public BigDecimal variancePercent(BigDecimal price) {
        BigDecimal mid = midpoint();
        if (mid.signum() == 0) {
            return price.signum() == 0 ? BigDecimal.ZERO.setScale(2) : BigDecimal.valueOf(100).setScale(2);
        }
        return price.subtract(mid).abs()
                .divide(mid.abs(), MathContext.DECIMAL64)
                .multiply(BigDecimal.valueOf(100))
                .setScale(2, RoundingMode.HALF_UP);
    }
}
