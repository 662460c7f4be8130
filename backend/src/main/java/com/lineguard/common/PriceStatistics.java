package com.lineguard.common;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Descriptive statistics over price samples. Inputs to percentile must be sorted ascending.
 */
public final class PriceStatistics {

    private static final MathContext MC = MathContext.DECIMAL64;

    private PriceStatistics() {
    }

    /**
     * Linear-interpolated percentile, p in [0, 1].
     */
    public static BigDecimal percentile(List<BigDecimal> sortedAscending, double p) {
        if (sortedAscending == null || sortedAscending.isEmpty()) {
            throw new IllegalArgumentException("percentile of empty sample");
        }
        if (sortedAscending.size() == 1) {
            return sortedAscending.get(0);
        }
        double rank = Math.min(1.0, Math.max(0.0, p)) * (sortedAscending.size() - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        BigDecimal lo = sortedAscending.get(lower);
        if (lower == upper) {
            return lo;
        }
        BigDecimal fraction = BigDecimal.valueOf(rank - lower);
        BigDecimal hi = sortedAscending.get(upper);
        return lo.add(hi.subtract(lo).multiply(fraction, MC), MC).setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal mean(List<BigDecimal> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("mean of empty sample");
        }
        BigDecimal sum = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(values.size()), MC);
    }

    /**
     * Population standard deviation divided by mean; 0 when the mean is 0 or there is a single sample.
     */
    public static double coefficientOfVariation(List<BigDecimal> values) {
        if (values == null || values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values).doubleValue();
        if (mean == 0.0) {
            return 0.0;
        }
        double squares = 0.0;
        for (BigDecimal v : values) {
            double d = v.doubleValue() - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / values.size()) / Math.abs(mean);
    }
}
