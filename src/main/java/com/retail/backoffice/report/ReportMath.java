package com.retail.backoffice.report;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rounding and safe-division rules used across every report. A zero denominator
 * always yields zero.
 */
public final class ReportMath {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TEN_THOUSAND = BigDecimal.valueOf(10_000);

    private ReportMath() {
    }

    public static BigDecimal money(BigDecimal value) {
        return value == null ? BigDecimal.ZERO.setScale(2) : value.setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal divide(BigDecimal numerator, BigDecimal denominator) {
        if (numerator == null || denominator == null || denominator.signum() == 0)
            return BigDecimal.ZERO.setScale(2);
        return numerator.divide(denominator, 2, RoundingMode.HALF_UP);
    }

    public static BigDecimal divide(BigDecimal numerator, long denominator) {
        return divide(numerator, BigDecimal.valueOf(denominator));
    }

    /** round(value / total x 10000) / 100, i.e. a percentage with two decimals. */
    public static BigDecimal percent(BigDecimal value, BigDecimal total) {
        if (value == null || total == null || total.signum() == 0)
            return BigDecimal.ZERO.setScale(2);
        return value.multiply(TEN_THOUSAND)
                .divide(total, 0, RoundingMode.HALF_UP)
                .divide(HUNDRED, 2, RoundingMode.UNNECESSARY);
    }

    public static BigDecimal percent(long value, long total) {
        return percent(BigDecimal.valueOf(value), BigDecimal.valueOf(total));
    }

    /**
     * Shares of a partition. The rounding residual goes to the largest member so a
     * non-empty partition adds up to exactly 100.00; an all-zero partition stays at zero.
     */
    public static Map<String, BigDecimal> shares(Map<String, BigDecimal> values) {
        BigDecimal total = values.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        Map<String, BigDecimal> shares = new LinkedHashMap<>();
        String largest = null;
        BigDecimal largestValue = null;
        BigDecimal sum = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : values.entrySet()) {
            BigDecimal share = percent(entry.getValue(), total);
            shares.put(entry.getKey(), share);
            sum = sum.add(share);
            if (largestValue == null || entry.getValue().compareTo(largestValue) > 0) {
                largest = entry.getKey();
                largestValue = entry.getValue();
            }
        }
        if (total.signum() > 0 && largest != null) {
            BigDecimal residual = HUNDRED.setScale(2).subtract(sum);
            shares.put(largest, shares.get(largest).add(residual));
        }
        return shares;
    }
}
