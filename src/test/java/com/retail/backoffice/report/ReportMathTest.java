package com.retail.backoffice.report;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportMathTest {

    @Test
    void percent_ShouldRoundToTwoDecimals() {
        assertEquals(new BigDecimal("33.33"), ReportMath.percent(1, 3));
        assertEquals(new BigDecimal("66.67"), ReportMath.percent(2, 3));
        assertEquals(new BigDecimal("0.00"), ReportMath.percent(5, 0));
    }

    @Test
    void divide_ShouldReturnZeroForZeroDenominator() {
        assertEquals(new BigDecimal("0.00"), ReportMath.divide(new BigDecimal("100"), 0));
        assertEquals(new BigDecimal("33.33"), ReportMath.divide(new BigDecimal("100"), 3));
    }

    @Test
    void shares_ShouldCloseToExactlyOneHundred() {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        values.put("cash", BigDecimal.ONE);
        values.put("upi", BigDecimal.ONE);
        values.put("card", BigDecimal.ONE);

        Map<String, BigDecimal> shares = ReportMath.shares(values);

        BigDecimal sum = shares.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, sum.compareTo(new BigDecimal("100.00")));
        assertEquals(new BigDecimal("33.34"), shares.get("cash"));
        assertEquals(new BigDecimal("33.33"), shares.get("upi"));
    }

    @Test
    void shares_ShouldStayZeroForEmptyPartition() {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        values.put("online", BigDecimal.ZERO);
        values.put("offline", BigDecimal.ZERO);

        Map<String, BigDecimal> shares = ReportMath.shares(values);

        assertEquals(0, shares.get("online").signum());
        assertEquals(0, shares.get("offline").signum());
    }
}
