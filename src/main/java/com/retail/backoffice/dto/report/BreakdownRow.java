package com.retail.backoffice.dto.report;

import com.retail.backoffice.report.GroupTotals;
import com.retail.backoffice.report.ReportMath;

import java.math.BigDecimal;

/**
 * One member of a partition (payment method, channel): order share and revenue share.
 */
public record BreakdownRow(
        String key,
        long count,
        BigDecimal grossRevenue,
        BigDecimal refundAmount,
        BigDecimal netRevenue,
        BigDecimal avgOrderValue,
        BigDecimal percentage,
        BigDecimal amountPercentage) {

    public static BreakdownRow of(GroupTotals totals, BigDecimal percentage, BigDecimal amountPercentage) {
        return new BreakdownRow(totals.getKey(), totals.getOrderCount(), ReportMath.money(totals.getGrossAmount()),
                ReportMath.money(totals.getRefundAmount()), ReportMath.money(totals.netAmount()),
                totals.avgOrderValue(), percentage, amountPercentage);
    }
}
