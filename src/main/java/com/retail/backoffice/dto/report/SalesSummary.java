package com.retail.backoffice.dto.report;

import com.retail.backoffice.report.GroupTotals;
import com.retail.backoffice.report.ReportMath;

import java.math.BigDecimal;

public record SalesSummary(
        long totalOrders,
        long completedOrders,
        long refundedOrders,
        long cancelledOrders,
        BigDecimal grossRevenue,
        BigDecimal totalRefunds,
        BigDecimal netRevenue,
        BigDecimal avgOrderValue,
        long totalItems,
        BigDecimal totalCost,
        BigDecimal grossProfit,
        BigDecimal grossMargin) {

    public static SalesSummary of(GroupTotals totals) {
        return new SalesSummary(totals.getOrderCount(), totals.getRevenueOrders(), totals.getRefundedOrders(),
                totals.getCancelledOrders(), ReportMath.money(totals.getGrossAmount()),
                ReportMath.money(totals.getRefundAmount()), ReportMath.money(totals.netAmount()),
                totals.avgOrderValue(), totals.getQuantity(), ReportMath.money(totals.getCost()),
                ReportMath.money(totals.profit()), totals.margin());
    }

    public static SalesSummary empty() {
        BigDecimal zero = ReportMath.money(BigDecimal.ZERO);
        return new SalesSummary(0, 0, 0, 0, zero, zero, zero, zero, 0, zero, zero, zero);
    }
}
