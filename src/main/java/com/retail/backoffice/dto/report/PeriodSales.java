package com.retail.backoffice.dto.report;

import com.retail.backoffice.report.GroupTotals;
import com.retail.backoffice.report.ReportMath;

import java.math.BigDecimal;
import java.util.List;

public record PeriodSales(
        String period,
        long orderCount,
        BigDecimal grossRevenue,
        BigDecimal refunds,
        BigDecimal netRevenue,
        BigDecimal avgOrderValue,
        List<ProductSales> topProducts) {

    public static PeriodSales of(GroupTotals totals, List<ProductSales> topProducts) {
        return new PeriodSales(totals.getKey(), totals.getOrderCount(), ReportMath.money(totals.getGrossAmount()),
                ReportMath.money(totals.getRefundAmount()), ReportMath.money(totals.netAmount()),
                totals.avgOrderValue(), topProducts);
    }
}
