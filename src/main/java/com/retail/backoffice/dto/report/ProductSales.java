package com.retail.backoffice.dto.report;

import com.retail.backoffice.report.GroupTotals;
import com.retail.backoffice.report.ReportMath;

import java.math.BigDecimal;

public record ProductSales(
        String key,
        String name,
        String category,
        long quantity,
        long orders,
        BigDecimal revenue,
        BigDecimal cost,
        BigDecimal profit,
        BigDecimal margin) {

    public static ProductSales of(GroupTotals totals) {
        return new ProductSales(totals.getKey(), totals.getLabel(), totals.getCategory(), totals.getQuantity(),
                totals.getOrderCount(), ReportMath.money(totals.getGrossAmount()), ReportMath.money(totals.getCost()),
                ReportMath.money(totals.profit()), totals.margin());
    }
}
