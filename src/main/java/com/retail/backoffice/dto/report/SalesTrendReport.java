package com.retail.backoffice.dto.report;

import com.retail.backoffice.report.ReportMath;
import com.retail.backoffice.report.ReportWarning;

import java.math.BigDecimal;
import java.util.List;

public record SalesTrendReport(
        String period,
        DateWindow dateRange,
        List<PeriodSales> trend,
        Summary summary,
        List<ReportWarning> warnings,
        String error) {

    public record Summary(BigDecimal totalRevenue, long totalOrders, BigDecimal avgPeriodRevenue, String bestPeriod,
            BigDecimal growthRate) {
    }

    public static SalesTrendReport empty(String period, DateWindow dateRange, String error) {
        BigDecimal zero = ReportMath.money(BigDecimal.ZERO);
        return new SalesTrendReport(period, dateRange, List.of(), new Summary(zero, 0, zero, null, zero), List.of(),
                error);
    }
}
