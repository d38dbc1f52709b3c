package com.retail.backoffice.dto.report;

import com.retail.backoffice.report.ReportWarning;

import java.time.LocalDate;
import java.util.List;

public record DailySalesReport(
        LocalDate date,
        SalesSummary summary,
        PaymentInsights paymentInsights,
        ChannelInsights channelInsights,
        List<ProductSales> topProducts,
        List<ProductSales> categoryBreakdown,
        List<HourlySales> hourlyBreakdown,
        List<OrderLine> orders,
        List<ReportWarning> warnings,
        String error) {

    public static DailySalesReport empty(LocalDate date, String error) {
        return new DailySalesReport(date, SalesSummary.empty(), PaymentInsights.empty(), ChannelInsights.empty(),
                List.of(), List.of(), HourlySales.emptyDay(), List.of(), List.of(), error);
    }
}
