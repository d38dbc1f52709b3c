package com.retail.backoffice.dto.report;

import com.retail.backoffice.model.PaymentMethod;
import com.retail.backoffice.model.SalesChannel;
import com.retail.backoffice.report.ReportMath;
import com.retail.backoffice.report.ReportWarning;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record PaymentAnalyticsReport(
        DateWindow dateRange,
        SalesSummary summary,
        List<BreakdownRow> paymentSummary,
        List<BreakdownRow> channelSummary,
        List<DailyPaymentMix> dailyBreakdown,
        Insights insights,
        List<ReportWarning> warnings,
        String error) {

    public record DailyPaymentMix(String date, long orders, BigDecimal grossRevenue, BigDecimal netRevenue,
            Map<String, Long> methodCounts) {
    }

    public record Insights(String topPaymentMethod, String topChannel, BigDecimal digitalAdoption,
            BigDecimal cashPercentage, BigDecimal refundRate) {
    }

    public static PaymentAnalyticsReport empty(DateWindow dateRange, String error) {
        BigDecimal zero = ReportMath.money(BigDecimal.ZERO);
        return new PaymentAnalyticsReport(dateRange, SalesSummary.empty(), List.of(), List.of(), List.of(),
                new Insights(PaymentMethod.CASH.getCode(), SalesChannel.OFFLINE.getCode(), zero, zero, zero),
                List.of(), error);
    }
}
