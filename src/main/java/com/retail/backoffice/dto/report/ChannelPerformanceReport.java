package com.retail.backoffice.dto.report;

import com.retail.backoffice.report.ReportWarning;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record ChannelPerformanceReport(
        DateWindow dateRange,
        SalesSummary summary,
        ChannelInsights channels,
        List<DailyChannelMix> dailyTrend,
        Map<String, List<BreakdownRow>> paymentMixByChannel,
        List<ReportWarning> warnings,
        String error) {

    public record DailyChannelMix(String date, long onlineOrders, long offlineOrders, BigDecimal onlineRevenue,
            BigDecimal offlineRevenue) {
    }

    public static ChannelPerformanceReport empty(DateWindow dateRange, String error) {
        return new ChannelPerformanceReport(dateRange, SalesSummary.empty(), ChannelInsights.empty(), List.of(),
                Map.of(), List.of(), error);
    }
}
