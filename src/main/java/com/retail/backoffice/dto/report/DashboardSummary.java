package com.retail.backoffice.dto.report;

import com.retail.backoffice.model.PaymentMethod;
import com.retail.backoffice.model.SalesChannel;
import com.retail.backoffice.report.ReportMath;
import com.retail.backoffice.report.ReportWarning;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Landing-page overview assembled from several reports. Sections only managers see are
 * null (overview) or empty (analytics) for other roles.
 */
public record DashboardSummary(
        LocalDateTime generatedAt,
        String companyName,
        String currencySymbol,
        Overview overview,
        Analytics analytics,
        Alerts alerts,
        List<Recommendation> recommendations,
        Map<String, Boolean> reportStatus,
        List<ReportWarning> warnings,
        String error) {

    public record Overview(Today today, InventoryOverview inventory, PaymentOverview payment,
            ChannelOverview channels) {
    }

    public record Today(BigDecimal revenue, long orders, BigDecimal avgOrder, long totalItems, BigDecimal refunds) {
    }

    public record InventoryOverview(BigDecimal totalValue, long lowStockItems, long outOfStock, long healthyStock) {
    }

    public record PaymentOverview(String topMethod, BigDecimal cashPercentage, BigDecimal upiPercentage,
            BigDecimal cardPercentage, BigDecimal digitalAdoption) {
    }

    public record ChannelOverview(BigDecimal onlinePercentage, BigDecimal offlinePercentage, String dominantChannel) {
    }

    public record Analytics(List<BreakdownRow> paymentSplit, List<BreakdownRow> channelSplit,
            List<HourlySales> hourlyBreakdown, List<PeriodSales> salesTrend, List<ProductSales> topProducts) {
    }

    public record Alerts(List<LowStockReport.Item> critical, List<Alert> stockAlerts, List<Alert> performanceAlerts,
            String todayPerformance) {
    }

    public record Alert(String type, String message, List<String> items, String priority) {
    }

    public record Recommendation(String type, String priority, String action, String expectedImpact,
            String timeline) {
    }

    public static DashboardSummary empty(LocalDateTime generatedAt, String companyName, String currencySymbol,
            String error) {
        BigDecimal zero = ReportMath.money(BigDecimal.ZERO);
        Overview overview = new Overview(
                new Today(zero, 0, zero, 0, zero),
                new InventoryOverview(zero, 0, 0, 0),
                new PaymentOverview(PaymentMethod.CASH.getCode(), zero, zero, zero, zero),
                new ChannelOverview(zero, zero, SalesChannel.OFFLINE.getCode()));
        return new DashboardSummary(generatedAt, companyName, currencySymbol, overview,
                new Analytics(List.of(), List.of(), HourlySales.emptyDay(), List.of(), List.of()),
                new Alerts(List.of(), List.of(), List.of(), "needs_attention"),
                List.of(), Map.of(), List.of(), error);
    }
}
