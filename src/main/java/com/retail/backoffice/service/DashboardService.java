package com.retail.backoffice.service;

import com.retail.backoffice.dto.report.BreakdownRow;
import com.retail.backoffice.dto.report.DailySalesReport;
import com.retail.backoffice.dto.report.DashboardSummary;
import com.retail.backoffice.dto.report.InventoryValuationReport;
import com.retail.backoffice.dto.report.LowStockReport;
import com.retail.backoffice.dto.report.PaymentAnalyticsReport;
import com.retail.backoffice.dto.report.SalesSummary;
import com.retail.backoffice.dto.report.SalesTrendReport;
import com.retail.backoffice.model.PaymentMethod;
import com.retail.backoffice.model.SalesChannel;
import com.retail.backoffice.report.ReportDefaults;
import com.retail.backoffice.report.ReportError;
import com.retail.backoffice.report.ReportMath;
import com.retail.backoffice.report.ReportResult;
import com.retail.backoffice.report.ReportWarning;
import com.retail.backoffice.report.Severity;
import com.retail.backoffice.report.TimeBucketer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class DashboardService {

    private static final Logger logger = LoggerFactory.getLogger(DashboardService.class);

    public static final String REPORT_UNAVAILABLE = "REPORT_UNAVAILABLE";
    public static final String SETTINGS_UNAVAILABLE = "SETTINGS_UNAVAILABLE";

    static final int PAYMENT_WINDOW_DAYS = 7;
    static final int TREND_WEEKS = 4;
    static final int CRITICAL_ITEMS = 5;
    static final int ALERT_ITEM_NAMES = 3;
    static final BigDecimal HIGH_REFUND_RATE = BigDecimal.valueOf(10);
    static final BigDecimal HIGH_CASH_SHARE = BigDecimal.valueOf(70);
    static final BigDecimal LOW_ONLINE_SHARE = BigDecimal.valueOf(20);

    private final ReportService reportService;
    private final SettingsService settingsService;
    private final TimeBucketer bucketer;

    public DashboardService(ReportService reportService, SettingsService settingsService, TimeBucketer bucketer) {
        this.reportService = reportService;
        this.settingsService = settingsService;
        this.bucketer = bucketer;
    }

    /**
     * Builds the dashboard. With {@code managerView} the payment, channel, trend and
     * valuation sections are computed as well; otherwise they are left out.
     */
    public ReportResult<DashboardSummary> dashboard(boolean managerView) {
        LocalDateTime generatedAt = bucketer.nowUtc();
        List<ReportWarning> warnings = new ArrayList<>();
        String companyName = SettingsService.DEFAULT_COMPANY_NAME;
        String currencySymbol = SettingsService.DEFAULT_CURRENCY_SYMBOL;
        int threshold = ReportDefaults.DEFAULT_LOW_STOCK_THRESHOLD;
        try {
            companyName = settingsService.getCompanyName();
            currencySymbol = settingsService.getCurrencySymbol();
            threshold = settingsService.getLowStockThreshold();
        } catch (DataAccessException e) {
            logger.warn("Dashboard settings unavailable, using defaults: {}", e.getMessage());
            warnings.add(new ReportWarning(SETTINGS_UNAVAILABLE, "Settings could not be read; defaults were used",
                    Severity.LOW, 0));
        }

        try {
            return ReportResult.ok(compose(managerView, generatedAt, companyName, currencySymbol, threshold,
                    warnings));
        } catch (RuntimeException e) {
            logger.error("dashboard degraded, composition failed", e);
            String message = "Dashboard composition failed: " + e.getMessage();
            return ReportResult.degraded(DashboardSummary.empty(generatedAt, companyName, currencySymbol, message),
                    new ReportError("dashboard", ReportError.Kind.COMPUTATION_FAILED, message));
        }
    }

    private DashboardSummary compose(boolean managerView, LocalDateTime generatedAt, String companyName,
            String currencySymbol, int threshold, List<ReportWarning> warnings) {
        LocalDate today = bucketer.today();
        Map<String, Boolean> status = new LinkedHashMap<>();

        ReportResult<DailySalesReport> daily = track("dailySales", reportService.dailySales(today), status,
                warnings);
        ReportResult<LowStockReport> lowStock = track("lowStock", reportService.lowStock(threshold), status,
                warnings);
        ReportResult<InventoryValuationReport> inventory = null;
        ReportResult<PaymentAnalyticsReport> payment = null;
        ReportResult<SalesTrendReport> trend = null;
        if (managerView) {
            inventory = track("inventory", reportService.inventoryValuation(), status, warnings);
            payment = track("payment", reportService.paymentAnalytics(today.minusDays(PAYMENT_WINDOW_DAYS), today),
                    status, warnings);
            trend = track("trend", reportService.salesTrend("weekly", TREND_WEEKS), status, warnings);
        }

        DailySalesReport dailyReport = daily.getReport();
        LowStockReport lowStockReport = lowStock.getReport();
        SalesSummary todaySummary = dailyReport.summary();
        BigDecimal zero = ReportMath.money(BigDecimal.ZERO);

        DashboardSummary.Today todayOverview = new DashboardSummary.Today(todaySummary.netRevenue(),
                todaySummary.completedOrders(), todaySummary.avgOrderValue(), todaySummary.totalItems(),
                todaySummary.totalRefunds());
        DashboardSummary.InventoryOverview inventoryOverview = new DashboardSummary.InventoryOverview(
                inventory != null ? inventory.getReport().summary().totalRetailValue() : zero,
                lowStockReport.summary().totalLowStock(),
                lowStockReport.summary().outOfStock(),
                inventory != null ? inventory.getReport().breakdown().healthy() : 0);

        DashboardSummary.PaymentOverview paymentOverview = null;
        DashboardSummary.ChannelOverview channelOverview = null;
        if (payment != null) {
            PaymentAnalyticsReport paymentReport = payment.getReport();
            paymentOverview = new DashboardSummary.PaymentOverview(paymentReport.insights().topPaymentMethod(),
                    share(paymentReport.paymentSummary(), PaymentMethod.CASH.getCode()),
                    share(paymentReport.paymentSummary(), PaymentMethod.UPI.getCode()),
                    share(paymentReport.paymentSummary(), PaymentMethod.CARD.getCode()),
                    paymentReport.insights().digitalAdoption());
            channelOverview = new DashboardSummary.ChannelOverview(
                    share(paymentReport.channelSummary(), SalesChannel.ONLINE.getCode()),
                    share(paymentReport.channelSummary(), SalesChannel.OFFLINE.getCode()),
                    paymentReport.insights().topChannel());
        }

        DashboardSummary.Analytics analytics = managerView
                ? new DashboardSummary.Analytics(dailyReport.paymentInsights().split(),
                        dailyReport.channelInsights().split(), dailyReport.hourlyBreakdown(),
                        trend.getReport().trend(), dailyReport.topProducts())
                : new DashboardSummary.Analytics(List.of(), List.of(), List.of(), List.of(),
                        dailyReport.topProducts());

        List<LowStockReport.Item> critical = lowStockReport.products().stream()
                .filter(p -> "critical".equals(p.urgency()) || "high".equals(p.urgency()))
                .limit(CRITICAL_ITEMS)
                .collect(Collectors.toList());
        DashboardSummary.Alerts alerts = new DashboardSummary.Alerts(critical, stockAlerts(lowStockReport),
                daily.isDegraded() ? List.of() : performanceAlerts(todaySummary),
                performanceStatus(todaySummary.netRevenue()));

        List<DashboardSummary.Recommendation> recommendations = managerView
                ? recommendations(dailyReport, lowStockReport, payment != null ? payment.getReport() : null)
                : List.of();

        return new DashboardSummary(generatedAt, companyName, currencySymbol,
                new DashboardSummary.Overview(todayOverview, inventoryOverview, paymentOverview, channelOverview),
                analytics, alerts, recommendations, status, warnings, null);
    }

    private <T> ReportResult<T> track(String name, ReportResult<T> result, Map<String, Boolean> status,
            List<ReportWarning> warnings) {
        status.put(name, !result.isDegraded());
        result.getError().ifPresent(error -> warnings.add(new ReportWarning(REPORT_UNAVAILABLE,
                name + " report unavailable: " + error.message(), Severity.MEDIUM, 0)));
        return result;
    }

    static String performanceStatus(BigDecimal netRevenue) {
        if (netRevenue.compareTo(BigDecimal.valueOf(10000)) > 0)
            return "excellent";
        if (netRevenue.compareTo(BigDecimal.valueOf(5000)) > 0)
            return "good";
        if (netRevenue.compareTo(BigDecimal.valueOf(2000)) > 0)
            return "average";
        return "needs_attention";
    }

    static List<DashboardSummary.Alert> stockAlerts(LowStockReport lowStock) {
        List<DashboardSummary.Alert> alerts = new ArrayList<>();
        List<String> outOfStock = namesWithUrgency(lowStock, "critical");
        List<String> criticallyLow = namesWithUrgency(lowStock, "high");
        if (!outOfStock.isEmpty()) {
            alerts.add(new DashboardSummary.Alert("critical", outOfStock.size() + " items are out of stock",
                    outOfStock.stream().limit(ALERT_ITEM_NAMES).collect(Collectors.toList()), "high"));
        }
        if (!criticallyLow.isEmpty()) {
            alerts.add(new DashboardSummary.Alert("warning", criticallyLow.size() + " items are critically low",
                    criticallyLow.stream().limit(ALERT_ITEM_NAMES).collect(Collectors.toList()), "medium"));
        }
        return alerts;
    }

    static List<DashboardSummary.Alert> performanceAlerts(SalesSummary today) {
        List<DashboardSummary.Alert> alerts = new ArrayList<>();
        if (today.netRevenue().signum() == 0) {
            alerts.add(new DashboardSummary.Alert("warning", "No sales recorded today", List.of(), "high"));
        }
        BigDecimal refundRate = ReportMath.percent(today.refundedOrders(), Math.max(1L, today.completedOrders()));
        if (refundRate.compareTo(HIGH_REFUND_RATE) > 0) {
            alerts.add(new DashboardSummary.Alert("warning", "High refund rate: " + refundRate + "%", List.of(),
                    "medium"));
        }
        return alerts;
    }

    private static List<DashboardSummary.Recommendation> recommendations(DailySalesReport daily,
            LowStockReport lowStock, PaymentAnalyticsReport payment) {
        List<DashboardSummary.Recommendation> recommendations = new ArrayList<>();
        if (payment != null
                && share(payment.paymentSummary(), PaymentMethod.CASH.getCode()).compareTo(HIGH_CASH_SHARE) > 0) {
            recommendations.add(new DashboardSummary.Recommendation("payment", "high",
                    "Promote digital payments with instant discounts", "Increase digital payment share by 15-20%",
                    "7 days"));
        }
        int outOfStock = namesWithUrgency(lowStock, "critical").size();
        if (outOfStock > 0) {
            recommendations.add(new DashboardSummary.Recommendation("inventory", "high",
                    "Reorder " + outOfStock + " critical items immediately", "Prevent lost sales", "immediate"));
        }
        if (daily.summary().totalOrders() > 0
                && daily.channelInsights().onlinePercentage().compareTo(LOW_ONLINE_SHARE) < 0) {
            recommendations.add(new DashboardSummary.Recommendation("channel", "medium",
                    "Boost online presence with social media campaigns", "Increase online orders by 25%",
                    "30 days"));
        }
        return recommendations;
    }

    private static List<String> namesWithUrgency(LowStockReport lowStock, String urgency) {
        return lowStock.products().stream()
                .filter(p -> urgency.equals(p.urgency()))
                .map(LowStockReport.Item::name)
                .collect(Collectors.toList());
    }

    private static BigDecimal share(List<BreakdownRow> rows, String key) {
        return rows.stream()
                .filter(row -> row.key().equals(key))
                .map(BreakdownRow::percentage)
                .findFirst()
                .orElse(ReportMath.money(BigDecimal.ZERO));
    }
}
