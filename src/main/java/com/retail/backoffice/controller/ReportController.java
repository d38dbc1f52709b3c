package com.retail.backoffice.controller;

import com.retail.backoffice.dto.ApiResponse;
import com.retail.backoffice.dto.report.ChannelPerformanceReport;
import com.retail.backoffice.dto.report.CustomerHistoryReport;
import com.retail.backoffice.dto.report.DailySalesReport;
import com.retail.backoffice.dto.report.DashboardSummary;
import com.retail.backoffice.dto.report.ExportParameters;
import com.retail.backoffice.dto.report.InventoryValuationReport;
import com.retail.backoffice.dto.report.LowStockReport;
import com.retail.backoffice.dto.report.PaymentAnalyticsReport;
import com.retail.backoffice.dto.report.ReportExport;
import com.retail.backoffice.dto.report.SalesTrendReport;
import com.retail.backoffice.report.ExportFormat;
import com.retail.backoffice.report.ExportType;
import com.retail.backoffice.report.ReportResult;
import com.retail.backoffice.report.TrendPeriod;
import com.retail.backoffice.service.DashboardService;
import com.retail.backoffice.service.ReportExportService;
import com.retail.backoffice.service.ReportService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only report endpoints. Parameters are range-checked here; the report itself is
 * always answered with 200, degraded reports are flagged in the metadata and the
 * {@value #STATUS_HEADER} header.
 */
@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ReportController.class);

    public static final String STATUS_HEADER = "X-Report-Status";

    private static final String ADMIN_ROLE = "ROLE_ADMIN";
    private static final Set<String> MANAGER_ROLES = Set.of(ADMIN_ROLE, "ROLE_MANAGER");

    private final ReportService reportService;
    private final DashboardService dashboardService;
    private final ReportExportService exportService;

    public ReportController(ReportService reportService, DashboardService dashboardService,
            ReportExportService exportService) {
        this.reportService = reportService;
        this.dashboardService = dashboardService;
        this.exportService = exportService;
    }

    @GetMapping("/sales/daily")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'STAFF')")
    public ResponseEntity<ApiResponse<DailySalesReport>> dailySales(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return respond("Daily sales report", reportService.dailySales(date));
    }

    @GetMapping("/analytics/payment")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<PaymentAnalyticsReport>> paymentAnalytics(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return respond("Payment analytics report", reportService.paymentAnalytics(startDate, endDate));
    }

    @GetMapping("/analytics/channels")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<ChannelPerformanceReport>> channelPerformance(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return respond("Channel performance report", reportService.channelPerformance(startDate, endDate));
    }

    @GetMapping("/inventory/low-stock")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'STAFF')")
    public ResponseEntity<ApiResponse<LowStockReport>> lowStock(@RequestParam(required = false) Integer threshold) {
        checkRange("threshold", threshold, 0, 1000);
        return respond("Low stock report", reportService.lowStock(threshold));
    }

    @GetMapping("/customers/history")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<CustomerHistoryReport>> customerHistory(
            @RequestParam(required = false) Long customerId,
            @RequestParam(required = false) Integer limit) {
        checkRange("limit", limit, 1, 1000);
        return respond("Customer history report", reportService.customerHistory(customerId, limit));
    }

    @GetMapping("/sales/trend")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<SalesTrendReport>> salesTrend(
            @RequestParam(defaultValue = "weekly") String period,
            @RequestParam(required = false) Integer weeks) {
        TrendPeriod.from(period);
        checkRange("weeks", weeks, 1, 104);
        return respond("Sales trend report", reportService.salesTrend(period, weeks));
    }

    @GetMapping("/inventory/valuation")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<InventoryValuationReport>> inventoryValuation() {
        return respond("Inventory valuation report", reportService.inventoryValuation());
    }

    @GetMapping("/dashboard")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'STAFF')")
    public ResponseEntity<ApiResponse<DashboardSummary>> dashboard(Authentication authentication) {
        boolean managerView = authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(MANAGER_ROLES::contains);
        return respond("Dashboard", dashboardService.dashboard(managerView));
    }

    /**
     * Downloads any report as JSON or CSV. Cost, profit, margin and price fields are
     * only included for admins.
     */
    @GetMapping("/export/{type}")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<?> export(@PathVariable String type,
            @RequestParam(defaultValue = "json") String format,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer threshold,
            @RequestParam(required = false) Long customerId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String period,
            @RequestParam(required = false) Integer weeks,
            Authentication authentication) {
        ExportType exportType = ExportType.from(type);
        ExportFormat exportFormat = ExportFormat.from(format);
        checkRange("threshold", threshold, 0, 1000);
        checkRange("limit", limit, 1, 1000);
        checkRange("weeks", weeks, 1, 104);
        if (period != null)
            TrendPeriod.from(period);
        boolean fullAccess = authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(ADMIN_ROLE::equals);

        ReportExport export = exportService.export(exportType, exportFormat,
                new ExportParameters(startDate, endDate, threshold, customerId, limit, period, weeks), fullAccess);
        String status = export.isDegraded() ? "degraded" : "ok";

        if (exportFormat == ExportFormat.CSV) {
            return ResponseEntity.ok()
                    .header(STATUS_HEADER, status)
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            ContentDisposition.attachment().filename(export.fileName()).build().toString())
                    .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                    .body(export.csv());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("format", exportFormat.getCode());
        metadata.put("type", exportType.getCode());
        metadata.put("fileName", export.fileName());
        metadata.put("degraded", export.isDegraded());
        if (export.isDegraded())
            metadata.put("errorKind", export.error().kind());
        return ResponseEntity.ok()
                .header(STATUS_HEADER, status)
                .body(ApiResponse.of(exportType.getCode() + " report exported successfully", export.report(),
                        metadata));
    }

    private static void checkRange(String name, Integer value, int min, int max) {
        if (value != null && (value < min || value > max))
            throw new IllegalArgumentException(name + " must be between " + min + " and " + max);
    }

    private <T> ResponseEntity<ApiResponse<T>> respond(String title, ReportResult<T> result) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("degraded", result.isDegraded());
        if (result.isDegraded()) {
            result.getError().ifPresent(error -> {
                metadata.put("reportType", error.reportType());
                metadata.put("errorKind", error.kind());
                logger.warn("Serving degraded {} report: {}", error.reportType(), error.message());
            });
            return ResponseEntity.ok()
                    .header(STATUS_HEADER, "degraded")
                    .body(ApiResponse.of(title + " generated with errors", result.getReport(), metadata));
        }
        return ResponseEntity.ok()
                .header(STATUS_HEADER, "ok")
                .body(ApiResponse.of(title + " generated successfully", result.getReport(), metadata));
    }
}
