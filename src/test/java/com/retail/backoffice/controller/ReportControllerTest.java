package com.retail.backoffice.controller;

import com.retail.backoffice.dto.report.DailySalesReport;
import com.retail.backoffice.dto.report.DashboardSummary;
import com.retail.backoffice.dto.report.InventoryValuationReport;
import com.retail.backoffice.dto.report.LowStockReport;
import com.retail.backoffice.report.ReportError;
import com.retail.backoffice.report.ReportResult;
import com.retail.backoffice.service.DashboardService;
import com.retail.backoffice.service.ReportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class ReportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReportService reportService;
    @MockBean
    private DashboardService dashboardService;

    private final LocalDate day = LocalDate.of(2024, 3, 15);
    private final LocalDateTime now = LocalDateTime.of(2024, 3, 15, 10, 0);

    @Test
    @WithMockUser(roles = "STAFF")
    void dailySales_ShouldWrapReportInEnvelope() throws Exception {
        when(reportService.dailySales(day)).thenReturn(ReportResult.ok(DailySalesReport.empty(day, null)));

        mockMvc.perform(get("/api/reports/sales/daily").param("date", "2024-03-15"))
                .andExpect(status().isOk())
                .andExpect(header().string(ReportController.STATUS_HEADER, "ok"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.metadata.degraded").value(false))
                .andExpect(jsonPath("$.data.date").value("2024-03-15"))
                .andExpect(jsonPath("$.data.hourlyBreakdown.length()").value(24));
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void inventoryValuation_ShouldFlagDegradedReport() throws Exception {
        when(reportService.inventoryValuation()).thenReturn(ReportResult.degraded(
                InventoryValuationReport.empty(now, "Could not load report data: down"),
                new ReportError("inventory-valuation", ReportError.Kind.FETCH_FAILED,
                        "Could not load report data: down")));

        mockMvc.perform(get("/api/reports/inventory/valuation"))
                .andExpect(status().isOk())
                .andExpect(header().string(ReportController.STATUS_HEADER, "degraded"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.metadata.degraded").value(true))
                .andExpect(jsonPath("$.metadata.errorKind").value("FETCH_FAILED"))
                .andExpect(jsonPath("$.data.error").value("Could not load report data: down"));
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void paymentAnalytics_ShouldBeForbiddenForStaff() throws Exception {
        mockMvc.perform(get("/api/reports/analytics/payment"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.success").value(false));

        verify(reportService, never()).paymentAnalytics(any(), any());
    }

    @Test
    void dailySales_ShouldRequireAuthentication() throws Exception {
        mockMvc.perform(get("/api/reports/sales/daily"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void lowStock_ShouldRejectOutOfRangeThreshold() throws Exception {
        mockMvc.perform(get("/api/reports/inventory/low-stock").param("threshold", "5000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("threshold must be between 0 and 1000"))
                .andExpect(jsonPath("$.path").value("/api/reports/inventory/low-stock"));

        verifyNoInteractions(reportService);
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void lowStock_ShouldPassThresholdThrough() throws Exception {
        when(reportService.lowStock(3)).thenReturn(ReportResult.ok(LowStockReport.empty(now, 3, null)));

        mockMvc.perform(get("/api/reports/inventory/low-stock").param("threshold", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.threshold").value(3));
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void salesTrend_ShouldRejectUnknownPeriodAndWeeks() throws Exception {
        mockMvc.perform(get("/api/reports/sales/trend").param("period", "yearly"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/reports/sales/trend").param("weeks", "0"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(reportService);
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void customerHistory_ShouldRejectMalformedId() throws Exception {
        mockMvc.perform(get("/api/reports/customers/history").param("customerId", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid value for parameter 'customerId'"));
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void dailySales_ShouldRejectMalformedDate() throws Exception {
        mockMvc.perform(get("/api/reports/sales/daily").param("date", "15/03/2024"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void dashboard_ShouldUseManagerViewForManagers() throws Exception {
        when(dashboardService.dashboard(true)).thenReturn(ReportResult.ok(
                DashboardSummary.empty(now, "Corner Store", "₹", null)));

        mockMvc.perform(get("/api/reports/dashboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.companyName").value("Corner Store"));

        verify(dashboardService).dashboard(true);
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void dashboard_ShouldUseStaffViewForStaff() throws Exception {
        when(dashboardService.dashboard(false)).thenReturn(ReportResult.ok(
                DashboardSummary.empty(now, "Corner Store", "₹", null)));

        mockMvc.perform(get("/api/reports/dashboard"))
                .andExpect(status().isOk());

        verify(dashboardService).dashboard(false);
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void export_ShouldReturnJsonWithoutCostFieldsForManagers() throws Exception {
        when(reportService.inventoryValuation()).thenReturn(ReportResult.ok(InventoryValuationReport.empty(now, null)));

        mockMvc.perform(get("/api/reports/export/inventory-valuation"))
                .andExpect(status().isOk())
                .andExpect(header().string(ReportController.STATUS_HEADER, "ok"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("inventory-valuation report exported successfully"))
                .andExpect(jsonPath("$.metadata.format").value("json"))
                .andExpect(jsonPath("$.metadata.type").value("inventory-valuation"))
                .andExpect(jsonPath("$.data.summary.totalProducts").value(0))
                .andExpect(jsonPath("$.data.summary.totalCostValue").doesNotExist())
                .andExpect(jsonPath("$.data.summary.totalPotentialProfit").doesNotExist());
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void export_ShouldDownloadCsvForAdmins() throws Exception {
        when(reportService.dailySales(day)).thenReturn(ReportResult.ok(DailySalesReport.empty(day, null)));

        mockMvc.perform(get("/api/reports/export/daily-sales")
                .param("format", "csv")
                .param("startDate", "2024-03-15"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("attachment")))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("daily-sales-report-")))
                .andExpect(content().string(startsWith("field,value\n")))
                .andExpect(content().string(containsString("date,2024-03-15\n")))
                .andExpect(content().string(containsString("summary.totalCost,")))
                .andExpect(content().string(containsString("hourlyBreakdown[23].hour,23:00\n")));
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void export_ShouldRejectUnknownReportType() throws Exception {
        mockMvc.perform(get("/api/reports/export/profit-and-loss"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value(startsWith("Invalid report type. Valid types:")));

        verifyNoInteractions(reportService);
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void export_ShouldRejectUnsupportedFormat() throws Exception {
        mockMvc.perform(get("/api/reports/export/daily-sales").param("format", "pdf"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(reportService);
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void export_ShouldBeForbiddenForStaff() throws Exception {
        mockMvc.perform(get("/api/reports/export/daily-sales"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(reportService);
    }
}
