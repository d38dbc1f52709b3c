package com.retail.backoffice.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.retail.backoffice.dto.report.DateWindow;
import com.retail.backoffice.dto.report.ExportParameters;
import com.retail.backoffice.dto.report.InventoryValuationReport;
import com.retail.backoffice.dto.report.LowStockReport;
import com.retail.backoffice.dto.report.ReportExport;
import com.retail.backoffice.dto.report.SalesTrendReport;
import com.retail.backoffice.report.ExportFormat;
import com.retail.backoffice.report.ExportType;
import com.retail.backoffice.report.ReportError;
import com.retail.backoffice.report.ReportResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static com.retail.backoffice.report.ReportFixtures.bucketer;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReportExportServiceTest {

    @Mock
    private ReportService reportService;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final LocalDateTime now = LocalDateTime.of(2024, 3, 15, 10, 0);

    private ReportExportService exportService;

    @BeforeEach
    void setUp() {
        exportService = new ReportExportService(reportService, bucketer(), objectMapper);
    }

    private LowStockReport lowStock() {
        LowStockReport.Item tea = new LowStockReport.Item(3L, "Green Tea", "BEV-001", "Beverages",
                new BigDecimal("240.25"), 0, 5, 10, true, "critical", "Reorder immediately", 25);
        return new LowStockReport(now, 5, new LowStockReport.Summary(1, 1, 1, 0, 1), List.of(tea), List.of(),
                null);
    }

    @Test
    void export_ShouldHidePricesFromManagers() {
        when(reportService.lowStock(5)).thenReturn(ReportResult.ok(lowStock()));

        ReportExport export = exportService.export(ExportType.INVENTORY, ExportFormat.JSON,
                new ExportParameters(null, null, 5, null, null, null, null), false);

        JsonNode item = export.report().get("products").get(0);
        assertEquals("Green Tea", item.get("name").asText());
        assertNull(item.get("price"));
        assertEquals(25, item.get("suggestedReorderQty").asInt());
        assertEquals("inventory-report-20240315.json", export.fileName());
        assertNull(export.csv());
        assertFalse(export.isDegraded());
    }

    @Test
    void export_ShouldWriteOneCsvRowPerValueForAdmins() {
        when(reportService.lowStock(null)).thenReturn(ReportResult.ok(lowStock()));

        ReportExport export = exportService.export(ExportType.INVENTORY, ExportFormat.CSV, ExportParameters.none(),
                true);

        String csv = export.csv();
        assertTrue(csv.startsWith("field,value\n"));
        assertTrue(csv.contains("generatedAt,2024-03-15T10:00:00\n"));
        assertTrue(csv.contains("products[0].name,Green Tea\n"));
        assertTrue(csv.contains("products[0].price,240.25\n"));
        assertTrue(csv.contains("summary.outOfStock,1\n"));
        assertTrue(csv.contains("error,\n"));
        assertEquals("inventory-report-20240315.csv", export.fileName());
    }

    @Test
    void export_ShouldCarryDegradedReportAndError() {
        String message = "Could not load report data: down";
        when(reportService.inventoryValuation()).thenReturn(ReportResult.degraded(
                InventoryValuationReport.empty(now, message),
                new ReportError("inventory-valuation", ReportError.Kind.FETCH_FAILED, message)));

        ReportExport export = exportService.export(ExportType.INVENTORY_VALUATION, ExportFormat.JSON,
                ExportParameters.none(), false);

        assertTrue(export.isDegraded());
        assertEquals(ReportError.Kind.FETCH_FAILED, export.error().kind());
        assertEquals(message, export.report().get("error").asText());
        assertNull(export.report().get("summary").get("totalCostValue"));
        assertNull(export.report().get("summary").get("avgProfitMargin"));
        assertNotNull(export.report().get("summary").get("totalRetailValue"));
    }

    @Test
    void export_ShouldPassTrendParametersThrough() {
        when(reportService.salesTrend("monthly", 6)).thenReturn(ReportResult.ok(SalesTrendReport.empty("monthly",
                new DateWindow(LocalDate.of(2023, 9, 15), LocalDate.of(2024, 3, 15)), null)));

        exportService.export(ExportType.SALES_TREND, ExportFormat.JSON,
                new ExportParameters(null, null, null, null, null, "monthly", 6), true);

        verify(reportService).salesTrend("monthly", 6);
        verifyNoMoreInteractions(reportService);
    }

    @Test
    void removeSensitiveFields_ShouldMatchAnyCaseInNestedValues() throws Exception {
        JsonNode report = objectMapper.readTree("{\"summary\":{\"totalCost\":1,\"grossMargin\":2,\"netRevenue\":3},"
                + "\"rows\":[{\"unitPrice\":4,\"name\":\"Tea\",\"potentialProfit\":5}]}");

        ReportExportService.removeSensitiveFields(report);

        assertEquals("{\"summary\":{\"netRevenue\":3},\"rows\":[{\"name\":\"Tea\"}]}", report.toString());
    }

    @Test
    void exportType_ShouldRejectUnknownReport() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> ExportType.from("profit-and-loss"));

        assertTrue(error.getMessage().startsWith("Invalid report type. Valid types: daily-sales"));
        assertEquals(ExportFormat.JSON, ExportFormat.from(null));
        assertThrows(IllegalArgumentException.class, () -> ExportFormat.from("pdf"));
    }
}
