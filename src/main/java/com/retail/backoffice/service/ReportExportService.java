package com.retail.backoffice.service;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.retail.backoffice.dto.report.ExportParameters;
import com.retail.backoffice.dto.report.ReportExport;
import com.retail.backoffice.report.ExportFormat;
import com.retail.backoffice.report.ExportType;
import com.retail.backoffice.report.ReportResult;
import com.retail.backoffice.report.TimeBucketer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs a report through {@link ReportService} and renders it for download. Callers
 * without full access get the report with every cost, profit, margin and price field
 * removed.
 */
@Service
public class ReportExportService {

    private static final Logger logger = LoggerFactory.getLogger(ReportExportService.class);

    static final List<String> SENSITIVE_FIELDS = List.of("cost", "profit", "margin", "price");

    private final ReportService reportService;
    private final TimeBucketer bucketer;
    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema csvSchema = csvMapper.schemaFor(ExportRow.class).withHeader();

    public ReportExportService(ReportService reportService, TimeBucketer bucketer, ObjectMapper objectMapper) {
        this.reportService = reportService;
        this.bucketer = bucketer;
        // keep the scale of money values, 50.00 must not become 5E+1
        this.objectMapper = objectMapper.copy().setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
    }

    public ReportExport export(ExportType type, ExportFormat format, ExportParameters parameters,
            boolean fullAccess) {
        ReportResult<?> result = run(type, parameters);
        JsonNode report = objectMapper.valueToTree(result.getReport());
        if (!fullAccess)
            removeSensitiveFields(report);

        String fileName = type.getCode() + "-report-" + bucketer.today().format(DateTimeFormatter.BASIC_ISO_DATE)
                + "." + format.getCode();
        String csv = format == ExportFormat.CSV ? toCsv(report) : null;
        logger.info("Exported {} report as {} (full access: {}, degraded: {})", type.getCode(), format.getCode(),
                fullAccess, result.isDegraded());
        return new ReportExport(type, format, fileName, report, csv, result.getError().orElse(null));
    }

    private ReportResult<?> run(ExportType type, ExportParameters parameters) {
        switch (type) {
            case DAILY_SALES:
                return reportService.dailySales(parameters.startDate());
            case PAYMENT_ANALYTICS:
                return reportService.paymentAnalytics(parameters.startDate(), parameters.endDate());
            case CHANNEL_PERFORMANCE:
                return reportService.channelPerformance(parameters.startDate(), parameters.endDate());
            case INVENTORY:
                return reportService.lowStock(parameters.threshold());
            case CUSTOMERS:
                return reportService.customerHistory(parameters.customerId(), parameters.limit());
            case SALES_TREND:
                return reportService.salesTrend(parameters.period(), parameters.weeks());
            case INVENTORY_VALUATION:
                return reportService.inventoryValuation();
            default:
                throw new IllegalArgumentException("Unsupported report type: " + type);
        }
    }

    static void removeSensitiveFields(JsonNode node) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = ((ObjectNode) node).fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (isSensitive(field.getKey()))
                    fields.remove();
                else
                    removeSensitiveFields(field.getValue());
            }
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                removeSensitiveFields(child);
            }
        }
    }

    private static boolean isSensitive(String fieldName) {
        String name = fieldName.toLowerCase(Locale.ROOT);
        return SENSITIVE_FIELDS.stream().anyMatch(name::contains);
    }

    /**
     * One row per leaf value, addressed by its path in the report, e.g.
     * {@code summary.netRevenue} or {@code topProducts[0].name}.
     */
    String toCsv(JsonNode report) {
        List<ExportRow> rows = new ArrayList<>();
        flatten("", report, rows);
        try {
            return csvMapper.writer(csvSchema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not write CSV export", e);
        }
    }

    private static void flatten(String path, JsonNode node, List<ExportRow> rows) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                flatten(path.isEmpty() ? field.getKey() : path + "." + field.getKey(), field.getValue(), rows);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                flatten(path + "[" + i + "]", node.get(i), rows);
            }
        } else if (node.isNull()) {
            rows.add(new ExportRow(path, ""));
        } else if (node.isBigDecimal()) {
            rows.add(new ExportRow(path, node.decimalValue().toPlainString()));
        } else {
            rows.add(new ExportRow(path, node.asText()));
        }
    }

    @JsonPropertyOrder({ "field", "value" })
    public record ExportRow(String field, String value) {
    }
}
