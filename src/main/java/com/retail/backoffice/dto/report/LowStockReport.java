package com.retail.backoffice.dto.report;

import com.retail.backoffice.report.ReportWarning;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record LowStockReport(
        LocalDateTime generatedAt,
        int threshold,
        Summary summary,
        List<Item> products,
        List<ReportWarning> warnings,
        String error) {

    public record Summary(long totalLowStock, long outOfStock, long criticalStock, long warningStock,
            long belowMinimum) {
    }

    public record Item(
            Long id,
            String name,
            String sku,
            String category,
            BigDecimal price,
            int stock,
            int minStockLevel,
            Integer reorderPoint,
            boolean belowMinimum,
            String urgency,
            String reorderSuggestion,
            int suggestedReorderQty) {
    }

    public static LowStockReport empty(LocalDateTime generatedAt, int threshold, String error) {
        return new LowStockReport(generatedAt, threshold, new Summary(0, 0, 0, 0, 0), List.of(), List.of(), error);
    }
}
