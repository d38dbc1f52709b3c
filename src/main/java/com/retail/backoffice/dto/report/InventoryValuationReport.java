package com.retail.backoffice.dto.report;

import com.retail.backoffice.report.AbcClass;
import com.retail.backoffice.report.ProductValuation;
import com.retail.backoffice.report.ReportMath;
import com.retail.backoffice.report.ReportWarning;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record InventoryValuationReport(
        LocalDateTime generatedAt,
        Summary summary,
        Breakdown breakdown,
        List<AbcTier> abcAnalysis,
        List<CategoryValuation> categories,
        List<ProductValuation> valuation,
        List<ReportWarning> warnings,
        String error) {

    public record Summary(int totalProducts, long totalStockCount, BigDecimal totalCostValue,
            BigDecimal totalRetailValue, BigDecimal totalPotentialProfit, BigDecimal avgProfitMargin) {
    }

    public record Breakdown(long outOfStock, long lowStock, long overstocked, long belowMinimum, long healthy) {
    }

    public record AbcTier(AbcClass tier, long productCount, BigDecimal retailValue, BigDecimal valuePercentage) {
    }

    public record CategoryValuation(String category, long productCount, long stock, BigDecimal costValue,
            BigDecimal retailValue) {
    }

    public static InventoryValuationReport empty(LocalDateTime generatedAt, String error) {
        BigDecimal zero = ReportMath.money(BigDecimal.ZERO);
        return new InventoryValuationReport(generatedAt, new Summary(0, 0, zero, zero, zero, zero),
                new Breakdown(0, 0, 0, 0, 0), List.of(), List.of(), List.of(), List.of(), error);
    }
}
