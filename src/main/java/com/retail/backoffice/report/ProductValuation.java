package com.retail.backoffice.report;

import java.math.BigDecimal;

public record ProductValuation(
        Long id,
        String name,
        String sku,
        String category,
        BigDecimal costPrice,
        BigDecimal sellPrice,
        int stock,
        int minStockLevel,
        BigDecimal costValue,
        BigDecimal retailValue,
        BigDecimal potentialProfit,
        BigDecimal profitMargin,
        long salesLast90Days,
        BigDecimal avgMonthlySales,
        BigDecimal monthsOfStock,
        BigDecimal stockTurnover,
        StockStatus status,
        AbcClass abcClass) {

    public ProductValuation withAbcClass(AbcClass tier) {
        return new ProductValuation(id, name, sku, category, costPrice, sellPrice, stock, minStockLevel, costValue,
                retailValue, potentialProfit, profitMargin, salesLast90Days, avgMonthlySales, monthsOfStock,
                stockTurnover, status, tier);
    }
}
