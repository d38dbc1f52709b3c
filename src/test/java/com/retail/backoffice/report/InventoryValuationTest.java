package com.retail.backoffice.report;

import com.retail.backoffice.model.Product;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static com.retail.backoffice.report.ReportFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class InventoryValuationTest {

    private final InventoryValuation valuation = new InventoryValuation();

    @Test
    void valuate_ShouldReportNoSalesAndNoTurnoverForEmptyShelf() {
        Product empty = product(1, "Green Tea", "Beverages", "240.00", null, 0);

        ProductValuation result = valuation.valuate(empty, 0);

        assertEquals(StockStatus.OUT_OF_STOCK, result.status());
        assertEquals(0, result.monthsOfStock().compareTo(new BigDecimal("999")));
        assertEquals(0, result.stockTurnover().signum());
        assertEquals(0, result.retailValue().signum());
    }

    @Test
    void valuate_ShouldUseDefaultCostRatioWhenCostMissing() {
        Product soap = product(1, "Soap", "Household", "100.00", null, 10);

        ProductValuation result = valuation.valuate(soap, 30);

        assertEquals(0, result.costPrice().compareTo(new BigDecimal("60.00")));
        assertEquals(0, result.costValue().compareTo(new BigDecimal("600.00")));
        assertEquals(0, result.retailValue().compareTo(new BigDecimal("1000.00")));
        assertEquals(0, result.potentialProfit().compareTo(new BigDecimal("400.00")));
        assertEquals(new BigDecimal("40.00"), result.profitMargin());
        assertEquals(0, result.avgMonthlySales().compareTo(new BigDecimal("10")));
        assertEquals(0, result.monthsOfStock().compareTo(BigDecimal.ONE));
    }

    @Test
    void classify_ShouldApplyStatusPriority() {
        assertEquals(StockStatus.OUT_OF_STOCK, InventoryValuation.classify(0, new BigDecimal("999"), 5));
        assertEquals(StockStatus.OVERSTOCKED, InventoryValuation.classify(100, new BigDecimal("10"), 5));
        assertEquals(StockStatus.LOW_STOCK, InventoryValuation.classify(4, new BigDecimal("0.4"), 5));
        assertEquals(StockStatus.BELOW_MINIMUM, InventoryValuation.classify(4, new BigDecimal("4"), 5));
        assertEquals(StockStatus.HEALTHY, InventoryValuation.classify(20, new BigDecimal("2"), 5));
    }

    @Test
    void classifyAbc_ShouldSplitByCumulativeRetailValue() {
        List<ProductValuation> result = valuation.valuate(List.of(
                product(1, "Small", "A", "1.00", null, 50),
                product(2, "Large", "A", "1.00", null, 800),
                product(3, "Medium", "A", "1.00", null, 150)), Map.of());

        assertEquals("Large", result.get(0).name());
        assertEquals(AbcClass.A, result.get(0).abcClass());
        assertEquals(AbcClass.B, result.get(1).abcClass());
        assertEquals(AbcClass.C, result.get(2).abcClass());
    }

    @Test
    void classifyAbc_ShouldPutEverythingInTierAWhenNothingHasValue() {
        List<ProductValuation> result = valuation.valuate(List.of(
                product(1, "Empty 1", "A", "1.00", null, 0),
                product(2, "Empty 2", "A", "1.00", null, 0)), Map.of());

        assertTrue(result.stream().allMatch(v -> v.abcClass() == AbcClass.A));
    }

    @Test
    void unitsSold_ShouldCountOnlyRevenueBearingOrders() {
        Product rice = product(1, "Rice", "Groceries", "50.00", null, 10);
        LocalDateTime at = nowUtc().minusDays(5);

        Map<Long, Long> units = valuation.unitsSold(List.of(
                order(1, "completed", "cash", null, at, item(rice, 3, "50.00")),
                order(2, "refunded", "cash", null, at, item(rice, 5, "50.00")),
                order(3, "cancelled", "cash", null, at, item(rice, 7, "50.00")),
                order(4, "completed", "cash", null, at, removedItem("Old Tea", 2, "10.00"))));

        assertEquals(Map.of(1L, 3L), units);
    }
}
