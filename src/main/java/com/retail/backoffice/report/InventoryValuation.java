package com.retail.backoffice.report;

import com.retail.backoffice.model.OrderItem;
import com.retail.backoffice.model.OrderStatus;
import com.retail.backoffice.model.Product;
import com.retail.backoffice.model.SalesOrder;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stock valuation, sales velocity and ABC classification per product.
 */
@Component
public class InventoryValuation {

    static final BigDecimal OVERSTOCK_MONTHS = BigDecimal.valueOf(6);
    static final BigDecimal LOW_STOCK_MONTHS = new BigDecimal("0.5");
    static final BigDecimal TIER_A_SHARE = BigDecimal.valueOf(80);
    static final BigDecimal TIER_B_SHARE = BigDecimal.valueOf(95);

    /**
     * Units sold per product across revenue-bearing orders. Lines of removed products
     * carry no product id and are skipped.
     */
    public Map<Long, Long> unitsSold(Collection<SalesOrder> orders) {
        Map<Long, Long> units = new HashMap<>();
        for (SalesOrder order : orders) {
            boolean revenue = OrderStatus.from(order.getStatus()).map(OrderStatus::isRevenueBearing).orElse(false);
            if (!revenue)
                continue;
            for (OrderItem item : order.getItems()) {
                if (item.getProduct() != null && item.getProduct().getId() != null)
                    units.merge(item.getProduct().getId(), (long) item.getQuantity(), Long::sum);
            }
        }
        return units;
    }

    /**
     * Values every product and assigns its ABC tier. The result is ordered by
     * descending retail value.
     */
    public List<ProductValuation> valuate(Collection<Product> products, Map<Long, Long> unitsSoldLast90Days) {
        List<ProductValuation> valuations = new ArrayList<>(products.size());
        for (Product product : products) {
            long sold = product.getId() != null ? unitsSoldLast90Days.getOrDefault(product.getId(), 0L) : 0L;
            valuations.add(valuate(product, sold));
        }
        return classifyAbc(valuations);
    }

    ProductValuation valuate(Product product, long unitsSold) {
        int stock = Math.max(0, product.getStock());
        BigDecimal sellPrice = product.getPrice() != null ? product.getPrice() : BigDecimal.ZERO;
        BigDecimal costPrice = product.effectiveCostPrice();
        BigDecimal units = BigDecimal.valueOf(stock);

        BigDecimal costValue = ReportMath.money(costPrice.multiply(units));
        BigDecimal retailValue = ReportMath.money(sellPrice.multiply(units));
        BigDecimal potentialProfit = retailValue.subtract(costValue);

        BigDecimal avgMonthlySales = BigDecimal.valueOf(unitsSold)
                .divide(BigDecimal.valueOf(ReportDefaults.SALES_VELOCITY_MONTHS), 4, RoundingMode.HALF_UP);
        BigDecimal monthsOfStock = avgMonthlySales.signum() == 0
                ? ReportDefaults.NO_SALES_MONTHS_OF_STOCK
                : units.divide(avgMonthlySales, 2, RoundingMode.HALF_UP);
        BigDecimal stockTurnover = stock == 0
                ? BigDecimal.ZERO.setScale(2)
                : avgMonthlySales.divide(units, 2, RoundingMode.HALF_UP);

        return new ProductValuation(product.getId(), product.getName(), product.getSku(),
                product.getCategory() != null ? product.getCategory() : ReportDefaults.UNCATEGORIZED,
                ReportMath.money(costPrice), ReportMath.money(sellPrice), stock, product.minimumStock(),
                costValue, retailValue, potentialProfit, ReportMath.percent(potentialProfit, retailValue),
                unitsSold, avgMonthlySales.setScale(2, RoundingMode.HALF_UP), monthsOfStock, stockTurnover,
                classify(stock, monthsOfStock, product.minimumStock()), null);
    }

    static StockStatus classify(int stock, BigDecimal monthsOfStock, int minStockLevel) {
        if (stock == 0)
            return StockStatus.OUT_OF_STOCK;
        if (monthsOfStock.compareTo(OVERSTOCK_MONTHS) > 0)
            return StockStatus.OVERSTOCKED;
        if (monthsOfStock.compareTo(LOW_STOCK_MONTHS) < 0)
            return StockStatus.LOW_STOCK;
        if (stock < minStockLevel)
            return StockStatus.BELOW_MINIMUM;
        return StockStatus.HEALTHY;
    }

    /**
     * Walks products by descending retail value; a product is A while the running total
     * (itself included) stays within 80% of the grand total, B within 95%, otherwise C.
     */
    public List<ProductValuation> classifyAbc(List<ProductValuation> valuations) {
        List<ProductValuation> sorted = new ArrayList<>(valuations);
        sorted.sort(Comparator.comparing(ProductValuation::retailValue).reversed()
                .thenComparing(v -> v.name() != null ? v.name() : ""));

        BigDecimal grandTotal = sorted.stream().map(ProductValuation::retailValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal running = BigDecimal.ZERO;
        List<ProductValuation> classified = new ArrayList<>(sorted.size());
        for (ProductValuation valuation : sorted) {
            running = running.add(valuation.retailValue());
            // running / grandTotal <= share / 100, without dividing
            BigDecimal scaled = running.multiply(BigDecimal.valueOf(100));
            AbcClass tier;
            if (scaled.compareTo(TIER_A_SHARE.multiply(grandTotal)) <= 0) {
                tier = AbcClass.A;
            } else if (scaled.compareTo(TIER_B_SHARE.multiply(grandTotal)) <= 0) {
                tier = AbcClass.B;
            } else {
                tier = AbcClass.C;
            }
            classified.add(valuation.withAbcClass(tier));
        }
        return classified;
    }
}
