package com.retail.backoffice.report;

import com.retail.backoffice.model.OrderStatus;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Running totals for one group of an aggregation.
 */
@Getter
public class GroupTotals {

    private final String key;
    private String label;
    private String category;

    private long orderCount;
    private long revenueOrders;
    private long refundedOrders;
    private long cancelledOrders;

    private BigDecimal grossAmount = BigDecimal.ZERO;
    private BigDecimal refundAmount = BigDecimal.ZERO;
    private long quantity;
    private BigDecimal cost = BigDecimal.ZERO;

    public GroupTotals(String key) {
        this.key = key;
        this.label = key;
    }

    GroupTotals describe(String label, String category) {
        this.label = label;
        this.category = category;
        return this;
    }

    void countOrder(OrderStatus status) {
        orderCount++;
        if (status.isRevenueBearing()) {
            revenueOrders++;
        } else if (status.isRefund()) {
            refundedOrders++;
        } else if (status == OrderStatus.CANCELLED) {
            cancelledOrders++;
        }
    }

    void addAmount(OrderStatus status, BigDecimal amount) {
        if (status.isRevenueBearing()) {
            grossAmount = grossAmount.add(amount);
        } else if (status.isRefund()) {
            refundAmount = refundAmount.add(amount.abs());
        }
    }

    void addUnits(long units, BigDecimal unitsCost) {
        quantity += units;
        cost = cost.add(unitsCost);
    }

    public BigDecimal netAmount() {
        BigDecimal net = grossAmount.subtract(refundAmount);
        return net.signum() < 0 ? BigDecimal.ZERO : net;
    }

    public BigDecimal avgOrderValue() {
        return ReportMath.divide(grossAmount, revenueOrders);
    }

    public BigDecimal profit() {
        return grossAmount.subtract(cost);
    }

    public BigDecimal margin() {
        return ReportMath.percent(profit(), grossAmount);
    }
}
