package com.retail.backoffice.report;

import com.retail.backoffice.model.OrderStatus;
import com.retail.backoffice.model.SalesOrder;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Recency/Frequency/Monetary scoring for a single customer. Depends only on that
 * customer's own order history.
 */
@Component
public class CustomerSegmentation {

    static final int MIN_ORDERS_FOR_PREDICTION = 3;

    private final TimeBucketer bucketer;

    public CustomerSegmentation(TimeBucketer bucketer) {
        this.bucketer = bucketer;
    }

    public RfmProfile profile(List<SalesOrder> customerOrders, LocalDateTime nowUtc) {
        List<SalesOrder> purchases = customerOrders.stream()
                .filter(o -> OrderStatus.from(o.getStatus()).map(OrderStatus::isRevenueBearing).orElse(false))
                .sorted(Comparator.comparing(SalesOrder::getCreatedAt))
                .collect(Collectors.toList());

        BigDecimal gross = BigDecimal.ZERO;
        for (SalesOrder order : purchases) {
            gross = gross.add(order.getTotal());
        }
        BigDecimal refunds = BigDecimal.ZERO;
        for (SalesOrder order : customerOrders) {
            if (OrderStatus.from(order.getStatus()).map(OrderStatus::isRefund).orElse(false))
                refunds = refunds.add(order.getTotal().abs());
        }
        BigDecimal netSpend = gross.subtract(refunds).max(BigDecimal.ZERO);

        Long daysSinceLast = null;
        double ordersPer30Days = 0;
        if (!purchases.isEmpty()) {
            LocalDateTime first = purchases.get(0).getCreatedAt();
            LocalDateTime last = purchases.get(purchases.size() - 1).getCreatedAt();
            long daysSinceFirst = Math.max(0, ChronoUnit.DAYS.between(first, nowUtc));
            daysSinceLast = Math.max(0, ChronoUnit.DAYS.between(last, nowUtc));
            ordersPer30Days = purchases.size() / Math.max(1.0, daysSinceFirst / 30.0);
        }

        int recency = recencyScore(daysSinceLast);
        int frequency = frequencyScore(ordersPer30Days);
        int monetary = monetaryScore(netSpend);
        int total = recency + frequency + monetary;
        CustomerSegment segment = CustomerSegment.fromScore(total);
        int churnRisk = churnRisk(recency, frequency, segment);

        BigDecimal avgOrderValue = ReportMath.divide(gross, purchases.size());
        BigDecimal lifetimeValue = avgOrderValue
                .multiply(BigDecimal.valueOf(ordersPer30Days))
                .multiply(BigDecimal.valueOf(12))
                .multiply(BigDecimal.valueOf(100 - churnRisk))
                .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);

        return new RfmProfile(recency, frequency, monetary, total, segment, churnRisk, daysSinceLast,
                Math.round(ordersPer30Days * 100) / 100.0, ReportMath.money(netSpend), lifetimeValue,
                predictNextPurchase(purchases));
    }

    public static int monetaryScore(BigDecimal netSpend) {
        double spend = netSpend == null ? 0 : netSpend.doubleValue();
        if (spend > 10000)
            return 5;
        if (spend > 5000)
            return 4;
        if (spend > 2000)
            return 3;
        if (spend > 500)
            return 2;
        return 1;
    }

    public static int frequencyScore(double ordersPer30Days) {
        if (ordersPer30Days > 4)
            return 5;
        if (ordersPer30Days > 2)
            return 4;
        if (ordersPer30Days > 1)
            return 3;
        if (ordersPer30Days > 0.5)
            return 2;
        return 1;
    }

    // No purchase at all scores like the stalest customer
    public static int recencyScore(Long daysSinceLastOrder) {
        if (daysSinceLastOrder == null)
            return 1;
        if (daysSinceLastOrder <= 7)
            return 5;
        if (daysSinceLastOrder <= 30)
            return 4;
        if (daysSinceLastOrder <= 90)
            return 3;
        if (daysSinceLastOrder <= 180)
            return 2;
        return 1;
    }

    public static int churnRisk(int recencyScore, int frequencyScore, CustomerSegment segment) {
        int risk = 0;
        if (recencyScore == 1)
            risk += 40;
        else if (recencyScore == 2)
            risk += 20;
        else if (recencyScore == 3)
            risk += 10;

        if (frequencyScore == 1)
            risk += 30;
        else if (frequencyScore == 2)
            risk += 15;

        if (segment == CustomerSegment.AT_RISK)
            risk += 20;
        else if (segment == CustomerSegment.LOST)
            risk += 30;

        return Math.min(100, risk);
    }

    /**
     * Last purchase plus the average gap between consecutive purchases; needs at
     * least three purchases (two gaps). The date is in the business zone.
     */
    LocalDate predictNextPurchase(List<SalesOrder> purchasesByDate) {
        if (purchasesByDate.size() < MIN_ORDERS_FOR_PREDICTION)
            return null;
        long totalSeconds = 0;
        for (int i = 1; i < purchasesByDate.size(); i++) {
            totalSeconds += Duration.between(purchasesByDate.get(i - 1).getCreatedAt(),
                    purchasesByDate.get(i).getCreatedAt()).getSeconds();
        }
        long averageGapSeconds = totalSeconds / (purchasesByDate.size() - 1);
        LocalDateTime predictedUtc = purchasesByDate.get(purchasesByDate.size() - 1).getCreatedAt()
                .plusSeconds(averageGapSeconds);
        return bucketer.toLocal(predictedUtc).toLocalDate();
    }
}
