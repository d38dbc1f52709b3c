package com.retail.backoffice.report;

import com.retail.backoffice.model.OrderItem;
import com.retail.backoffice.model.OrderStatus;
import com.retail.backoffice.model.PaymentMethod;
import com.retail.backoffice.model.Product;
import com.retail.backoffice.model.SalesChannel;
import com.retail.backoffice.model.SalesOrder;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Folds validated orders into groups. Revenue-bearing orders feed gross amounts,
 * refunded orders feed refund amounts and cancelled orders are only counted.
 */
@Component
public class OrderAggregator {

    public static final String ALL = "all";

    private final TimeBucketer bucketer;

    public OrderAggregator(TimeBucketer bucketer) {
        this.bucketer = bucketer;
    }

    /**
     * Groups are returned in a stable order: chronological for time dimensions, declaration
     * order for payment methods and channels (every one present, zero-filled), and by
     * descending revenue for products and categories.
     */
    public Map<String, GroupTotals> aggregate(Collection<SalesOrder> orders, GroupingDimension dimension,
            DateRange range) {
        Map<String, GroupTotals> groups = seed(dimension, range);
        if (dimension.isItemBased()) {
            aggregateItems(orders, dimension, groups);
            return sortByRevenue(groups);
        }
        for (SalesOrder order : orders) {
            Optional<OrderStatus> status = OrderStatus.from(order.getStatus());
            if (status.isEmpty())
                continue;
            GroupTotals totals = groups.computeIfAbsent(orderKey(order, dimension), GroupTotals::new);
            totals.countOrder(status.get());
            totals.addAmount(status.get(), order.getTotal());
            if (status.get().isRevenueBearing()) {
                for (OrderItem item : order.getItems()) {
                    totals.addUnits(item.getQuantity(), itemCost(item));
                }
            }
        }
        return groups;
    }

    public Map<String, GroupTotals> aggregate(Collection<SalesOrder> orders, GroupingDimension dimension) {
        if (dimension.isTimeBased())
            throw new IllegalArgumentException("A date range is required to group by " + dimension);
        return aggregate(orders, dimension, null);
    }

    public GroupTotals totals(Collection<SalesOrder> orders) {
        return aggregate(orders, GroupingDimension.NONE).get(ALL);
    }

    private void aggregateItems(Collection<SalesOrder> orders, GroupingDimension dimension,
            Map<String, GroupTotals> groups) {
        for (SalesOrder order : orders) {
            Optional<OrderStatus> status = OrderStatus.from(order.getStatus());
            if (status.isEmpty())
                continue;
            Set<String> touched = new HashSet<>();
            for (OrderItem item : order.getItems()) {
                String key = itemKey(item, dimension);
                GroupTotals totals = groups.computeIfAbsent(key,
                        k -> new GroupTotals(k).describe(itemLabel(item, dimension), categoryOf(item)));
                if (touched.add(key)) {
                    totals.countOrder(status.get());
                }
                BigDecimal lineAmount = lineAmount(item);
                totals.addAmount(status.get(), lineAmount);
                if (status.get().isRevenueBearing()) {
                    totals.addUnits(item.getQuantity(), itemCost(item));
                }
            }
        }
    }

    private Map<String, GroupTotals> seed(GroupingDimension dimension, DateRange range) {
        Map<String, GroupTotals> groups = new LinkedHashMap<>();
        switch (dimension) {
            case NONE:
                groups.put(ALL, new GroupTotals(ALL));
                break;
            case HOUR:
            case DAY:
            case WEEK:
            case MONTH:
                if (range == null)
                    throw new IllegalArgumentException("A date range is required to group by " + dimension);
                for (String key : bucketer.bucketKeys(dimension.getGranularity(), range)) {
                    groups.put(key, new GroupTotals(key));
                }
                break;
            case PAYMENT_METHOD:
                for (PaymentMethod method : PaymentMethod.values()) {
                    groups.put(method.getCode(), new GroupTotals(method.getCode()));
                }
                break;
            case CHANNEL:
                for (SalesChannel channel : SalesChannel.values()) {
                    groups.put(channel.getCode(), new GroupTotals(channel.getCode()));
                }
                break;
            default:
                break;
        }
        return groups;
    }

    private String orderKey(SalesOrder order, GroupingDimension dimension) {
        switch (dimension) {
            case NONE:
                return ALL;
            case PAYMENT_METHOD:
                return PaymentMethod.from(order.getPaymentMethod()).getCode();
            case CHANNEL:
                return SalesChannel.of(order).getCode();
            default:
                return bucketer.key(dimension.getGranularity(), order.getCreatedAt());
        }
    }

    private String itemKey(OrderItem item, GroupingDimension dimension) {
        if (dimension == GroupingDimension.CATEGORY)
            return categoryOf(item);
        Product product = item.getProduct();
        if (product != null && product.getId() != null)
            return String.valueOf(product.getId());
        return "removed:" + item.displayName();
    }

    private String itemLabel(OrderItem item, GroupingDimension dimension) {
        return dimension == GroupingDimension.CATEGORY ? categoryOf(item) : item.displayName();
    }

    private static String categoryOf(OrderItem item) {
        Product product = item.getProduct();
        if (product == null || product.getCategory() == null || product.getCategory().isBlank())
            return ReportDefaults.UNCATEGORIZED;
        return product.getCategory();
    }

    static BigDecimal lineAmount(OrderItem item) {
        BigDecimal price = item.getPrice() != null ? item.getPrice() : BigDecimal.ZERO;
        return price.multiply(BigDecimal.valueOf(item.getQuantity()));
    }

    /**
     * Cost of a line: the product's cost price, or the default share of the price paid
     * when the product has no cost price or no longer exists.
     */
    static BigDecimal itemCost(OrderItem item) {
        BigDecimal unitCost;
        Product product = item.getProduct();
        if (product != null && product.getCostPrice() != null) {
            unitCost = product.getCostPrice();
        } else {
            BigDecimal price = item.getPrice() != null ? item.getPrice() : BigDecimal.ZERO;
            unitCost = price.multiply(ReportDefaults.DEFAULT_COST_RATIO).setScale(2, RoundingMode.HALF_UP);
        }
        return unitCost.multiply(BigDecimal.valueOf(item.getQuantity()));
    }

    private static Map<String, GroupTotals> sortByRevenue(Map<String, GroupTotals> groups) {
        List<GroupTotals> sorted = new ArrayList<>(groups.values());
        sorted.sort(Comparator.comparing(GroupTotals::getGrossAmount).reversed()
                .thenComparing(Comparator.comparingLong(GroupTotals::getQuantity).reversed())
                .thenComparing(GroupTotals::getLabel));
        Map<String, GroupTotals> ordered = new LinkedHashMap<>();
        for (GroupTotals totals : sorted) {
            ordered.put(totals.getKey(), totals);
        }
        return ordered;
    }

    public Map<String, BigDecimal> countShares(Map<String, GroupTotals> groups) {
        return ReportMath.shares(project(groups, t -> BigDecimal.valueOf(t.getOrderCount())));
    }

    public Map<String, BigDecimal> amountShares(Map<String, GroupTotals> groups) {
        return ReportMath.shares(project(groups, GroupTotals::getGrossAmount));
    }

    /**
     * The group with the most orders; ties go to the larger gross amount, then to the
     * group listed first. Falls back when no group has any order.
     */
    public String dominant(Map<String, GroupTotals> groups, String fallback) {
        GroupTotals best = null;
        for (GroupTotals totals : groups.values()) {
            if (totals.getOrderCount() == 0)
                continue;
            if (best == null
                    || totals.getOrderCount() > best.getOrderCount()
                    || (totals.getOrderCount() == best.getOrderCount()
                            && totals.getGrossAmount().compareTo(best.getGrossAmount()) > 0)) {
                best = totals;
            }
        }
        return best != null ? best.getKey() : fallback;
    }

    private static Map<String, BigDecimal> project(Map<String, GroupTotals> groups,
            Function<GroupTotals, BigDecimal> value) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        groups.forEach((key, totals) -> values.put(key, value.apply(totals)));
        return values;
    }
}
