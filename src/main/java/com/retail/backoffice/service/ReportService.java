package com.retail.backoffice.service;

import com.retail.backoffice.dto.report.BreakdownRow;
import com.retail.backoffice.dto.report.ChannelInsights;
import com.retail.backoffice.dto.report.ChannelPerformanceReport;
import com.retail.backoffice.dto.report.CustomerHistoryReport;
import com.retail.backoffice.dto.report.DailySalesReport;
import com.retail.backoffice.dto.report.DateWindow;
import com.retail.backoffice.dto.report.HourlySales;
import com.retail.backoffice.dto.report.InventoryValuationReport;
import com.retail.backoffice.dto.report.LowStockReport;
import com.retail.backoffice.dto.report.OrderLine;
import com.retail.backoffice.dto.report.PaymentAnalyticsReport;
import com.retail.backoffice.dto.report.PaymentInsights;
import com.retail.backoffice.dto.report.PeriodSales;
import com.retail.backoffice.dto.report.ProductSales;
import com.retail.backoffice.dto.report.SalesSummary;
import com.retail.backoffice.dto.report.SalesTrendReport;
import com.retail.backoffice.model.Customer;
import com.retail.backoffice.model.OrderStatus;
import com.retail.backoffice.model.PaymentMethod;
import com.retail.backoffice.model.Product;
import com.retail.backoffice.model.SalesChannel;
import com.retail.backoffice.model.SalesOrder;
import com.retail.backoffice.report.AbcClass;
import com.retail.backoffice.report.CustomerSegmentation;
import com.retail.backoffice.report.DateRange;
import com.retail.backoffice.report.GroupTotals;
import com.retail.backoffice.report.GroupingDimension;
import com.retail.backoffice.report.InventoryValuation;
import com.retail.backoffice.report.OrderAggregator;
import com.retail.backoffice.report.OrderValidator;
import com.retail.backoffice.report.ProductValuation;
import com.retail.backoffice.report.RecordNotFoundException;
import com.retail.backoffice.report.ReportDefaults;
import com.retail.backoffice.report.ReportError;
import com.retail.backoffice.report.ReportMath;
import com.retail.backoffice.report.ReportResult;
import com.retail.backoffice.report.ReportSnapshotProvider;
import com.retail.backoffice.report.ReportWarning;
import com.retail.backoffice.report.RfmProfile;
import com.retail.backoffice.report.SnapshotFetchException;
import com.retail.backoffice.report.StockStatus;
import com.retail.backoffice.report.TimeBucketer;
import com.retail.backoffice.report.TrendPeriod;
import com.retail.backoffice.report.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point for every report. Each call loads a snapshot, validates it, aggregates it
 * and returns a {@link ReportResult}; failures never escape, they come back as the empty
 * form of the requested report.
 */
@Service
public class ReportService {

    private static final Logger logger = LoggerFactory.getLogger(ReportService.class);

    static final int TOP_PRODUCTS = 5;
    static final int TREND_TOP_PRODUCTS = 3;
    static final int FAVORITE_PRODUCTS = 5;
    static final int FAVORITE_CATEGORIES = 3;
    static final int RECENT_ORDERS = 5;
    static final int CRITICAL_STOCK = 3;
    static final int MIN_REORDER_QTY = 25;

    private final ReportSnapshotProvider snapshots;
    private final TimeBucketer bucketer;
    private final OrderValidator validator;
    private final OrderAggregator aggregator;
    private final CustomerSegmentation segmentation;
    private final InventoryValuation inventoryValuation;

    public ReportService(ReportSnapshotProvider snapshots, TimeBucketer bucketer, OrderValidator validator,
            OrderAggregator aggregator, CustomerSegmentation segmentation, InventoryValuation inventoryValuation) {
        this.snapshots = snapshots;
        this.bucketer = bucketer;
        this.validator = validator;
        this.aggregator = aggregator;
        this.segmentation = segmentation;
        this.inventoryValuation = inventoryValuation;
    }

    // ---------------------------------------------------------------- daily sales

    public ReportResult<DailySalesReport> dailySales(LocalDate date) {
        DateRange day = bucketer.day(date);
        return generate("daily-sales", () -> buildDailySales(day),
                message -> DailySalesReport.empty(day.startDate(), message));
    }

    private DailySalesReport buildDailySales(DateRange day) {
        ValidationResult validation = load(day);
        List<SalesOrder> orders = validation.validOrders();
        List<SalesOrder> settled = withoutCancelled(orders);

        List<HourlySales> hourly = aggregator.aggregate(orders, GroupingDimension.HOUR, day).values().stream()
                .map(HourlySales::of)
                .collect(Collectors.toList());

        List<OrderLine> lines = orders.stream()
                .sorted(Comparator.comparing(SalesOrder::getCreatedAt).reversed())
                .map(this::toOrderLine)
                .collect(Collectors.toList());

        return new DailySalesReport(day.startDate(),
                SalesSummary.of(aggregator.totals(orders)),
                paymentInsights(aggregator.aggregate(settled, GroupingDimension.PAYMENT_METHOD)),
                channelInsights(aggregator.aggregate(settled, GroupingDimension.CHANNEL)),
                topSold(aggregator.aggregate(settled, GroupingDimension.PRODUCT), TOP_PRODUCTS),
                topSold(aggregator.aggregate(settled, GroupingDimension.CATEGORY), Integer.MAX_VALUE),
                hourly, lines, validation.warnings(), null);
    }

    // ---------------------------------------------------------------- payment analytics

    public ReportResult<PaymentAnalyticsReport> paymentAnalytics(LocalDate startDate, LocalDate endDate) {
        DateRange range = bucketer.range(startDate, endDate);
        return generate("payment-analytics", () -> buildPaymentAnalytics(range),
                message -> PaymentAnalyticsReport.empty(DateWindow.of(range), message));
    }

    private PaymentAnalyticsReport buildPaymentAnalytics(DateRange range) {
        ValidationResult validation = load(range);
        List<SalesOrder> orders = validation.validOrders();
        List<SalesOrder> settled = withoutCancelled(orders);

        GroupTotals totals = aggregator.totals(orders);
        Map<String, GroupTotals> methods = aggregator.aggregate(settled, GroupingDimension.PAYMENT_METHOD);
        Map<String, GroupTotals> channels = aggregator.aggregate(settled, GroupingDimension.CHANNEL);
        PaymentInsights payment = paymentInsights(methods);

        Map<String, Map<String, Long>> methodCountsByDay = new LinkedHashMap<>();
        for (SalesOrder order : settled) {
            String day = bucketer.key(GroupingDimension.DAY.getGranularity(), order.getCreatedAt());
            methodCountsByDay.computeIfAbsent(day, k -> zeroMethodCounts())
                    .merge(PaymentMethod.from(order.getPaymentMethod()).getCode(), 1L, Long::sum);
        }
        List<PaymentAnalyticsReport.DailyPaymentMix> daily = new ArrayList<>();
        for (GroupTotals day : aggregator.aggregate(orders, GroupingDimension.DAY, range).values()) {
            daily.add(new PaymentAnalyticsReport.DailyPaymentMix(day.getKey(), day.getOrderCount(),
                    ReportMath.money(day.getGrossAmount()), ReportMath.money(day.netAmount()),
                    methodCountsByDay.getOrDefault(day.getKey(), zeroMethodCounts())));
        }

        PaymentAnalyticsReport.Insights insights = new PaymentAnalyticsReport.Insights(
                payment.dominantMethod(),
                aggregator.dominant(channels, SalesChannel.OFFLINE.getCode()),
                payment.digitalAdoption(),
                payment.cashPercentage(),
                ReportMath.percent(totals.getRefundedOrders(), totals.getRevenueOrders()));

        return new PaymentAnalyticsReport(DateWindow.of(range), SalesSummary.of(totals), payment.split(),
                breakdown(channels), daily, insights, validation.warnings(), null);
    }

    // ---------------------------------------------------------------- channel performance

    public ReportResult<ChannelPerformanceReport> channelPerformance(LocalDate startDate, LocalDate endDate) {
        DateRange range = bucketer.range(startDate, endDate);
        return generate("channel-performance", () -> buildChannelPerformance(range),
                message -> ChannelPerformanceReport.empty(DateWindow.of(range), message));
    }

    private ChannelPerformanceReport buildChannelPerformance(DateRange range) {
        ValidationResult validation = load(range);
        List<SalesOrder> orders = validation.validOrders();
        List<SalesOrder> settled = withoutCancelled(orders);

        Map<SalesChannel, List<SalesOrder>> byChannel = new EnumMap<>(SalesChannel.class);
        for (SalesChannel channel : SalesChannel.values()) {
            byChannel.put(channel, new ArrayList<>());
        }
        for (SalesOrder order : settled) {
            byChannel.get(SalesChannel.of(order)).add(order);
        }

        Map<String, GroupTotals> online = aggregator.aggregate(byChannel.get(SalesChannel.ONLINE),
                GroupingDimension.DAY, range);
        Map<String, GroupTotals> offline = aggregator.aggregate(byChannel.get(SalesChannel.OFFLINE),
                GroupingDimension.DAY, range);
        List<ChannelPerformanceReport.DailyChannelMix> trend = new ArrayList<>();
        for (String day : online.keySet()) {
            GroupTotals on = online.get(day);
            GroupTotals off = offline.get(day);
            trend.add(new ChannelPerformanceReport.DailyChannelMix(day, on.getOrderCount(), off.getOrderCount(),
                    ReportMath.money(on.netAmount()), ReportMath.money(off.netAmount())));
        }

        Map<String, List<BreakdownRow>> paymentMix = new LinkedHashMap<>();
        byChannel.forEach((channel, channelOrders) -> paymentMix.put(channel.getCode(),
                breakdown(aggregator.aggregate(channelOrders, GroupingDimension.PAYMENT_METHOD))));

        return new ChannelPerformanceReport(DateWindow.of(range), SalesSummary.of(aggregator.totals(orders)),
                channelInsights(aggregator.aggregate(settled, GroupingDimension.CHANNEL)), trend, paymentMix,
                validation.warnings(), null);
    }

    // ---------------------------------------------------------------- low stock

    public ReportResult<LowStockReport> lowStock(Integer threshold) {
        int limit = threshold != null ? threshold : ReportDefaults.DEFAULT_LOW_STOCK_THRESHOLD;
        LocalDateTime generatedAt = bucketer.nowUtc();
        return generate("low-stock", () -> buildLowStock(limit, generatedAt),
                message -> LowStockReport.empty(generatedAt, limit, message));
    }

    private LowStockReport buildLowStock(int threshold, LocalDateTime generatedAt) {
        List<Product> products = snapshots.findProductsWithStockAtMost(threshold);
        logger.debug("Low stock at or below {}: {} products", threshold, products.size());

        List<LowStockReport.Item> items = new ArrayList<>();
        long outOfStock = 0;
        long critical = 0;
        long warning = 0;
        long belowMinimum = 0;
        for (Product product : products) {
            int stock = Math.max(0, product.getStock());
            if (stock > threshold)
                continue;
            boolean underMinimum = stock < product.minimumStock();
            if (stock == 0)
                outOfStock++;
            if (stock <= CRITICAL_STOCK)
                critical++;
            else if (stock <= ReportDefaults.DEFAULT_LOW_STOCK_THRESHOLD)
                warning++;
            if (underMinimum)
                belowMinimum++;
            items.add(new LowStockReport.Item(product.getId(), product.getName(), product.getSku(),
                    product.getCategory() != null ? product.getCategory() : ReportDefaults.UNCATEGORIZED,
                    ReportMath.money(product.getPrice()), stock, product.minimumStock(), product.getReorderPoint(),
                    underMinimum, urgency(stock), reorderSuggestion(stock), suggestedReorderQty(stock)));
        }
        LowStockReport.Summary summary = new LowStockReport.Summary(items.size(), outOfStock, critical, warning,
                belowMinimum);
        return new LowStockReport(generatedAt, threshold, summary, items, List.of(), null);
    }

    static String urgency(int stock) {
        if (stock == 0)
            return "critical";
        if (stock <= CRITICAL_STOCK)
            return "high";
        if (stock <= ReportDefaults.DEFAULT_LOW_STOCK_THRESHOLD)
            return "medium";
        return "low";
    }

    static String reorderSuggestion(int stock) {
        if (stock == 0)
            return "URGENT: Out of stock - reorder immediately";
        if (stock <= CRITICAL_STOCK)
            return "HIGH: Critical stock level - reorder within 24 hours";
        if (stock <= ReportDefaults.DEFAULT_LOW_STOCK_THRESHOLD)
            return "MEDIUM: Low stock - reorder within a week";
        return "LOW: Monitor stock level";
    }

    static int suggestedReorderQty(int stock) {
        return Math.max(MIN_REORDER_QTY, stock * 3);
    }

    // ---------------------------------------------------------------- customer history

    public ReportResult<CustomerHistoryReport> customerHistory(Long customerId, Integer limit) {
        int pageSize = limit != null ? limit : ReportDefaults.DEFAULT_CUSTOMER_LIMIT;
        LocalDateTime generatedAt = bucketer.nowUtc();
        return generate("customer-history", () -> buildCustomerHistory(customerId, pageSize, generatedAt),
                message -> CustomerHistoryReport.empty(generatedAt, message));
    }

    private CustomerHistoryReport buildCustomerHistory(Long customerId, int limit, LocalDateTime generatedAt) {
        List<Customer> customers;
        if (customerId != null) {
            Customer customer = snapshots.findCustomer(customerId)
                    .orElseThrow(() -> new RecordNotFoundException("Customer " + customerId + " not found"));
            customers = List.of(customer);
        } else {
            customers = snapshots.findCustomers(limit);
        }

        List<Long> ids = customers.stream().map(Customer::getId).collect(Collectors.toList());
        ValidationResult validation = validator.validate(ids.isEmpty() ? List.of()
                : snapshots.findOrdersForCustomers(ids));
        Map<Long, List<SalesOrder>> ordersByCustomer = validation.validOrders().stream()
                .filter(o -> o.getCustomer() != null)
                .collect(Collectors.groupingBy(o -> o.getCustomer().getId()));

        List<CustomerHistoryReport.CustomerProfile> profiles = new ArrayList<>(customers.size());
        for (Customer customer : customers) {
            profiles.add(profile(customer, ordersByCustomer.getOrDefault(customer.getId(), List.of()), generatedAt));
        }

        Map<String, Long> segments = CustomerHistoryReport.Summary.emptyDistribution();
        long totalOrders = 0;
        BigDecimal totalRevenue = BigDecimal.ZERO;
        long churnTotal = 0;
        for (CustomerHistoryReport.CustomerProfile profile : profiles) {
            segments.merge(profile.rfm().segment().getCode(), 1L, Long::sum);
            totalOrders += profile.summary().orderCount();
            totalRevenue = totalRevenue.add(profile.rfm().netSpend());
            churnTotal += profile.rfm().churnRisk();
        }
        CustomerHistoryReport.Summary summary = new CustomerHistoryReport.Summary(profiles.size(), totalOrders,
                ReportMath.money(totalRevenue), segments, ReportMath.divide(BigDecimal.valueOf(churnTotal),
                        profiles.size()));

        return new CustomerHistoryReport(generatedAt, customerId != null ? profiles.get(0) : null, profiles,
                summary, validation.warnings(), null);
    }

    private CustomerHistoryReport.CustomerProfile profile(Customer customer, List<SalesOrder> orders,
            LocalDateTime generatedAt) {
        RfmProfile rfm = segmentation.profile(orders, generatedAt);
        GroupTotals totals = aggregator.totals(orders);

        List<SalesOrder> purchases = orders.stream()
                .filter(o -> OrderStatus.from(o.getStatus()).map(OrderStatus::isRevenueBearing).orElse(false))
                .sorted(Comparator.comparing(SalesOrder::getCreatedAt))
                .collect(Collectors.toList());
        LocalDate firstOrder = purchases.isEmpty() ? null
                : bucketer.toLocal(purchases.get(0).getCreatedAt()).toLocalDate();
        LocalDate lastOrder = purchases.isEmpty() ? null
                : bucketer.toLocal(purchases.get(purchases.size() - 1).getCreatedAt()).toLocalDate();

        CustomerHistoryReport.PurchaseSummary purchaseSummary = new CustomerHistoryReport.PurchaseSummary(
                ReportMath.money(totals.getGrossAmount()), ReportMath.money(totals.getRefundAmount()),
                totals.getRevenueOrders(), totals.avgOrderValue(), firstOrder, lastOrder);

        List<OrderLine> recent = orders.stream()
                .sorted(Comparator.comparing(SalesOrder::getCreatedAt).reversed())
                .limit(RECENT_ORDERS)
                .map(this::toOrderLine)
                .collect(Collectors.toList());

        return new CustomerHistoryReport.CustomerProfile(customer.getId(), customer.getName(),
                new CustomerHistoryReport.Contact(customer.getEmail(), customer.getPhone()),
                customer.getTags() != null ? new ArrayList<>(customer.getTags()) : List.of(),
                purchaseSummary, rfm,
                mostBought(aggregator.aggregate(purchases, GroupingDimension.PRODUCT), FAVORITE_PRODUCTS),
                mostBought(aggregator.aggregate(purchases, GroupingDimension.CATEGORY), FAVORITE_CATEGORIES),
                recent);
    }

    // ---------------------------------------------------------------- sales trend

    public ReportResult<SalesTrendReport> salesTrend(String period, Integer count) {
        TrendPeriod trendPeriod = TrendPeriod.from(period);
        int periods = count != null ? count : ReportDefaults.DEFAULT_TREND_WEEKS;
        DateRange range;
        switch (trendPeriod) {
            case DAILY:
                range = bucketer.lastDays(periods);
                break;
            case MONTHLY:
                range = bucketer.lastMonths(periods);
                break;
            default:
                range = bucketer.lastWeeks(periods);
                break;
        }
        DateRange window = range;
        return generate("sales-trend", () -> buildSalesTrend(trendPeriod, window),
                message -> SalesTrendReport.empty(trendPeriod.getCode(), DateWindow.of(window), message));
    }

    private SalesTrendReport buildSalesTrend(TrendPeriod period, DateRange range) {
        ValidationResult validation = load(range);
        List<SalesOrder> orders = validation.validOrders();
        GroupingDimension dimension = period.getDimension();

        Map<String, List<SalesOrder>> ordersByBucket = withoutCancelled(orders).stream()
                .collect(Collectors.groupingBy(o -> bucketer.key(dimension.getGranularity(), o.getCreatedAt())));

        List<PeriodSales> trend = new ArrayList<>();
        BigDecimal totalRevenue = BigDecimal.ZERO;
        long totalOrders = 0;
        GroupTotals best = null;
        for (GroupTotals bucket : aggregator.aggregate(orders, dimension, range).values()) {
            List<SalesOrder> bucketOrders = ordersByBucket.getOrDefault(bucket.getKey(), List.of());
            trend.add(PeriodSales.of(bucket,
                    topSold(aggregator.aggregate(bucketOrders, GroupingDimension.PRODUCT), TREND_TOP_PRODUCTS)));
            totalRevenue = totalRevenue.add(bucket.netAmount());
            totalOrders += bucket.getOrderCount();
            if (bucket.netAmount().signum() > 0
                    && (best == null || bucket.netAmount().compareTo(best.netAmount()) > 0)) {
                best = bucket;
            }
        }

        SalesTrendReport.Summary summary = new SalesTrendReport.Summary(ReportMath.money(totalRevenue), totalOrders,
                ReportMath.divide(totalRevenue, trend.size()), best != null ? best.getKey() : null,
                growthRate(trend));
        return new SalesTrendReport(period.getCode(), DateWindow.of(range), trend, summary, validation.warnings(),
                null);
    }

    /**
     * Change of the last period against the first period that had any net revenue.
     */
    static BigDecimal growthRate(List<PeriodSales> trend) {
        if (trend.size() < 2)
            return ReportMath.money(BigDecimal.ZERO);
        BigDecimal last = trend.get(trend.size() - 1).netRevenue();
        for (int i = 0; i < trend.size() - 1; i++) {
            BigDecimal first = trend.get(i).netRevenue();
            if (first.signum() > 0)
                return ReportMath.percent(last.subtract(first), first);
        }
        return ReportMath.money(BigDecimal.ZERO);
    }

    // ---------------------------------------------------------------- inventory valuation

    public ReportResult<InventoryValuationReport> inventoryValuation() {
        LocalDateTime generatedAt = bucketer.nowUtc();
        return generate("inventory-valuation", () -> buildInventoryValuation(generatedAt),
                message -> InventoryValuationReport.empty(generatedAt, message));
    }

    private InventoryValuationReport buildInventoryValuation(LocalDateTime generatedAt) {
        List<Product> products = snapshots.findProducts();
        ValidationResult validation = load(bucketer.lastDays(ReportDefaults.SALES_VELOCITY_DAYS));
        List<ProductValuation> valuations = inventoryValuation.valuate(products,
                inventoryValuation.unitsSold(validation.validOrders()));

        long stockCount = 0;
        BigDecimal costValue = BigDecimal.ZERO;
        BigDecimal retailValue = BigDecimal.ZERO;
        Map<StockStatus, Long> statuses = new EnumMap<>(StockStatus.class);
        Map<String, InventoryValuationReport.CategoryValuation> categories = new LinkedHashMap<>();
        for (ProductValuation valuation : valuations) {
            stockCount += valuation.stock();
            costValue = costValue.add(valuation.costValue());
            retailValue = retailValue.add(valuation.retailValue());
            statuses.merge(valuation.status(), 1L, Long::sum);
            categories.merge(valuation.category(),
                    new InventoryValuationReport.CategoryValuation(valuation.category(), 1, valuation.stock(),
                            valuation.costValue(), valuation.retailValue()),
                    (a, b) -> new InventoryValuationReport.CategoryValuation(a.category(),
                            a.productCount() + b.productCount(), a.stock() + b.stock(),
                            a.costValue().add(b.costValue()), a.retailValue().add(b.retailValue())));
        }
        BigDecimal profit = retailValue.subtract(costValue);
        InventoryValuationReport.Summary summary = new InventoryValuationReport.Summary(valuations.size(),
                stockCount, ReportMath.money(costValue), ReportMath.money(retailValue), ReportMath.money(profit),
                ReportMath.percent(profit, retailValue));
        InventoryValuationReport.Breakdown breakdown = new InventoryValuationReport.Breakdown(
                statuses.getOrDefault(StockStatus.OUT_OF_STOCK, 0L),
                statuses.getOrDefault(StockStatus.LOW_STOCK, 0L),
                statuses.getOrDefault(StockStatus.OVERSTOCKED, 0L),
                statuses.getOrDefault(StockStatus.BELOW_MINIMUM, 0L),
                statuses.getOrDefault(StockStatus.HEALTHY, 0L));

        List<InventoryValuationReport.CategoryValuation> byCategory = new ArrayList<>(categories.values());
        byCategory.sort(Comparator.comparing(InventoryValuationReport.CategoryValuation::retailValue).reversed());

        return new InventoryValuationReport(generatedAt, summary, breakdown, abcTiers(valuations), byCategory,
                valuations, validation.warnings(), null);
    }

    private static List<InventoryValuationReport.AbcTier> abcTiers(List<ProductValuation> valuations) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        Map<AbcClass, Long> counts = new EnumMap<>(AbcClass.class);
        for (AbcClass tier : AbcClass.values()) {
            values.put(tier.name(), BigDecimal.ZERO);
            counts.put(tier, 0L);
        }
        for (ProductValuation valuation : valuations) {
            values.merge(valuation.abcClass().name(), valuation.retailValue(), BigDecimal::add);
            counts.merge(valuation.abcClass(), 1L, Long::sum);
        }
        Map<String, BigDecimal> shares = ReportMath.shares(values);
        List<InventoryValuationReport.AbcTier> tiers = new ArrayList<>();
        for (AbcClass tier : AbcClass.values()) {
            tiers.add(new InventoryValuationReport.AbcTier(tier, counts.get(tier),
                    ReportMath.money(values.get(tier.name())), shares.get(tier.name())));
        }
        return tiers;
    }

    // ---------------------------------------------------------------- shared

    private <T> ReportResult<T> generate(String reportType, Supplier<T> builder, Function<String, T> emptyReport) {
        long started = System.currentTimeMillis();
        try {
            T report = builder.get();
            logger.info("Generated {} report in {} ms", reportType, System.currentTimeMillis() - started);
            return ReportResult.ok(report);
        } catch (RecordNotFoundException e) {
            logger.warn("{} report: {}", reportType, e.getMessage());
            return ReportResult.degraded(emptyReport.apply(e.getMessage()),
                    new ReportError(reportType, ReportError.Kind.NOT_FOUND, e.getMessage()));
        } catch (SnapshotFetchException e) {
            logger.error("{} report degraded, records could not be loaded", reportType, e);
            String message = "Could not load report data: " + e.getMessage();
            return ReportResult.degraded(emptyReport.apply(message),
                    new ReportError(reportType, ReportError.Kind.FETCH_FAILED, message));
        } catch (RuntimeException e) {
            logger.error("{} report degraded, computation failed", reportType, e);
            String message = "Report computation failed: " + e.getMessage();
            return ReportResult.degraded(emptyReport.apply(message),
                    new ReportError(reportType, ReportError.Kind.COMPUTATION_FAILED, message));
        }
    }

    private ValidationResult load(DateRange range) {
        List<SalesOrder> fetched = snapshots.findOrders(range.startUtc(), range.endUtc());
        logger.debug("Loaded {} orders between {} and {}", fetched.size(), range.startDate(), range.endDate());
        return validator.validate(fetched);
    }

    private static List<SalesOrder> withoutCancelled(Collection<SalesOrder> orders) {
        return orders.stream()
                .filter(o -> OrderStatus.from(o.getStatus()).map(s -> s != OrderStatus.CANCELLED).orElse(false))
                .collect(Collectors.toList());
    }

    private PaymentInsights paymentInsights(Map<String, GroupTotals> methods) {
        long total = 0;
        long digital = 0;
        for (GroupTotals totals : methods.values()) {
            total += totals.getOrderCount();
            if (PaymentMethod.from(totals.getKey()).isDigital())
                digital += totals.getOrderCount();
        }
        Map<String, BigDecimal> shares = aggregator.countShares(methods);
        return new PaymentInsights(breakdown(methods),
                aggregator.dominant(methods, PaymentMethod.CASH.getCode()),
                shares.get(PaymentMethod.CASH.getCode()),
                ReportMath.percent(digital, total));
    }

    private ChannelInsights channelInsights(Map<String, GroupTotals> channels) {
        Map<String, BigDecimal> shares = aggregator.countShares(channels);
        return new ChannelInsights(breakdown(channels),
                aggregator.dominant(channels, SalesChannel.OFFLINE.getCode()),
                shares.get(SalesChannel.ONLINE.getCode()),
                channels.get(SalesChannel.ONLINE.getCode()).avgOrderValue(),
                channels.get(SalesChannel.OFFLINE.getCode()).avgOrderValue());
    }

    private List<BreakdownRow> breakdown(Map<String, GroupTotals> groups) {
        Map<String, BigDecimal> counts = aggregator.countShares(groups);
        Map<String, BigDecimal> amounts = aggregator.amountShares(groups);
        return groups.values().stream()
                .map(t -> BreakdownRow.of(t, counts.get(t.getKey()), amounts.get(t.getKey())))
                .collect(Collectors.toList());
    }

    // Groups arrive ordered by revenue; only products that actually sold a unit are listed
    private static List<ProductSales> topSold(Map<String, GroupTotals> groups, int limit) {
        return groups.values().stream()
                .filter(t -> t.getQuantity() > 0)
                .limit(limit)
                .map(ProductSales::of)
                .collect(Collectors.toList());
    }

    private static List<ProductSales> mostBought(Map<String, GroupTotals> groups, int limit) {
        return groups.values().stream()
                .filter(t -> t.getQuantity() > 0)
                .sorted(Comparator.comparingLong(GroupTotals::getQuantity).reversed())
                .limit(limit)
                .map(ProductSales::of)
                .collect(Collectors.toList());
    }

    private OrderLine toOrderLine(SalesOrder order) {
        String customer = order.getCustomer() != null ? order.getCustomer().getName()
                : ReportDefaults.WALK_IN_CUSTOMER;
        return new OrderLine(order.getId(), customer, order.getStatus(),
                PaymentMethod.from(order.getPaymentMethod()).getCode(), SalesChannel.of(order).getCode(),
                ReportMath.money(order.getTotal()), order.getItems().size(), bucketer.toLocal(order.getCreatedAt()));
    }

    private static Map<String, Long> zeroMethodCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (PaymentMethod method : PaymentMethod.values()) {
            counts.put(method.getCode(), 0L);
        }
        return counts;
    }
}
