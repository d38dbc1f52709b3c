package com.retail.backoffice.dto.report;

import com.retail.backoffice.report.CustomerSegment;
import com.retail.backoffice.report.ReportMath;
import com.retail.backoffice.report.ReportWarning;
import com.retail.backoffice.report.RfmProfile;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Purchase history either for a single customer ({@code customer}) or for a page of
 * customers ({@code customers}).
 */
public record CustomerHistoryReport(
        LocalDateTime generatedAt,
        CustomerProfile customer,
        List<CustomerProfile> customers,
        Summary summary,
        List<ReportWarning> warnings,
        String error) {

    public record CustomerProfile(
            Long customerId,
            String customerName,
            Contact contact,
            List<String> tags,
            PurchaseSummary summary,
            RfmProfile rfm,
            List<ProductSales> favoriteProducts,
            List<ProductSales> favoriteCategories,
            List<OrderLine> recentActivity) {
    }

    public record Contact(String email, String phone) {
    }

    public record PurchaseSummary(BigDecimal totalSpent, BigDecimal totalRefunded, long orderCount,
            BigDecimal avgOrderValue, LocalDate firstOrder, LocalDate lastOrder) {
    }

    public record Summary(long totalCustomers, long totalOrders, BigDecimal totalRevenue,
            Map<String, Long> segmentDistribution, BigDecimal avgChurnRisk) {

        public static Summary empty() {
            BigDecimal zero = ReportMath.money(BigDecimal.ZERO);
            return new Summary(0, 0, zero, emptyDistribution(), zero);
        }

        /** Every segment with a zero count, in segment order. */
        public static Map<String, Long> emptyDistribution() {
            Map<String, Long> segments = new LinkedHashMap<>();
            for (CustomerSegment segment : CustomerSegment.values()) {
                segments.put(segment.getCode(), 0L);
            }
            return segments;
        }
    }

    public static CustomerHistoryReport empty(LocalDateTime generatedAt, String error) {
        return new CustomerHistoryReport(generatedAt, null, List.of(), Summary.empty(), List.of(), error);
    }
}
