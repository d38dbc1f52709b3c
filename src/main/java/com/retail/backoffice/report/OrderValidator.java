package com.retail.backoffice.report;

import com.retail.backoffice.model.OrderItem;
import com.retail.backoffice.model.OrderStatus;
import com.retail.backoffice.model.SalesOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Decides which raw orders may enter a report. Rejected orders never reach an
 * aggregate; their count is surfaced as a warning instead.
 */
@Component
public class OrderValidator {

    private static final Logger logger = LoggerFactory.getLogger(OrderValidator.class);

    static final double HIGH_SEVERITY_RATIO = 0.25;
    static final double MEDIUM_SEVERITY_RATIO = 0.10;

    public boolean isValidOrder(SalesOrder order) {
        if (order == null || order.getItems() == null || order.getItems().isEmpty())
            return false;
        if (order.getTotal() == null || order.getTotal().compareTo(BigDecimal.ZERO) <= 0)
            return false;
        if (order.getCreatedAt() == null)
            return false;
        if (OrderStatus.from(order.getStatus()).isEmpty())
            return false;
        for (OrderItem item : order.getItems()) {
            if (!isValidItem(item))
                return false;
        }
        return true;
    }

    // Either a live product reference, or the name/price/quantity captured for a removed product
    boolean isValidItem(OrderItem item) {
        if (item == null)
            return false;
        if (item.getProduct() != null)
            return true;
        return item.getProductName() != null && !item.getProductName().isBlank()
                && item.getPrice() != null
                && item.getQuantity() > 0;
    }

    public ValidationResult validate(Collection<SalesOrder> orders) {
        List<SalesOrder> valid = new ArrayList<>(orders.size());
        int invalid = 0;
        for (SalesOrder order : orders) {
            if (isValidOrder(order)) {
                valid.add(order);
            } else {
                invalid++;
            }
        }

        List<ReportWarning> warnings = new ArrayList<>();
        if (invalid > 0) {
            Severity severity = severityFor(invalid, orders.size());
            logger.warn("Excluded {} of {} orders that failed validation", invalid, orders.size());
            warnings.add(new ReportWarning(ReportWarning.INVALID_ORDERS,
                    invalid + " of " + orders.size() + " orders were excluded because they are incomplete or malformed",
                    severity, invalid));
        }
        return new ValidationResult(valid, invalid, warnings);
    }

    static Severity severityFor(int invalid, int total) {
        double ratio = total == 0 ? 0 : (double) invalid / total;
        if (ratio >= HIGH_SEVERITY_RATIO)
            return Severity.HIGH;
        if (ratio >= MEDIUM_SEVERITY_RATIO)
            return Severity.MEDIUM;
        return Severity.LOW;
    }
}
