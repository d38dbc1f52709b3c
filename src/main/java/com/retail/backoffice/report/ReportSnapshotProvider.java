package com.retail.backoffice.report;

import com.retail.backoffice.model.Customer;
import com.retail.backoffice.model.Product;
import com.retail.backoffice.model.SalesOrder;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the records a report is computed from. Implementations throw
 * {@link SnapshotFetchException} when the underlying store fails; the returned objects
 * are treated as an immutable snapshot for the duration of one report.
 */
public interface ReportSnapshotProvider {

    /** Orders created within the UTC bounds (inclusive), with items, products and customer loaded. */
    List<SalesOrder> findOrders(LocalDateTime fromUtc, LocalDateTime toUtc);

    List<SalesOrder> findOrdersForCustomers(Collection<Long> customerIds);

    List<Product> findProducts();

    List<Product> findProductsWithStockAtMost(int threshold);

    Optional<Customer> findCustomer(Long customerId);

    /** Customers ordered by name, at most {@code limit}. */
    List<Customer> findCustomers(int limit);
}
