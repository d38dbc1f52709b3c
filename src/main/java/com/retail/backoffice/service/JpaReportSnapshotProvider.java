package com.retail.backoffice.service;

import com.retail.backoffice.model.Customer;
import com.retail.backoffice.model.Product;
import com.retail.backoffice.model.SalesOrder;
import com.retail.backoffice.report.ReportSnapshotProvider;
import com.retail.backoffice.report.SnapshotFetchException;
import com.retail.backoffice.repository.CustomerRepository;
import com.retail.backoffice.repository.ProductRepository;
import com.retail.backoffice.repository.SalesOrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Loads report snapshots through the JPA repositories. Every association a report reads
 * is fetched eagerly so the entities stay usable once the transaction has closed.
 */
@Service
public class JpaReportSnapshotProvider implements ReportSnapshotProvider {

    private static final Logger logger = LoggerFactory.getLogger(JpaReportSnapshotProvider.class);

    private final SalesOrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final CustomerRepository customerRepository;

    public JpaReportSnapshotProvider(SalesOrderRepository orderRepository, ProductRepository productRepository,
            CustomerRepository customerRepository) {
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
        this.customerRepository = customerRepository;
    }

    @Override
    public List<SalesOrder> findOrders(LocalDateTime fromUtc, LocalDateTime toUtc) {
        return fetch("orders", () -> orderRepository.findWithItemsCreatedBetween(fromUtc, toUtc));
    }

    @Override
    public List<SalesOrder> findOrdersForCustomers(Collection<Long> customerIds) {
        if (customerIds.isEmpty())
            return List.of();
        return fetch("customer orders", () -> orderRepository.findWithItemsByCustomerIds(customerIds));
    }

    @Override
    public List<Product> findProducts() {
        return fetch("products", productRepository::findAllByOrderByNameAsc);
    }

    @Override
    public List<Product> findProductsWithStockAtMost(int threshold) {
        return fetch("low stock products",
                () -> productRepository.findByStockLessThanEqualOrderByStockAscNameAsc(threshold));
    }

    @Override
    public Optional<Customer> findCustomer(Long customerId) {
        return fetch("customer", () -> customerRepository.findById(customerId));
    }

    @Override
    public List<Customer> findCustomers(int limit) {
        return fetch("customers", () -> customerRepository.findByOrderByNameAsc(PageRequest.of(0, limit)));
    }

    private <T> T fetch(String what, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            logger.error("Failed to load {}: {}", what, e.getMessage());
            throw new SnapshotFetchException("Failed to load " + what, e);
        }
    }
}
