package com.retail.backoffice.report;

import com.retail.backoffice.model.Customer;
import com.retail.backoffice.model.OrderItem;
import com.retail.backoffice.model.Product;
import com.retail.backoffice.model.SalesOrder;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Builders for report test data. Timestamps are UTC, like stored orders.
 */
public final class ReportFixtures {

    /** 2024-03-15 10:00 UTC, a Friday. */
    public static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    private ReportFixtures() {
    }

    public static TimeBucketer bucketer() {
        return bucketer(ZoneOffset.UTC);
    }

    public static TimeBucketer bucketer(ZoneId zone) {
        return new TimeBucketer(zone, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    public static LocalDateTime nowUtc() {
        return LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);
    }

    public static Product product(long id, String name, String category, String price, String costPrice, int stock) {
        Product p = new Product();
        p.setId(id);
        p.setName(name);
        p.setSku("SKU-" + id);
        p.setCategory(category);
        p.setPrice(new BigDecimal(price));
        p.setCostPrice(costPrice != null ? new BigDecimal(costPrice) : null);
        p.setStock(stock);
        return p;
    }

    public static Customer customer(long id, String name) {
        Customer c = new Customer();
        c.setId(id);
        c.setName(name);
        c.setEmail(name.toLowerCase().replace(' ', '.') + "@example.com");
        c.setPhone("98000000" + id);
        return c;
    }

    public static OrderItem item(Product product, int quantity, String price) {
        OrderItem item = new OrderItem();
        item.setProduct(product);
        item.setProductName(product.getName());
        item.setQuantity(quantity);
        item.setPrice(new BigDecimal(price));
        return item;
    }

    /** A line whose product has since been removed from the catalogue. */
    public static OrderItem removedItem(String name, int quantity, String price) {
        OrderItem item = new OrderItem();
        item.setProductName(name);
        item.setQuantity(quantity);
        item.setPrice(new BigDecimal(price));
        return item;
    }

    /** Order whose total is the sum of its lines. */
    public static SalesOrder order(long id, String status, String paymentMethod, Customer customer,
            LocalDateTime createdAtUtc, OrderItem... items) {
        SalesOrder order = new SalesOrder();
        order.setId(id);
        order.setStatus(status);
        order.setPaymentMethod(paymentMethod);
        order.setCustomer(customer);
        order.setCreatedAt(createdAtUtc);
        BigDecimal total = BigDecimal.ZERO;
        for (OrderItem item : items) {
            order.addItem(item);
            total = total.add(item.getPrice().multiply(BigDecimal.valueOf(item.getQuantity())));
        }
        order.setTotal(total);
        return order;
    }
}
