package com.retail.backoffice.repository;

import com.retail.backoffice.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class SalesOrderRepositoryTest {

    @Autowired
    private SalesOrderRepository orderRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private TestEntityManager entityManager;

    private Product rice;
    private Customer asha;

    @BeforeEach
    void setUp() {
        rice = new Product();
        rice.setName("Rice");
        rice.setSku("GRO-001");
        rice.setCategory("Groceries");
        rice.setPrice(new BigDecimal("50.00"));
        rice.setStock(5);
        productRepository.save(rice);

        Product tea = new Product();
        tea.setName("Tea");
        tea.setSku("BEV-001");
        tea.setPrice(new BigDecimal("25.00"));
        tea.setStock(5);
        productRepository.save(tea);

        Product oil = new Product();
        oil.setName("Oil");
        oil.setSku("GRO-002");
        oil.setPrice(new BigDecimal("165.00"));
        oil.setStock(6);
        productRepository.save(oil);

        asha = new Customer();
        asha.setName("Asha Menon");
        asha.getTags().add("vip");
        customerRepository.save(asha);
    }

    private SalesOrder saveOrder(LocalDateTime createdAt, Customer customer, int quantity) {
        SalesOrder order = new SalesOrder();
        order.setCreatedAt(createdAt);
        order.setCustomer(customer);
        order.setStatus(OrderStatus.COMPLETED.getCode());
        order.setPaymentMethod(PaymentMethod.UPI.getCode());
        OrderItem item = new OrderItem();
        item.setProduct(rice);
        item.setProductName(rice.getName());
        item.setQuantity(quantity);
        item.setPrice(rice.getPrice());
        order.addItem(item);
        order.setTotal(rice.getPrice().multiply(BigDecimal.valueOf(quantity)));
        return orderRepository.save(order);
    }

    @Test
    void findWithItemsCreatedBetween_ShouldIncludeBoundsAndLoadItems() {
        LocalDateTime from = LocalDateTime.of(2024, 3, 15, 0, 0);
        LocalDateTime to = LocalDateTime.of(2024, 3, 15, 23, 59, 59);
        saveOrder(from, null, 1);
        saveOrder(to, asha, 2);
        saveOrder(from.minusSeconds(1), null, 3);
        saveOrder(to.plusSeconds(1), null, 4);
        entityManager.flush();
        entityManager.clear();

        List<SalesOrder> orders = orderRepository.findWithItemsCreatedBetween(from, to);

        assertEquals(2, orders.size());
        assertEquals(to, orders.get(0).getCreatedAt());
        assertEquals(1, orders.get(0).getItems().size());
        assertEquals("Rice", orders.get(0).getItems().get(0).getProduct().getName());
        assertEquals("Asha Menon", orders.get(0).getCustomer().getName());
    }

    @Test
    void findWithItemsByCustomerIds_ShouldSkipWalkInOrders() {
        saveOrder(LocalDateTime.of(2024, 3, 1, 10, 0), asha, 1);
        saveOrder(LocalDateTime.of(2024, 3, 2, 10, 0), asha, 1);
        saveOrder(LocalDateTime.of(2024, 3, 3, 10, 0), null, 1);
        entityManager.flush();
        entityManager.clear();

        List<SalesOrder> orders = orderRepository.findWithItemsByCustomerIds(List.of(asha.getId()));

        assertEquals(2, orders.size());
        assertTrue(orders.get(0).getCreatedAt().isAfter(orders.get(1).getCreatedAt()));
    }

    @Test
    void findByStockLessThanEqual_ShouldIncludeThresholdAndSortByStock() {
        List<Product> low = productRepository.findByStockLessThanEqualOrderByStockAscNameAsc(5);

        assertEquals(List.of("Rice", "Tea"), low.stream().map(Product::getName).toList());
    }

    @Test
    void findByOrderByNameAsc_ShouldPageCustomers() {
        Customer ravi = new Customer();
        ravi.setName("Ravi Kumar");
        customerRepository.save(ravi);

        List<Customer> page = customerRepository.findByOrderByNameAsc(PageRequest.of(0, 1));

        assertEquals(1, page.size());
        assertEquals("Asha Menon", page.get(0).getName());
        assertEquals(List.of("vip"), page.get(0).getTags());
    }
}
