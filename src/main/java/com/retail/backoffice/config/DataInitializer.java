package com.retail.backoffice.config;

import com.retail.backoffice.model.*;
import com.retail.backoffice.repository.*;
import com.retail.backoffice.service.SettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeds a small catalogue with customers and two months of orders so the reports have
 * something to show. Only runs with {@code reports.demo-data=true} on an empty database.
 */
@Configuration
@ConditionalOnProperty(name = "reports.demo-data", havingValue = "true")
public class DataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    private static final int DEMO_DAYS = 60;

    @Bean
    CommandLineRunner init(ProductRepository productRepo,
            CustomerRepository customerRepo,
            SalesOrderRepository orderRepo,
            SettingsService settingsService,
            Clock clock) {
        return args -> {
            if (productRepo.count() > 0) {
                logger.info("Demo data skipped, catalogue is not empty");
                return;
            }

            settingsService.updateSetting(SettingsService.KEY_COMPANY_NAME, "Corner Store");
            settingsService.updateSetting(SettingsService.KEY_CURRENCY_SYMBOL, "₹");
            settingsService.updateSetting(SettingsService.KEY_LOW_STOCK_THRESHOLD, "10");

            List<Product> products = new ArrayList<>();
            products.add(productRepo.save(product("Basmati Rice 5kg", "GRO-001", "Groceries", "620.00", "480.00", 42)));
            products.add(productRepo.save(product("Sunflower Oil 1L", "GRO-002", "Groceries", "165.00", "130.00", 8)));
            products.add(productRepo.save(product("Green Tea 100g", "BEV-001", "Beverages", "240.00", null, 0)));
            products.add(productRepo.save(product("Instant Coffee 200g", "BEV-002", "Beverages", "450.00", "310.00", 3)));
            products.add(productRepo.save(product("Hand Wash 250ml", "HOM-001", "Household", "99.00", "55.00", 150)));
            products.add(productRepo.save(product("Dish Sponge (3 pack)", "HOM-002", "Household", "60.00", null, 12)));
            products.add(productRepo.save(product("Notebook A5", "STA-001", null, "45.00", "20.00", 30)));

            List<Customer> customers = new ArrayList<>();
            customers.add(customerRepo.save(customer("Asha Menon", "9800000001", "asha@example.com", "vip")));
            customers.add(customerRepo.save(customer("Ravi Kumar", "9800000002", null, "wholesale")));
            customers.add(customerRepo.save(customer("Meera Iyer", "9800000003", "meera@example.com", null)));

            Random random = new Random(42);
            LocalDateTime now = LocalDateTime.now(clock.withZone(ZoneOffset.UTC));
            String[] methods = { "cash", "cash", "upi", "upi", "card", "wallet", "qr" };
            int orders = 0;
            for (int day = DEMO_DAYS; day >= 0; day--) {
                int perDay = 1 + random.nextInt(4);
                for (int n = 0; n < perDay; n++) {
                    SalesOrder order = new SalesOrder();
                    order.setCreatedAt(now.minusDays(day).withHour(8 + random.nextInt(12)).withMinute(random.nextInt(60)));
                    order.setPaymentMethod(methods[random.nextInt(methods.length)]);
                    order.setCashierId("till-1");
                    if (random.nextInt(3) > 0)
                        order.setCustomer(customers.get(random.nextInt(customers.size())));

                    BigDecimal total = BigDecimal.ZERO;
                    int lines = 1 + random.nextInt(3);
                    for (int l = 0; l < lines; l++) {
                        Product p = products.get(random.nextInt(products.size()));
                        OrderItem item = new OrderItem();
                        item.setProduct(p);
                        item.setProductName(p.getName());
                        item.setQuantity(1 + random.nextInt(3));
                        item.setPrice(p.getPrice());
                        order.addItem(item);
                        total = total.add(p.getPrice().multiply(BigDecimal.valueOf(item.getQuantity())));
                    }
                    order.setTotal(total);

                    int roll = random.nextInt(20);
                    if (roll == 0) {
                        order.setStatus(OrderStatus.CANCELLED.getCode());
                    } else if (roll == 1) {
                        order.setStatus(OrderStatus.REFUNDED.getCode());
                    } else if (day == 0 && roll == 2) {
                        order.setStatus(OrderStatus.PENDING.getCode());
                    } else {
                        order.setStatus(OrderStatus.COMPLETED.getCode());
                    }
                    orderRepo.save(order);
                    orders++;
                }
            }
            logger.info("Seeded demo data: {} products, {} customers, {} orders", products.size(), customers.size(),
                    orders);
        };
    }

    private static Product product(String name, String sku, String category, String price, String costPrice,
            int stock) {
        Product p = new Product();
        p.setName(name);
        p.setSku(sku);
        p.setCategory(category);
        p.setPrice(new BigDecimal(price));
        p.setCostPrice(costPrice != null ? new BigDecimal(costPrice) : null);
        p.setStock(stock);
        return p;
    }

    private static Customer customer(String name, String phone, String email, String tag) {
        Customer c = new Customer();
        c.setName(name);
        c.setPhone(phone);
        c.setEmail(email);
        if (tag != null)
            c.getTags().add(tag);
        return c;
    }
}
