package com.retail.backoffice.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "order_items")
@Data
public class OrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "order_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private SalesOrder order;

    // Null once the product has been removed from the catalog
    @ManyToOne
    @JoinColumn(name = "product_id")
    private Product product;

    // Name captured at sale time, kept for removed products
    private String productName;

    @Column(nullable = false)
    private int quantity;

    // Unit price paid, independent of the current catalog price
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    public String displayName() {
        if (product != null && product.getName() != null)
            return product.getName();
        return productName != null ? productName : "Unknown";
    }
}
