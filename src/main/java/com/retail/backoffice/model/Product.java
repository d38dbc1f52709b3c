package com.retail.backoffice.model;

import com.retail.backoffice.report.ReportDefaults;
import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

@Entity
@Table(name = "products")
@Data
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(unique = true)
    private String sku;

    private String category;

    private String description;

    // Unit sell price
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    // Nullable: reports fall back to a fixed share of the sell price
    @Column(precision = 12, scale = 2)
    private BigDecimal costPrice;

    @Column(nullable = false)
    private int stock;

    private boolean active = true;

    private Integer minStockLevel = 5;
    private Integer reorderPoint = 10;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public BigDecimal effectiveCostPrice() {
        if (costPrice != null) {
            return costPrice;
        }
        if (price == null) {
            return BigDecimal.ZERO;
        }
        return price.multiply(ReportDefaults.DEFAULT_COST_RATIO).setScale(2, RoundingMode.HALF_UP);
    }

    public int minimumStock() {
        return minStockLevel != null ? minStockLevel : ReportDefaults.DEFAULT_MIN_STOCK_LEVEL;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
