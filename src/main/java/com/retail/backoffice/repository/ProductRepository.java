package com.retail.backoffice.repository;

import com.retail.backoffice.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProductRepository extends JpaRepository<Product, Long> {
    List<Product> findAllByOrderByNameAsc();

    List<Product> findByStockLessThanEqualOrderByStockAscNameAsc(int threshold);
}
