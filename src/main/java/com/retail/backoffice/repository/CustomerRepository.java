package com.retail.backoffice.repository;

import com.retail.backoffice.model.Customer;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CustomerRepository extends JpaRepository<Customer, Long> {
    List<Customer> findByOrderByNameAsc(Pageable pageable);
}
