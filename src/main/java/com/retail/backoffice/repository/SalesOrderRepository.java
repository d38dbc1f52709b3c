package com.retail.backoffice.repository;

import com.retail.backoffice.model.SalesOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface SalesOrderRepository extends JpaRepository<SalesOrder, Long> {

    @Query("SELECT DISTINCT o FROM SalesOrder o LEFT JOIN FETCH o.items i LEFT JOIN FETCH i.product "
            + "LEFT JOIN FETCH o.customer WHERE o.createdAt BETWEEN :from AND :to ORDER BY o.createdAt DESC")
    List<SalesOrder> findWithItemsCreatedBetween(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    @Query("SELECT DISTINCT o FROM SalesOrder o LEFT JOIN FETCH o.items i LEFT JOIN FETCH i.product "
            + "LEFT JOIN FETCH o.customer c WHERE c.id IN :customerIds ORDER BY o.createdAt DESC")
    List<SalesOrder> findWithItemsByCustomerIds(@Param("customerIds") Collection<Long> customerIds);
}
