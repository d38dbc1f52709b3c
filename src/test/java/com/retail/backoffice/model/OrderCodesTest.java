package com.retail.backoffice.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OrderCodesTest {

    @Test
    void orderStatus_ShouldParseCodesLeniently() {
        assertEquals(Optional.of(OrderStatus.COMPLETED), OrderStatus.from(" Completed "));
        assertTrue(OrderStatus.from("shipped").isEmpty());
        assertTrue(OrderStatus.from(null).isEmpty());
    }

    @Test
    void orderStatus_ShouldClassifyRevenueAndRefunds() {
        assertTrue(OrderStatus.PENDING.isRevenueBearing());
        assertTrue(OrderStatus.COMPLETED.isRevenueBearing());
        assertFalse(OrderStatus.CANCELLED.isRevenueBearing());
        assertFalse(OrderStatus.REFUNDED.isRevenueBearing());
        assertTrue(OrderStatus.REFUNDED.isRefund());
    }

    @Test
    void orderStatus_ShouldOnlyRefundCompletedOrders() {
        assertTrue(OrderStatus.COMPLETED.canTransitionTo(OrderStatus.REFUNDED));
        assertFalse(OrderStatus.PENDING.canTransitionTo(OrderStatus.REFUNDED));
        assertTrue(OrderStatus.PROCESSING.canTransitionTo(OrderStatus.CANCELLED));
        assertTrue(OrderStatus.CANCELLED.isTerminal());
        assertTrue(OrderStatus.CANCELLED.allowedTransitions().isEmpty());
    }

    @Test
    void paymentMethod_ShouldDefaultMissingToCashAndUnknownToOther() {
        assertEquals(PaymentMethod.CASH, PaymentMethod.from(null));
        assertEquals(PaymentMethod.CASH, PaymentMethod.from(" "));
        assertEquals(PaymentMethod.UPI, PaymentMethod.from("UPI"));
        assertEquals(PaymentMethod.OTHER, PaymentMethod.from("cheque"));
        assertFalse(PaymentMethod.CASH.isDigital());
        assertTrue(PaymentMethod.WALLET.isDigital());
    }

    @Test
    void salesChannel_ShouldFollowCustomerReference() {
        SalesOrder walkIn = new SalesOrder();
        assertEquals(SalesChannel.OFFLINE, SalesChannel.of(walkIn));

        SalesOrder online = new SalesOrder();
        online.setCustomer(new Customer());
        online.setPaymentMethod("cash");
        assertEquals(SalesChannel.ONLINE, SalesChannel.of(online));
    }

    @Test
    void product_ShouldEstimateMissingCostPrice() {
        Product product = new Product();
        product.setPrice(new java.math.BigDecimal("99.99"));

        assertEquals(new java.math.BigDecimal("59.99"), product.effectiveCostPrice());
        assertEquals(5, product.minimumStock());
    }
}
