package com.retail.backoffice.model;

public enum SalesChannel {
    ONLINE("online"),
    OFFLINE("offline");

    private final String code;

    SalesChannel(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    // Structural rule: a customer reference makes the order online, regardless of payment method
    public static SalesChannel of(SalesOrder order) {
        return order.getCustomer() != null ? ONLINE : OFFLINE;
    }
}
