package com.retail.backoffice.model;

import java.util.Locale;

public enum PaymentMethod {
    CASH("cash"),
    UPI("upi"),
    CARD("card"),
    WALLET("wallet"),
    QR("qr"),
    OTHER("other");

    private final String code;

    PaymentMethod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Absent values default to cash; anything unrecognised is reported as "other".
     */
    public static PaymentMethod from(String value) {
        if (value == null || value.isBlank())
            return CASH;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PaymentMethod method : values()) {
            if (method.code.equals(normalized))
                return method;
        }
        return OTHER;
    }

    public boolean isDigital() {
        return this != CASH;
    }
}
