package com.retail.backoffice.report;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Reports that can be exported, keyed by the path segment used in the export URL.
 */
public enum ExportType {
    DAILY_SALES("daily-sales"),
    PAYMENT_ANALYTICS("payment-analytics"),
    CHANNEL_PERFORMANCE("channel-performance"),
    INVENTORY("inventory"),
    CUSTOMERS("customers"),
    SALES_TREND("sales-trend"),
    INVENTORY_VALUATION("inventory-valuation");

    private final String code;

    ExportType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ExportType from(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (ExportType type : values()) {
            if (type.code.equals(normalized))
                return type;
        }
        throw new IllegalArgumentException("Invalid report type. Valid types: "
                + Arrays.stream(values()).map(ExportType::getCode).collect(Collectors.joining(", ")));
    }
}
