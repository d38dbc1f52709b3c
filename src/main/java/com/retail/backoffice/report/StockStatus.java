package com.retail.backoffice.report;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StockStatus {
    OUT_OF_STOCK("Out of Stock"),
    OVERSTOCKED("Overstocked"),
    LOW_STOCK("Low Stock"),
    BELOW_MINIMUM("Below Minimum"),
    HEALTHY("Healthy");

    private final String label;

    StockStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
