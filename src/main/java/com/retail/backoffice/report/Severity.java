package com.retail.backoffice.report;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
