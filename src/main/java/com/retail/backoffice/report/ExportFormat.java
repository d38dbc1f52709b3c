package com.retail.backoffice.report;

import java.util.Locale;

public enum ExportFormat {
    JSON("json", "application/json"),
    CSV("csv", "text/csv");

    private final String code;
    private final String mimeType;

    ExportFormat(String code, String mimeType) {
        this.code = code;
        this.mimeType = mimeType;
    }

    public String getCode() {
        return code;
    }

    public String getMimeType() {
        return mimeType;
    }

    /** Missing format means JSON. */
    public static ExportFormat from(String value) {
        if (value == null || value.isBlank())
            return JSON;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat format : values()) {
            if (format.code.equals(normalized))
                return format;
        }
        throw new IllegalArgumentException("Unsupported export format: " + value + ". Supported formats: json, csv");
    }
}
