package com.retail.backoffice.report;

public record ReportError(String reportType, Kind kind, String message) {

    public enum Kind {
        FETCH_FAILED,
        NOT_FOUND,
        COMPUTATION_FAILED
    }
}
