package com.retail.backoffice.report;

/**
 * Data-quality notice attached to a report that was still computed.
 */
public record ReportWarning(String code, String message, Severity severity, long affectedRecords) {

    public static final String INVALID_ORDERS = "INVALID_ORDERS";
}
