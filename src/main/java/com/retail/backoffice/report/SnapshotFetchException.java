package com.retail.backoffice.report;

/**
 * Raised by a {@link ReportSnapshotProvider} when records cannot be read.
 */
public class SnapshotFetchException extends RuntimeException {

    public SnapshotFetchException(String message) {
        super(message);
    }

    public SnapshotFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
