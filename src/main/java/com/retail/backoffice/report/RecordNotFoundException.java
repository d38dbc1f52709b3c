package com.retail.backoffice.report;

/**
 * The record a report was scoped to does not exist.
 */
public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String message) {
        super(message);
    }
}
