package com.retail.backoffice.dto.report;

import java.time.LocalDate;

/**
 * Query parameters accepted by the export endpoint. Each report type reads only the
 * ones it needs; {@code startDate} doubles as the day of a daily sales export.
 */
public record ExportParameters(
        LocalDate startDate,
        LocalDate endDate,
        Integer threshold,
        Long customerId,
        Integer limit,
        String period,
        Integer weeks) {

    public static ExportParameters none() {
        return new ExportParameters(null, null, null, null, null, null, null);
    }
}
