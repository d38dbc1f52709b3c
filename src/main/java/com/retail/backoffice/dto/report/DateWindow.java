package com.retail.backoffice.dto.report;

import com.retail.backoffice.report.DateRange;

import java.time.LocalDate;

public record DateWindow(LocalDate start, LocalDate end) {

    public static DateWindow of(DateRange range) {
        return new DateWindow(range.startDate(), range.endDate());
    }
}
