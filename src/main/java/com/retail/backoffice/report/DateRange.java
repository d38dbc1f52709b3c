package com.retail.backoffice.report;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Inclusive range of whole calendar days in the business zone. {@code start} sits on
 * 00:00:00.000 of the first day, {@code end} on 23:59:59.999 of the last.
 */
public record DateRange(LocalDateTime start, LocalDateTime end, ZoneId zone) {

    static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

    public static DateRange of(LocalDate first, LocalDate last, ZoneId zone) {
        if (first.isAfter(last)) {
            LocalDate swap = first;
            first = last;
            last = swap;
        }
        return new DateRange(first.atStartOfDay(), last.atTime(END_OF_DAY), zone);
    }

    public LocalDate startDate() {
        return start.toLocalDate();
    }

    public LocalDate endDate() {
        return end.toLocalDate();
    }

    public LocalDateTime startUtc() {
        return toUtc(start);
    }

    public LocalDateTime endUtc() {
        return toUtc(end);
    }

    private LocalDateTime toUtc(LocalDateTime local) {
        return local.atZone(zone).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }
}
