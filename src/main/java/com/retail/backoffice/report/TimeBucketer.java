package com.retail.backoffice.report;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalises report windows to whole days in the business zone and produces
 * hour, day, ISO-week and month bucket keys. Order timestamps are stored in UTC.
 */
@Component
public class TimeBucketer {

    private final ZoneId zone;
    private final Clock clock;

    public TimeBucketer(ZoneId zone, Clock clock) {
        this.zone = zone;
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }

    public LocalDateTime nowUtc() {
        return LocalDateTime.now(clock.withZone(ZoneOffset.UTC));
    }

    public DateRange day(LocalDate date) {
        LocalDate target = date != null ? date : today();
        return DateRange.of(target, target, zone);
    }

    /**
     * Missing bounds default to a trailing window ending today; reversed bounds are swapped.
     */
    public DateRange range(LocalDate startDate, LocalDate endDate) {
        LocalDate end = endDate != null ? endDate : today();
        LocalDate start = startDate != null ? startDate : end.minusDays(ReportDefaults.DEFAULT_RANGE_DAYS - 1L);
        return DateRange.of(start, end, zone);
    }

    public DateRange lastDays(int days) {
        LocalDate end = today();
        return DateRange.of(end.minusDays(Math.max(1, days) - 1L), end, zone);
    }

    public DateRange lastWeeks(int weeks) {
        LocalDate end = today();
        return DateRange.of(end.minusDays(weeks * 7L), end, zone);
    }

    public DateRange lastMonths(int months) {
        LocalDate end = today();
        return DateRange.of(end.minusMonths(months), end, zone);
    }

    public LocalDateTime toLocal(LocalDateTime utcTimestamp) {
        return utcTimestamp.atOffset(ZoneOffset.UTC).atZoneSameInstant(zone).toLocalDateTime();
    }

    public String key(Granularity granularity, LocalDateTime utcTimestamp) {
        LocalDateTime local = toLocal(utcTimestamp);
        switch (granularity) {
            case HOUR:
                return hourKey(local.getHour());
            case DAY:
                return dayKey(local.toLocalDate());
            case WEEK:
                return weekKey(local.toLocalDate());
            case MONTH:
                return monthKey(YearMonth.from(local));
            default:
                throw new IllegalArgumentException("Unsupported granularity: " + granularity);
        }
    }

    /**
     * Every bucket key of the range in chronological order. Hour buckets are hours of
     * the day, so there are always 24 of them.
     */
    public List<String> bucketKeys(Granularity granularity, DateRange range) {
        if (granularity == Granularity.HOUR) {
            List<String> hours = new ArrayList<>(24);
            for (int hour = 0; hour < 24; hour++) {
                hours.add(hourKey(hour));
            }
            return hours;
        }
        if (granularity == Granularity.MONTH) {
            List<String> months = new ArrayList<>();
            YearMonth last = YearMonth.from(range.endDate());
            for (YearMonth m = YearMonth.from(range.startDate()); !m.isAfter(last); m = m.plusMonths(1)) {
                months.add(monthKey(m));
            }
            return months;
        }
        Set<String> keys = new LinkedHashSet<>();
        for (LocalDate d = range.startDate(); !d.isAfter(range.endDate()); d = d.plusDays(1)) {
            keys.add(granularity == Granularity.DAY ? dayKey(d) : weekKey(d));
        }
        return new ArrayList<>(keys);
    }

    public static String hourKey(int hour) {
        return String.format("%02d:00", hour);
    }

    public static String dayKey(LocalDate date) {
        return date.toString();
    }

    // ISO-8601: the week's Thursday decides the year, week 1 holds the first Thursday
    public static String weekKey(LocalDate date) {
        int weekYear = date.get(IsoFields.WEEK_BASED_YEAR);
        int week = date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        return String.format("%d-W%02d", weekYear, week);
    }

    public static String monthKey(YearMonth month) {
        return month.toString();
    }
}
