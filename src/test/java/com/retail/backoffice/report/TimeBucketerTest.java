package com.retail.backoffice.report;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeBucketerTest {

    private static final ZoneId KOLKATA = ZoneId.of("Asia/Kolkata");

    @Test
    void day_ShouldAlignToBusinessZoneAndConvertBoundsToUtc() {
        DateRange day = ReportFixtures.bucketer(KOLKATA).day(LocalDate.of(2024, 3, 15));

        assertEquals(LocalDateTime.of(2024, 3, 15, 0, 0), day.start());
        assertEquals(LocalDateTime.of(2024, 3, 14, 18, 30), day.startUtc());
        assertEquals(LocalDateTime.of(2024, 3, 15, 18, 29, 59, 999_000_000), day.endUtc());
        assertEquals(day.startDate(), day.endDate());
    }

    @Test
    void day_ShouldDefaultToTodayInBusinessZone() {
        // 10:00 UTC is 15:30 in Kolkata, same calendar day
        assertEquals(LocalDate.of(2024, 3, 15), ReportFixtures.bucketer(KOLKATA).day(null).startDate());
    }

    @Test
    void key_ShouldBucketUtcTimestampByLocalTime() {
        TimeBucketer bucketer = ReportFixtures.bucketer(KOLKATA);
        LocalDateTime lateEveningUtc = LocalDateTime.of(2024, 3, 15, 20, 0);

        assertEquals("01:00", bucketer.key(Granularity.HOUR, lateEveningUtc));
        assertEquals("2024-03-16", bucketer.key(Granularity.DAY, lateEveningUtc));
        assertEquals("2024-03", bucketer.key(Granularity.MONTH, lateEveningUtc));
    }

    @Test
    void weekKey_ShouldFollowIsoWeekYear() {
        assertEquals("2025-W01", TimeBucketer.weekKey(LocalDate.of(2024, 12, 30)));
        assertEquals("2020-W53", TimeBucketer.weekKey(LocalDate.of(2021, 1, 3)));
        assertEquals("2024-W11", TimeBucketer.weekKey(LocalDate.of(2024, 3, 15)));
    }

    @Test
    void range_ShouldDefaultToLastThirtyDays() {
        DateRange range = ReportFixtures.bucketer().range(null, null);

        assertEquals(LocalDate.of(2024, 3, 15), range.endDate());
        assertEquals(LocalDate.of(2024, 2, 15), range.startDate());
    }

    @Test
    void range_ShouldSwapReversedBounds() {
        DateRange range = ReportFixtures.bucketer().range(LocalDate.of(2024, 3, 10), LocalDate.of(2024, 3, 1));

        assertEquals(LocalDate.of(2024, 3, 1), range.startDate());
        assertEquals(LocalDate.of(2024, 3, 10), range.endDate());
    }

    @Test
    void bucketKeys_ShouldZeroFillEveryBucketInOrder() {
        TimeBucketer bucketer = ReportFixtures.bucketer();

        List<String> hours = bucketer.bucketKeys(Granularity.HOUR, bucketer.day(null));
        assertEquals(24, hours.size());
        assertEquals("00:00", hours.get(0));
        assertEquals("23:00", hours.get(23));

        List<String> days = bucketer.bucketKeys(Granularity.DAY, bucketer.lastDays(7));
        assertEquals(List.of("2024-03-09", "2024-03-10", "2024-03-11", "2024-03-12", "2024-03-13", "2024-03-14",
                "2024-03-15"), days);

        List<String> weeks = bucketer.bucketKeys(Granularity.WEEK, bucketer.lastWeeks(4));
        assertEquals(List.of("2024-W07", "2024-W08", "2024-W09", "2024-W10", "2024-W11"), weeks);

        List<String> months = bucketer.bucketKeys(Granularity.MONTH, bucketer.lastMonths(2));
        assertEquals(List.of("2024-01", "2024-02", "2024-03"), months);
    }
}
