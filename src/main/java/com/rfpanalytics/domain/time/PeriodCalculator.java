package com.rfpanalytics.domain.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Day/week/month arithmetic shared by every series builder.
 *
 * All functions are pure. Period keys (ISO date of the period start) are the
 * only bucket identity used across components.
 */
public final class PeriodCalculator {

    private static final DateTimeFormatter EXACT_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    private PeriodCalculator() {
    }

    public static LocalDate toDay(Instant instant, ZoneId zone) {
        return instant.atZone(zone).toLocalDate();
    }

    public static Instant startOfDay(LocalDate day, ZoneId zone) {
        return day.atStartOfDay(zone).toInstant();
    }

    public static LocalDate startOfWeek(LocalDate date) {
        return Granularity.WEEK.periodStart(date);
    }

    public static LocalDate startOfMonth(LocalDate date) {
        return Granularity.MONTH.periodStart(date);
    }

    public static String periodKey(LocalDate periodStart) {
        return periodStart.toString();
    }

    public static String exactDate(LocalDate day) {
        return day.format(EXACT_DATE);
    }

    /**
     * Every period start from the period containing start through the period
     * containing end, ascending and gap-free. Empty when start is after end.
     */
    public static List<LocalDate> periodStarts(LocalDate start, LocalDate end, Granularity granularity) {
        List<LocalDate> starts = new ArrayList<>();
        LocalDate last = granularity.periodStart(end);
        for (LocalDate current = granularity.periodStart(start); !current.isAfter(last); current = granularity.next(current)) {
            starts.add(current);
        }
        return starts;
    }

    public static boolean within(LocalDate day, LocalDate start, LocalDate end) {
        return !day.isBefore(start) && !day.isAfter(end);
    }
}
