package com.rfpanalytics.domain.time;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;

/**
 * Bucket resolution of a period series.
 */
public enum Granularity {

    DAY {
        @Override
        public LocalDate periodStart(LocalDate date) {
            return date;
        }

        @Override
        public LocalDate next(LocalDate periodStart) {
            return periodStart.plusDays(1);
        }

        @Override
        public String label(LocalDate periodStart) {
            return periodStart.format(MONTH_DAY);
        }
    },

    WEEK {
        @Override
        public LocalDate periodStart(LocalDate date) {
            return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }

        @Override
        public LocalDate next(LocalDate periodStart) {
            return periodStart.plusWeeks(1);
        }

        @Override
        public String label(LocalDate periodStart) {
            return periodStart.format(MONTH_DAY) + " - " + periodStart.plusDays(6).format(MONTH_DAY);
        }
    },

    MONTH {
        @Override
        public LocalDate periodStart(LocalDate date) {
            return date.withDayOfMonth(1);
        }

        @Override
        public LocalDate next(LocalDate periodStart) {
            return periodStart.plusMonths(1);
        }

        @Override
        public String label(LocalDate periodStart) {
            return periodStart.format(MONTH_YEAR);
        }
    };

    private static final DateTimeFormatter MONTH_DAY = DateTimeFormatter.ofPattern("MM/dd");
    private static final DateTimeFormatter MONTH_YEAR = DateTimeFormatter.ofPattern("MM/yyyy");

    public abstract LocalDate periodStart(LocalDate date);

    /**
     * Start of the period following the one starting at periodStart.
     */
    public abstract LocalDate next(LocalDate periodStart);

    public abstract String label(LocalDate periodStart);
}
