package com.rfpanalytics.domain.model;

import com.rfpanalytics.domain.time.Granularity;

/**
 * Windows offered by the grouped breakdown chart.
 *
 * lookbackDays is null for ALL_TIME; its start comes from the earliest item.
 */
public enum Timeframe {

    SEVEN_DAYS("7days", 7, Granularity.DAY),
    THREE_MONTHS("3months", 90, Granularity.WEEK),
    TWELVE_MONTHS("12months", 365, Granularity.MONTH),
    ALL_TIME("allTime", null, Granularity.MONTH);

    private final String key;
    private final Integer lookbackDays;
    private final Granularity granularity;

    Timeframe(String key, Integer lookbackDays, Granularity granularity) {
        this.key = key;
        this.lookbackDays = lookbackDays;
        this.granularity = granularity;
    }

    public String getKey() {
        return key;
    }

    public Integer getLookbackDays() {
        return lookbackDays;
    }

    public Granularity getGranularity() {
        return granularity;
    }
}
