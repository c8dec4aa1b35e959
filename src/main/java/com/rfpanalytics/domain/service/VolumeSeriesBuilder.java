package com.rfpanalytics.domain.service;

import com.rfpanalytics.domain.model.ActivityRecord;
import com.rfpanalytics.domain.model.VolumePoint;
import com.rfpanalytics.domain.time.PeriodCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily analysis volume for the last N days, one point per day, oldest first.
 * Chat sessions are not analyses and are left out.
 */
@Component
@RequiredArgsConstructor
public class VolumeSeriesBuilder {

    private static final DateTimeFormatter LABEL = DateTimeFormatter.ofPattern("M/d");

    private final ZoneId zone;

    public List<VolumePoint> build(LocalDate today, int days, List<ActivityRecord> activities) {
        LocalDate start = today.minusDays(days - 1L);

        Map<LocalDate, Integer> counts = new LinkedHashMap<>();
        for (LocalDate day = start; !day.isAfter(today); day = day.plusDays(1)) {
            counts.put(day, 0);
        }

        for (ActivityRecord activity : activities) {
            if (!activity.getKind().isAnalysisLike() || !activity.hasTimestamp()) {
                continue;
            }
            LocalDate day = PeriodCalculator.toDay(activity.getOccurredAt(), zone);
            counts.computeIfPresent(day, (key, count) -> count + 1);
        }

        List<VolumePoint> series = new ArrayList<>(counts.size());
        counts.forEach((day, count) -> series.add(VolumePoint.builder()
                .date(PeriodCalculator.periodKey(day))
                .label(day.format(LABEL))
                .count(count)
                .build()));
        return series;
    }
}
