package com.rfpanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The full analytics summary. Cached and returned as one unit.
 *
 * groupedBreakdowns is keyed by {@link Timeframe#getKey()} in declaration order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SummaryResult {

    private int totalAnalyses;
    private double averagePerDay;
    private int uniqueAnalysts;

    @Builder.Default
    private List<VolumePoint> volumeSeries = new ArrayList<>();

    @Builder.Default
    private List<AnalystActivity> topAnalysts = new ArrayList<>();

    private DateRange dateRange;
    private VolumePoint busiestDay;

    // Null when the previous week had no activity
    private Double weekOverWeekChange;

    @Builder.Default
    private Map<String, List<PeriodBucket>> groupedBreakdowns = new LinkedHashMap<>();

    private FlowGraph flowGraph;
    private ItemActivity mostActiveItem;

    @Builder.Default
    private List<ItemActivity> mostActiveItems = new ArrayList<>();

    private Instant computedAt;
}
