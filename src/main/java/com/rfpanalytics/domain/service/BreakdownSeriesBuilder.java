package com.rfpanalytics.domain.service;

import com.rfpanalytics.domain.model.ActivityKind;
import com.rfpanalytics.domain.model.ActivityRecord;
import com.rfpanalytics.domain.model.ItemDetail;
import com.rfpanalytics.domain.model.LifecycleState;
import com.rfpanalytics.domain.model.PeriodBucket;
import com.rfpanalytics.domain.model.Timeframe;
import com.rfpanalytics.domain.model.WorkItemSnapshot;
import com.rfpanalytics.domain.service.LifecycleClassifier.MoveIndex;
import com.rfpanalytics.domain.time.Granularity;
import com.rfpanalytics.domain.time.PeriodCalculator;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Builds the new / submitted / declined breakdown per period.
 *
 * Each category is evaluated independently per item: an item created on one
 * day and declined a week later shows up in both buckets. Every period in the
 * range is seeded up front so the series has no holes.
 */
@Component
@RequiredArgsConstructor
public class BreakdownSeriesBuilder {

    private final LifecycleClassifier classifier;
    private final EntityMatcher entityMatcher;
    private final ZoneId zone;

    /**
     * All four timeframes, keyed by {@link Timeframe#getKey()}.
     */
    public Map<String, List<PeriodBucket>> buildAll(LocalDate today,
                                                   List<WorkItemSnapshot> items,
                                                   MoveIndex moves,
                                                   List<ActivityRecord> activities) {
        Map<String, AnalysisCounts> counts = countAnalyses(items, activities);
        Map<String, List<PeriodBucket>> grouped = new LinkedHashMap<>();
        for (Timeframe timeframe : Timeframe.values()) {
            LocalDate start = startOf(timeframe, today, items);
            grouped.put(timeframe.getKey(), build(timeframe.getGranularity(), start, today, items, moves, counts));
        }
        return grouped;
    }

    public LocalDate startOf(Timeframe timeframe, LocalDate today, List<WorkItemSnapshot> items) {
        if (timeframe.getLookbackDays() != null) {
            return today.minusDays(timeframe.getLookbackDays());
        }
        LocalDate fallback = today.minusDays(Timeframe.TWELVE_MONTHS.getLookbackDays());
        return items.stream()
                .map(WorkItemSnapshot::getCreatedAt)
                .filter(createdAt -> createdAt != null)
                .map(createdAt -> PeriodCalculator.toDay(createdAt, zone))
                .min(LocalDate::compareTo)
                .orElse(fallback);
    }

    public List<PeriodBucket> build(Granularity granularity,
                                    LocalDate start,
                                    LocalDate today,
                                    List<WorkItemSnapshot> items,
                                    MoveIndex moves,
                                    Map<String, AnalysisCounts> counts) {
        Map<String, PeriodBucket> buckets = new LinkedHashMap<>();
        for (LocalDate periodStart : PeriodCalculator.periodStarts(start, today, granularity)) {
            String key = PeriodCalculator.periodKey(periodStart);
            buckets.put(key, PeriodBucket.builder()
                    .date(key)
                    .periodStart(periodStart)
                    .label(granularity.label(periodStart))
                    .build());
        }

        for (WorkItemSnapshot item : items) {
            AnalysisCounts itemCounts = counts.getOrDefault(item.getId(), AnalysisCounts.NONE);

            place(Optional.ofNullable(item.getCreatedAt()), item, itemCounts,
                    granularity, start, today, buckets, PeriodBucket::addNew);
            place(classifier.transitionDate(item, LifecycleState.SUBMITTED, moves), item, itemCounts,
                    granularity, start, today, buckets, PeriodBucket::addSubmitted);
            place(classifier.transitionDate(item, LifecycleState.DECLINED, moves), item, itemCounts,
                    granularity, start, today, buckets, PeriodBucket::addDeclined);
        }

        return new ArrayList<>(buckets.values());
    }

    /**
     * Per item, how many of the fetched analyses, reviews and FOIA analyses
     * reference it under any alias.
     */
    public Map<String, AnalysisCounts> countAnalyses(List<WorkItemSnapshot> items, List<ActivityRecord> activities) {
        Map<String, AnalysisCounts> counts = new HashMap<>();
        for (WorkItemSnapshot item : items) {
            int analyses = 0;
            int reviews = 0;
            int foia = 0;
            for (ActivityRecord activity : activities) {
                if (!activity.getKind().isAnalysisLike() || !entityMatcher.matches(activity, item)) {
                    continue;
                }
                if (activity.getKind() == ActivityKind.ANALYSIS) {
                    analyses++;
                } else if (activity.getKind() == ActivityKind.PROPOSAL_REVIEW) {
                    reviews++;
                } else {
                    foia++;
                }
            }
            if (analyses + reviews + foia > 0) {
                counts.put(item.getId(), new AnalysisCounts(analyses, reviews, foia));
            }
        }
        return counts;
    }

    private void place(Optional<Instant> when,
                       WorkItemSnapshot item,
                       AnalysisCounts itemCounts,
                       Granularity granularity,
                       LocalDate start,
                       LocalDate today,
                       Map<String, PeriodBucket> buckets,
                       BiConsumer<PeriodBucket, ItemDetail> add) {
        if (when.isEmpty()) {
            return;
        }
        LocalDate day = PeriodCalculator.toDay(when.get(), zone);
        if (!PeriodCalculator.within(day, start, today)) {
            return;
        }
        PeriodBucket bucket = buckets.get(PeriodCalculator.periodKey(granularity.periodStart(day)));
        if (bucket != null) {
            add.accept(bucket, detail(item, day, itemCounts));
        }
    }

    private ItemDetail detail(WorkItemSnapshot item, LocalDate day, AnalysisCounts counts) {
        return ItemDetail.builder()
                .id(item.getId())
                .title(item.getDisplayTitle())
                .typeTag(item.getTypeTag())
                .typeColor(item.getTypeColor())
                .date(PeriodCalculator.exactDate(day))
                .analyses(counts.getAnalyses())
                .proposalReviews(counts.getProposalReviews())
                .foiaAnalyses(counts.getFoiaAnalyses())
                .build();
    }

    @Value
    public static class AnalysisCounts {
        static final AnalysisCounts NONE = new AnalysisCounts(0, 0, 0);

        int analyses;
        int proposalReviews;
        int foiaAnalyses;
    }
}
