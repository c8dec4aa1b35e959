package com.rfpanalytics.domain.service;

import com.rfpanalytics.domain.model.ActivityRecord;
import com.rfpanalytics.domain.model.AnalystActivity;
import com.rfpanalytics.domain.model.ItemActivity;
import com.rfpanalytics.domain.model.VolumePoint;
import com.rfpanalytics.domain.model.WorkItemSnapshot;
import com.rfpanalytics.domain.time.PeriodCalculator;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Totals, averages, week-over-week delta and the two leaderboards.
 */
@RequiredArgsConstructor
public class RankingBuilder {

    static final String UNKNOWN_ANALYST = "Unknown";

    private static final Comparator<ItemActivity> BY_ITEM_ID =
            Comparator.comparing(ItemActivity::getItemId);

    private final ZoneId zone;
    private final int leaderboardSize;
    private final int candidateLimit;
    private final int mostActiveSize;

    public int total(List<VolumePoint> series) {
        return series.stream().mapToInt(VolumePoint::getCount).sum();
    }

    /**
     * The day with the highest count; the earliest one wins a tie. Empty when
     * every day is zero.
     */
    public Optional<VolumePoint> busiestDay(List<VolumePoint> series) {
        VolumePoint busiest = null;
        for (VolumePoint point : series) {
            if (busiest == null || point.getCount() > busiest.getCount()) {
                busiest = point;
            }
        }
        return busiest != null && busiest.getCount() > 0 ? Optional.of(busiest) : Optional.empty();
    }

    /**
     * Percent change of the last 7 points against the 7 before them. Null when
     * the earlier week is empty.
     */
    public Double weekOverWeekChange(List<VolumePoint> series) {
        int size = series.size();
        int recent = sum(series, Math.max(0, size - 7), size);
        int previous = sum(series, Math.max(0, size - 14), Math.max(0, size - 7));
        if (previous == 0) {
            return null;
        }
        return round1(((double) (recent - previous) / previous) * 100.0);
    }

    public double windowAverage(int total, int days) {
        return days > 0 ? round1((double) total / days) : 0.0;
    }

    /**
     * Records per day across the whole history: record count divided by the
     * days between the earliest dated record and today (at least one).
     */
    public OptionalDouble allTimeAverage(List<ActivityRecord> history, LocalDate today) {
        Optional<LocalDate> earliest = history.stream()
                .filter(ActivityRecord::hasTimestamp)
                .map(record -> PeriodCalculator.toDay(record.getOccurredAt(), zone))
                .min(LocalDate::compareTo);
        if (earliest.isEmpty()) {
            return OptionalDouble.empty();
        }
        long days = Math.max(1L, ChronoUnit.DAYS.between(earliest.get(), today));
        return OptionalDouble.of(round1((double) history.size() / days));
    }

    /**
     * Activity per normalized analyst across every feed, chat included.
     */
    public Map<String, Integer> countByAnalyst(List<ActivityRecord> activities, LocalDate start, LocalDate today) {
        Map<String, Integer> counts = new HashMap<>();
        for (ActivityRecord activity : inWindow(activities, start, today)) {
            counts.merge(formatAnalyst(activity.getActor()), 1, Integer::sum);
        }
        return counts;
    }

    public List<AnalystActivity> leaderboard(Map<String, Integer> byAnalyst) {
        return byAnalyst.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .limit(leaderboardSize)
                .map(entry -> AnalystActivity.builder()
                        .analyst(entry.getKey())
                        .count(entry.getValue())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * "jane.doe_smith@corp.com" becomes "Jane Doe Smith"; blank or missing
     * becomes "Unknown".
     */
    public static String formatAnalyst(String actor) {
        if (actor == null || actor.isBlank()) {
            return UNKNOWN_ANALYST;
        }
        String local = actor.trim();
        int at = local.indexOf('@');
        if (at >= 0) {
            local = local.substring(0, at);
        }
        String label = Arrays.stream(local.replaceAll("[_.]+", " ").split(" "))
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
        return label.isEmpty() ? UNKNOWN_ANALYST : label;
    }

    /**
     * Per-item activity counts for records inside the window, keyed by the
     * record's primary entity id. Records without an entity reference are
     * skipped here but still count toward volume and the analyst leaderboard.
     */
    public Map<String, ItemActivity> tallyItems(List<ActivityRecord> activities, LocalDate start, LocalDate today) {
        Map<String, ItemActivity> tally = new LinkedHashMap<>();
        for (ActivityRecord activity : inWindow(activities, start, today)) {
            String itemId = activity.getEntityId();
            if (itemId == null) {
                continue;
            }
            ItemActivity entry = tally.computeIfAbsent(itemId, id -> ItemActivity.builder()
                    .itemId(id)
                    .counts(new ItemActivity.Counts())
                    .build());
            ItemActivity.Counts counts = entry.getCounts();
            switch (activity.getKind()) {
                case ANALYSIS -> counts.setAnalyses(counts.getAnalyses() + 1);
                case PROPOSAL_REVIEW -> counts.setProposalReviews(counts.getProposalReviews() + 1);
                case FOIA_ANALYSIS -> counts.setFoiaAnalyses(counts.getFoiaAnalyses() + 1);
                case CHAT_SESSION -> counts.setChatMessages(counts.getChatMessages() + 1);
            }
            if (entry.getItemTitle() == null && activity.getEntityTitle() != null) {
                entry.setItemTitle(activity.getEntityTitle());
            }
        }
        return tally;
    }

    /**
     * Board titles win over whatever title the activity rows carried.
     */
    public void backfillTitles(Map<String, ItemActivity> tally, List<WorkItemSnapshot> items, EntityMatcher matcher) {
        for (ItemActivity entry : tally.values()) {
            for (WorkItemSnapshot item : items) {
                if (matcher.matchesId(entry.getItemId(), item) && item.getTitle() != null && !item.getTitle().isBlank()) {
                    entry.setItemTitle(item.getTitle());
                    break;
                }
            }
        }
    }

    /**
     * Items worth the per-item updates lookup, ranked by everything except updates.
     */
    public List<ItemActivity> updateCandidates(Map<String, ItemActivity> tally) {
        return tally.values().stream()
                .sorted(Comparator.comparingInt((ItemActivity entry) -> entry.getCounts().withoutUpdates())
                        .reversed()
                        .thenComparing(BY_ITEM_ID))
                .limit(candidateLimit)
                .collect(Collectors.toList());
    }

    /**
     * Items ranked by unweighted total activity, updates included.
     */
    public List<ItemActivity> mostActive(Map<String, ItemActivity> tally) {
        List<ItemActivity> ranked = new ArrayList<>();
        for (ItemActivity entry : tally.values()) {
            entry.setTotalActivity(entry.getCounts().total());
            ranked.add(entry);
        }
        ranked.sort(Comparator.comparingInt(ItemActivity::getTotalActivity).reversed().thenComparing(BY_ITEM_ID));
        if (ranked.isEmpty() || ranked.get(0).getTotalActivity() <= 0) {
            return List.of();
        }
        return new ArrayList<>(ranked.subList(0, Math.min(mostActiveSize, ranked.size())));
    }

    private List<ActivityRecord> inWindow(List<ActivityRecord> activities, LocalDate start, LocalDate today) {
        List<ActivityRecord> inWindow = new ArrayList<>();
        for (ActivityRecord activity : activities) {
            if (activity.hasTimestamp()
                    && PeriodCalculator.within(PeriodCalculator.toDay(activity.getOccurredAt(), zone), start, today)) {
                inWindow.add(activity);
            }
        }
        return inWindow;
    }

    private static int sum(List<VolumePoint> series, int from, int to) {
        int total = 0;
        for (int i = from; i < to; i++) {
            total += series.get(i).getCount();
        }
        return total;
    }

    static double round1(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
