package com.rfpanalytics.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.rfpanalytics.config.AnalyticsProperties;
import com.rfpanalytics.domain.model.ActivityKind;
import com.rfpanalytics.domain.model.ActivityRecord;
import com.rfpanalytics.domain.model.DateRange;
import com.rfpanalytics.domain.model.ItemActivity;
import com.rfpanalytics.domain.model.MoveEvent;
import com.rfpanalytics.domain.model.SourceSnapshot;
import com.rfpanalytics.domain.model.SummaryResult;
import com.rfpanalytics.domain.model.VolumePoint;
import com.rfpanalytics.domain.model.WorkItemSnapshot;
import com.rfpanalytics.domain.time.PeriodCalculator;
import com.rfpanalytics.domain.time.TimestampParser;
import com.rfpanalytics.infrastructure.source.ActivityFeedClient;
import com.rfpanalytics.infrastructure.source.ActivityRecordMapper;
import com.rfpanalytics.infrastructure.source.BoardClient;
import com.rfpanalytics.infrastructure.source.FeedQuery;
import com.rfpanalytics.infrastructure.source.MoveEventMapper;
import com.rfpanalytics.infrastructure.source.WorkItemMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Computes the analytics summary from scratch.
 *
 * Flow:
 * 1. Fetch every primary source concurrently (four activity feeds, board
 *    snapshot, audit log) and wait for all of them
 * 2. Build volume, breakdown, flow and ranking views from the snapshot
 * 3. Look up updates (and missing titles) for the top candidates only, as one
 *    concurrent batch
 *
 * Any primary fetch failure aborts the whole computation. The all-time
 * history and the per-candidate lookups are best effort.
 */
@Slf4j
@Service
public class SummaryOrchestrator {

    private static final List<ActivityKind> ANALYSIS_KINDS =
            List.of(ActivityKind.ANALYSIS, ActivityKind.PROPOSAL_REVIEW, ActivityKind.FOIA_ANALYSIS);

    private final ActivityFeedClient activityFeedClient;
    private final BoardClient boardClient;
    private final ActivityRecordMapper activityRecordMapper;
    private final WorkItemMapper workItemMapper;
    private final MoveEventMapper moveEventMapper;
    private final LifecycleClassifier classifier;
    private final EntityMatcher entityMatcher;
    private final VolumeSeriesBuilder volumeSeriesBuilder;
    private final BreakdownSeriesBuilder breakdownSeriesBuilder;
    private final FlowGraphBuilder flowGraphBuilder;
    private final RankingBuilder rankingBuilder;
    private final TimestampParser timestampParser;
    private final Executor executor;
    private final Clock clock;
    private final ZoneId zone;
    private final AnalyticsProperties properties;

    public SummaryOrchestrator(ActivityFeedClient activityFeedClient,
                               BoardClient boardClient,
                               ActivityRecordMapper activityRecordMapper,
                               WorkItemMapper workItemMapper,
                               MoveEventMapper moveEventMapper,
                               LifecycleClassifier classifier,
                               EntityMatcher entityMatcher,
                               VolumeSeriesBuilder volumeSeriesBuilder,
                               BreakdownSeriesBuilder breakdownSeriesBuilder,
                               FlowGraphBuilder flowGraphBuilder,
                               RankingBuilder rankingBuilder,
                               TimestampParser timestampParser,
                               @Qualifier("summaryFetchExecutor") Executor executor,
                               Clock clock,
                               ZoneId zone,
                               AnalyticsProperties properties) {
        this.activityFeedClient = activityFeedClient;
        this.boardClient = boardClient;
        this.activityRecordMapper = activityRecordMapper;
        this.workItemMapper = workItemMapper;
        this.moveEventMapper = moveEventMapper;
        this.classifier = classifier;
        this.entityMatcher = entityMatcher;
        this.volumeSeriesBuilder = volumeSeriesBuilder;
        this.breakdownSeriesBuilder = breakdownSeriesBuilder;
        this.flowGraphBuilder = flowGraphBuilder;
        this.rankingBuilder = rankingBuilder;
        this.timestampParser = timestampParser;
        this.executor = executor;
        this.clock = clock;
        this.zone = zone;
        this.properties = properties;
    }

    public SummaryResult compute(int windowDays, int itemLimit) {
        long startTime = System.currentTimeMillis();

        LocalDate today = LocalDate.now(clock.withZone(zone));
        LocalDate start = today.minusDays(windowDays - 1L);

        SourceSnapshot snapshot = fetchSources(start, today, itemLimit);
        List<ActivityRecord> activities = snapshot.getActivities();
        List<WorkItemSnapshot> items = snapshot.getItems();

        // Volume and averages
        List<VolumePoint> volumeSeries = volumeSeriesBuilder.build(today, windowDays, activities);
        int totalAnalyses = rankingBuilder.total(volumeSeries);
        double averagePerDay = rankingBuilder.windowAverage(totalAnalyses, windowDays);
        if (snapshot.getAllTimeAnalyses() != null) {
            OptionalDouble allTime = rankingBuilder.allTimeAverage(snapshot.getAllTimeAnalyses(), today);
            if (allTime.isPresent()) {
                averagePerDay = allTime.getAsDouble();
            }
        }

        // Leaderboards
        Map<String, Integer> byAnalyst = rankingBuilder.countByAnalyst(activities, start, today);
        Map<String, ItemActivity> tally = rankingBuilder.tallyItems(activities, start, today);
        rankingBuilder.backfillTitles(tally, items, entityMatcher);
        enrichCandidates(rankingBuilder.updateCandidates(tally), start, today);
        List<ItemActivity> mostActive = rankingBuilder.mostActive(tally);

        LifecycleClassifier.MoveIndex moves = classifier.indexMoves(snapshot.getMoveEvents());

        SummaryResult result = SummaryResult.builder()
                .totalAnalyses(totalAnalyses)
                .averagePerDay(averagePerDay)
                .uniqueAnalysts(byAnalyst.size())
                .volumeSeries(volumeSeries)
                .topAnalysts(rankingBuilder.leaderboard(byAnalyst))
                .dateRange(DateRange.builder()
                        .startDate(PeriodCalculator.startOfDay(start, zone))
                        .endDate(PeriodCalculator.startOfDay(today, zone))
                        .build())
                .busiestDay(rankingBuilder.busiestDay(volumeSeries).orElse(null))
                .weekOverWeekChange(rankingBuilder.weekOverWeekChange(volumeSeries))
                .groupedBreakdowns(breakdownSeriesBuilder.buildAll(today, items, moves, activities))
                .flowGraph(flowGraphBuilder.build(items))
                .mostActiveItem(mostActive.isEmpty() ? null : mostActive.get(0))
                .mostActiveItems(mostActive)
                .computedAt(clock.instant())
                .build();

        log.info("Summary computed: {} analyses, {} items, {} move events, {} ms",
                totalAnalyses, items.size(), snapshot.getMoveEvents().size(),
                System.currentTimeMillis() - startTime);

        return result;
    }

    SourceSnapshot fetchSources(LocalDate start, LocalDate today, int itemLimit) {
        FeedQuery windowQuery = FeedQuery.builder()
                .startDate(PeriodCalculator.startOfDay(start, zone))
                .endDate(PeriodCalculator.startOfDay(today.plusDays(1), zone).minusMillis(1))
                .limit(itemLimit)
                .build();
        Instant auditSince = PeriodCalculator.startOfDay(today.minusDays(properties.getAuditLogLookbackDays()), zone);

        Map<ActivityKind, CompletableFuture<List<ActivityRecord>>> feeds = new EnumMap<>(ActivityKind.class);
        for (ActivityKind kind : ActivityKind.values()) {
            feeds.put(kind, CompletableFuture.supplyAsync(
                    () -> activityRecordMapper.map(kind, activityFeedClient.fetch(kind, windowQuery)), executor));
        }
        CompletableFuture<List<WorkItemSnapshot>> items = CompletableFuture.supplyAsync(
                () -> workItemMapper.map(boardClient.fetchItems()), executor);
        CompletableFuture<List<MoveEvent>> moves = CompletableFuture.supplyAsync(
                () -> moveEventMapper.map(boardClient.fetchActivityLogs(auditSince, properties.getAuditLogLimit())),
                executor);
        CompletableFuture<List<ActivityRecord>> allTime = fetchAllTimeAnalyses();

        List<CompletableFuture<?>> primary = new ArrayList<>(feeds.values());
        primary.add(items);
        primary.add(moves);

        try {
            CompletableFuture.allOf(primary.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Primary source fetch failed: {}", cause.getMessage());
            throw new SummaryComputationException("Failed to fetch analytics sources", cause);
        }

        // Analysis-like feeds first, chat last
        List<ActivityRecord> activities = new ArrayList<>();
        for (ActivityKind kind : ActivityKind.values()) {
            activities.addAll(feeds.get(kind).join());
        }

        return SourceSnapshot.builder()
                .activities(activities)
                .items(items.join())
                .moveEvents(moves.join())
                .allTimeAnalyses(allTime.join())
                .build();
    }

    private CompletableFuture<List<ActivityRecord>> fetchAllTimeAnalyses() {
        List<CompletableFuture<List<ActivityRecord>>> history = new ArrayList<>();
        for (ActivityKind kind : ANALYSIS_KINDS) {
            history.add(CompletableFuture.supplyAsync(
                    () -> activityRecordMapper.map(kind, activityFeedClient.fetch(kind, FeedQuery.unbounded())),
                    executor));
        }
        return CompletableFuture.allOf(history.toArray(new CompletableFuture[0]))
                .thenApply(done -> {
                    List<ActivityRecord> all = new ArrayList<>();
                    history.forEach(future -> all.addAll(future.join()));
                    return all;
                })
                .exceptionally(e -> {
                    log.warn("All-time history unavailable, using window average: {}", e.getMessage());
                    return null;
                });
    }

    /**
     * Fetches update counts (and titles still missing) for the candidates
     * concurrently. Results are merged by item id once every lookup settled;
     * a failed lookup leaves the field at its default.
     */
    void enrichCandidates(List<ItemActivity> candidates, LocalDate start, LocalDate today) {
        Map<String, CompletableFuture<Optional<Integer>>> updates = new HashMap<>();
        Map<String, CompletableFuture<Optional<String>>> titles = new HashMap<>();

        for (ItemActivity candidate : candidates) {
            String itemId = candidate.getItemId();
            updates.put(itemId, CompletableFuture.supplyAsync(() -> countUpdates(itemId, start, today), executor));
            if (candidate.getItemTitle() == null) {
                titles.put(itemId, CompletableFuture.supplyAsync(() -> lookupTitle(itemId), executor));
            }
        }

        List<CompletableFuture<?>> pending = new ArrayList<>(updates.values());
        pending.addAll(titles.values());
        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();

        for (ItemActivity candidate : candidates) {
            String itemId = candidate.getItemId();
            updates.get(itemId).join().ifPresent(count -> candidate.getCounts().setUpdates(count));
            CompletableFuture<Optional<String>> title = titles.get(itemId);
            if (title != null) {
                title.join().ifPresent(candidate::setItemTitle);
            }
        }
    }

    private Optional<Integer> countUpdates(String itemId, LocalDate start, LocalDate today) {
        try {
            int count = 0;
            for (JsonNode update : boardClient.fetchItemUpdates(itemId)) {
                Optional<Instant> createdAt = update == null
                        ? Optional.empty()
                        : timestampParser.parse(update.get("createdAt"));
                if (createdAt.isPresent()
                        && PeriodCalculator.within(PeriodCalculator.toDay(createdAt.get(), zone), start, today)) {
                    count++;
                }
            }
            return Optional.of(count);
        } catch (RuntimeException e) {
            log.warn("Could not fetch updates for item {}: {}", itemId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> lookupTitle(String itemId) {
        try {
            return boardClient.fetchItemTitle(itemId);
        } catch (RuntimeException e) {
            log.warn("Could not fetch title for item {}: {}", itemId, e.getMessage());
            return Optional.empty();
        }
    }
}
