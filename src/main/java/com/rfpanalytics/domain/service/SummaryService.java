package com.rfpanalytics.domain.service;

import com.rfpanalytics.config.AnalyticsProperties;
import com.rfpanalytics.domain.model.CacheEntry;
import com.rfpanalytics.domain.model.SummaryResult;
import com.rfpanalytics.infrastructure.cache.SummaryCacheService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Entry point for the analytics summary.
 *
 * Flow:
 * 1. Unless a refresh is forced, return the cached summary while it is unexpired;
 *    a forced refresh deletes the entry first
 * 2. Otherwise compute a fresh summary from all sources
 * 3. Overwrite the cache entry with a new TTL window
 *
 * There is one logical summary, so one fixed cache key. Two refreshes racing
 * may overwrite each other; both write a recomputation of the same data.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SummaryService {

    private final SummaryOrchestrator orchestrator;
    private final SummaryCacheService cacheService;
    private final MeterRegistry meterRegistry;
    private final AnalyticsProperties properties;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException     for a non-positive window or limit
     * @throws SummaryComputationException  when a primary source cannot be fetched
     */
    public SummaryResult getSummary(int windowDays, int itemLimit, boolean forceRefresh) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be at least 1, was " + windowDays);
        }
        if (itemLimit < 1) {
            throw new IllegalArgumentException("itemLimit must be at least 1, was " + itemLimit);
        }

        Timer.Sample sample = Timer.start(meterRegistry);

        if (!forceRefresh) {
            Optional<CacheEntry> cached = cacheService.get();
            if (cached.isPresent() && cached.get().isValidAt(clock.instant())) {
                log.debug("Serving cached summary computed at {}", cached.get().getComputedAt());

                Counter.builder("analytics.summary.cache")
                        .tag("result", "hit")
                        .register(meterRegistry)
                        .increment();

                return cached.get().getData();
            }
        } else {
            cacheService.invalidate();
        }

        Counter.builder("analytics.summary.cache")
                .tag("result", forceRefresh ? "refresh" : "miss")
                .register(meterRegistry)
                .increment();

        SummaryResult result;
        try {
            result = orchestrator.compute(windowDays, itemLimit);
        } catch (SummaryComputationException e) {
            Counter.builder("analytics.summary.computed")
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();
            throw e;
        }

        Duration ttl = properties.getCache().getTtl();
        Instant now = clock.instant();
        cacheService.put(CacheEntry.builder()
                .data(result)
                .computedAt(now)
                .expiresAt(now.plus(ttl))
                .build(), ttl);

        sample.stop(Timer.builder("analytics.summary.latency")
                .tag("cached", "false")
                .register(meterRegistry));

        Counter.builder("analytics.summary.computed")
                .tag("result", "success")
                .register(meterRegistry)
                .increment();

        return result;
    }

    /**
     * Drops the cached summary; the next request recomputes it.
     */
    public void clearCache() {
        log.info("Clearing cached analytics summary");
        cacheService.invalidate();
    }
}
