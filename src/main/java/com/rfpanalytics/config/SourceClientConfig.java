package com.rfpanalytics.config;

import com.rfpanalytics.infrastructure.source.ActivityFeedClient;
import com.rfpanalytics.infrastructure.source.BoardClient;
import com.rfpanalytics.infrastructure.source.HttpActivityFeedClient;
import com.rfpanalytics.infrastructure.source.HttpBoardClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Upstream clients and the pool their concurrent fetches run on.
 *
 * Fetch timeouts are owned by the HTTP layer: every call is bounded by the
 * configured connect and read timeouts.
 */
@Slf4j
@Configuration
public class SourceClientConfig {

    @Bean
    public ActivityFeedClient activityFeedClient(RestTemplateBuilder builder, AnalyticsProperties properties) {
        AnalyticsProperties.Sources sources = properties.getSources();
        return new HttpActivityFeedClient(builder
                .rootUri(sources.getActivityBaseUrl())
                .setConnectTimeout(sources.getConnectTimeout())
                .setReadTimeout(sources.getReadTimeout())
                .build());
    }

    @Bean
    public BoardClient boardClient(RestTemplateBuilder builder, AnalyticsProperties properties) {
        AnalyticsProperties.Sources sources = properties.getSources();
        return new HttpBoardClient(builder
                .rootUri(sources.getBoardBaseUrl())
                .setConnectTimeout(sources.getConnectTimeout())
                .setReadTimeout(sources.getReadTimeout())
                .build());
    }

    /**
     * Primary fan-out is eight calls and the candidate batch at most twenty,
     * so the pool is small. Saturation runs the task on the caller.
     */
    @Bean(name = "summaryFetchExecutor")
    public Executor summaryFetchExecutor(AnalyticsProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getFetchPoolSize());
        executor.setMaxPoolSize(properties.getFetchPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("summary-fetch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Initialized summary fetch executor - Pool: {}", properties.getFetchPoolSize());

        return executor;
    }
}
