package com.rfpanalytics.config;

import com.rfpanalytics.domain.model.LifecycleState;
import com.rfpanalytics.domain.service.ColorPalette;
import com.rfpanalytics.domain.service.FlowGraphBuilder;
import com.rfpanalytics.domain.service.LifecycleRules;
import com.rfpanalytics.domain.service.RankingBuilder;
import com.rfpanalytics.domain.time.TimestampParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the immutable lookup tables and the pure summary builders from
 * {@link AnalyticsProperties}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId analyticsZone(AnalyticsProperties properties) {
        return ZoneId.of(properties.getZone());
    }

    @Bean
    public TimestampParser timestampParser(ZoneId analyticsZone) {
        return new TimestampParser(analyticsZone);
    }

    @Bean
    public LifecycleRules lifecycleRules(AnalyticsProperties properties) {
        AnalyticsProperties.Lifecycle lifecycle = properties.getLifecycle();
        LifecycleRules rules = LifecycleRules.builder()
                .groupIds(LifecycleState.SUBMITTED, lifecycle.getSubmittedGroupIds())
                .groupIds(LifecycleState.DECLINED, lifecycle.getDeclinedGroupIds())
                .phrases(LifecycleState.SUBMITTED, lifecycle.getSubmittedPhrases())
                .phrases(LifecycleState.DECLINED, lifecycle.getDeclinedPhrases())
                .moveKeywords(LifecycleState.SUBMITTED, lifecycle.getSubmittedMoveKeywords())
                .moveKeywords(LifecycleState.DECLINED, lifecycle.getDeclinedMoveKeywords())
                .build();
        log.info("Lifecycle rules loaded: submitted groups {}, declined groups {}",
                rules.groupIds(LifecycleState.SUBMITTED), rules.groupIds(LifecycleState.DECLINED));
        return rules;
    }

    @Bean
    public ColorPalette colorPalette(AnalyticsProperties properties) {
        return new ColorPalette(properties.getFlow().getPalette());
    }

    @Bean
    public FlowGraphBuilder flowGraphBuilder(ColorPalette colorPalette, AnalyticsProperties properties) {
        return new FlowGraphBuilder(colorPalette,
                properties.getFlow().getRootLabel(),
                properties.getFlow().getDefaultColor());
    }

    @Bean
    public RankingBuilder rankingBuilder(ZoneId analyticsZone, AnalyticsProperties properties) {
        return new RankingBuilder(analyticsZone,
                properties.getLeaderboardSize(),
                properties.getUpdateCandidateLimit(),
                properties.getMostActiveSize());
    }
}
