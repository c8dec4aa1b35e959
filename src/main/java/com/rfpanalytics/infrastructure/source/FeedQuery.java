package com.rfpanalytics.infrastructure.source;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Date and size filter passed to an activity feed. Null fields are omitted
 * from the request, so {@link #unbounded()} asks for the full history.
 */
@Value
@Builder
public class FeedQuery {

    Instant startDate;
    Instant endDate;
    Integer limit;

    public static FeedQuery unbounded() {
        return FeedQuery.builder().build();
    }
}
