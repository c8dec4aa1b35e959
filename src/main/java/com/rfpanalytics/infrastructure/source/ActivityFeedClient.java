package com.rfpanalytics.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.rfpanalytics.domain.model.ActivityKind;

import java.util.List;

/**
 * Reads raw rows from the analysis, review, FOIA and chat stores.
 */
public interface ActivityFeedClient {

    /**
     * @throws SourceFetchException when the feed cannot be read
     */
    List<JsonNode> fetch(ActivityKind kind, FeedQuery query);
}
