package com.rfpanalytics.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reads the project board: item snapshot, audit log and per-item lookups.
 * Every method throws {@link SourceFetchException} when the board cannot be read.
 */
public interface BoardClient {

    List<JsonNode> fetchItems();

    List<JsonNode> fetchActivityLogs(Instant since, int limit);

    List<JsonNode> fetchItemUpdates(String itemId);

    Optional<String> fetchItemTitle(String itemId);
}
