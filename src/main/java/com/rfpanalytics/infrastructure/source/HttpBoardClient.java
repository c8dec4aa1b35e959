package com.rfpanalytics.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * REST client for the project board proxy.
 *
 * Endpoints:
 * - GET /rfp-items                 -> { "items": [...] }
 * - GET /activity-logs             -> { "logs": [...] }
 * - GET /items/{id}/updates        -> { "updates": [...] }
 * - GET /items/{id}                -> { "title": "..." }
 */
@Slf4j
public class HttpBoardClient implements BoardClient {

    private final RestTemplate restTemplate;

    public HttpBoardClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public List<JsonNode> fetchItems() {
        List<JsonNode> items = Envelopes.rows(get("/rfp-items"), "items");
        log.debug("Fetched {} board items", items.size());
        return items;
    }

    @Override
    public List<JsonNode> fetchActivityLogs(Instant since, int limit) {
        List<JsonNode> logs = Envelopes.rows(
                get("/activity-logs?limit={limit}&startDate={since}", limit, since.toString()), "logs");
        log.debug("Fetched {} audit log rows since {}", logs.size(), since);
        return logs;
    }

    @Override
    public List<JsonNode> fetchItemUpdates(String itemId) {
        return Envelopes.rows(get("/items/{id}/updates", itemId), "updates");
    }

    @Override
    public Optional<String> fetchItemTitle(String itemId) {
        JsonNode body = get("/items/{id}", itemId);
        if (body == null) {
            return Optional.empty();
        }
        String title = body.path("title").asText(body.path("name").asText(""));
        return title.isBlank() ? Optional.empty() : Optional.of(title);
    }

    private JsonNode get(String uriTemplate, Object... variables) {
        try {
            return restTemplate.getForObject(uriTemplate, JsonNode.class, variables);
        } catch (RestClientException e) {
            throw new SourceFetchException("Failed to call board endpoint " + uriTemplate, e);
        }
    }
}
