package com.rfpanalytics.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.rfpanalytics.domain.model.ActivityKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Optional;

/**
 * REST client for the activity stores.
 *
 * Endpoints:
 * - GET /rfp-analyses                     -> { "analyses": [...] }
 * - GET /analytics/all-proposal-reviews   -> { "reviews": [...] }
 * - GET /analytics/all-foia-analyses      -> { "analyses": [...] }
 * - GET /analytics/all-chat-sessions      -> { "sessions": [...] }
 *
 * All accept optional limit, startDate and endDate (ISO 8601) parameters.
 */
@Slf4j
public class HttpActivityFeedClient implements ActivityFeedClient {

    private final RestTemplate restTemplate;

    public HttpActivityFeedClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public List<JsonNode> fetch(ActivityKind kind, FeedQuery query) {
        String uri = UriComponentsBuilder.fromPath(path(kind))
                .queryParamIfPresent("limit", Optional.ofNullable(query.getLimit()))
                .queryParamIfPresent("startDate", Optional.ofNullable(query.getStartDate()))
                .queryParamIfPresent("endDate", Optional.ofNullable(query.getEndDate()))
                .build()
                .toUriString();
        try {
            JsonNode body = restTemplate.getForObject(uri, JsonNode.class);
            List<JsonNode> rows = Envelopes.rows(body, envelope(kind));
            log.debug("Fetched {} {} rows", rows.size(), kind);
            return rows;
        } catch (RestClientException e) {
            throw new SourceFetchException("Failed to fetch " + kind + " feed", e);
        }
    }

    static String path(ActivityKind kind) {
        return switch (kind) {
            case ANALYSIS -> "/rfp-analyses";
            case PROPOSAL_REVIEW -> "/analytics/all-proposal-reviews";
            case FOIA_ANALYSIS -> "/analytics/all-foia-analyses";
            case CHAT_SESSION -> "/analytics/all-chat-sessions";
        };
    }

    static String envelope(ActivityKind kind) {
        return switch (kind) {
            case ANALYSIS, FOIA_ANALYSIS -> "analyses";
            case PROPOSAL_REVIEW -> "reviews";
            case CHAT_SESSION -> "sessions";
        };
    }
}
