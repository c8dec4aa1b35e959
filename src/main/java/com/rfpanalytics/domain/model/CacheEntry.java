package com.rfpanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored form of a cached summary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    private SummaryResult data;
    private Instant computedAt;
    private Instant expiresAt;

    public boolean isValidAt(Instant now) {
        return data != null && expiresAt != null && now.isBefore(expiresAt);
    }
}
