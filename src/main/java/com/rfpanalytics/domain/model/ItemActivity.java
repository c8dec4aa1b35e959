package com.rfpanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Activity tally for one item, used by the most-active ranking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemActivity {

    private String itemId;
    private String itemTitle;
    private int totalActivity;
    private Counts counts;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Counts {
        private int analyses;
        private int proposalReviews;
        private int foiaAnalyses;
        private int chatMessages;
        private int updates;

        public int withoutUpdates() {
            return analyses + proposalReviews + foiaAnalyses + chatMessages;
        }

        // Unweighted: every activity type counts once
        public int total() {
            return withoutUpdates() + updates;
        }
    }
}
