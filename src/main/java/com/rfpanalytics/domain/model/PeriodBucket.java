package com.rfpanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One day, week or month of the grouped breakdown series.
 *
 * Buckets are pre-seeded for the whole range, so zero-activity periods are
 * present with empty item lists.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodBucket {

    // Period key: ISO date of periodStart
    private String date;
    private LocalDate periodStart;
    private String label;

    private int newCount;
    private int submitted;
    private int declined;

    @Builder.Default
    private List<ItemDetail> newItems = new ArrayList<>();

    @Builder.Default
    private List<ItemDetail> submittedItems = new ArrayList<>();

    @Builder.Default
    private List<ItemDetail> declinedItems = new ArrayList<>();

    public void addNew(ItemDetail detail) {
        newCount++;
        newItems.add(detail);
    }

    public void addSubmitted(ItemDetail detail) {
        submitted++;
        submittedItems.add(detail);
    }

    public void addDeclined(ItemDetail detail) {
        declined++;
        declinedItems.add(detail);
    }
}
