package com.rfpanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Drill-down row for one item inside a period bucket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemDetail {

    private String id;
    private String title;
    private String typeTag;
    private String typeColor;

    // Exact date of the creation or transition, MM/dd/yyyy
    private String date;

    private int analyses;
    private int proposalReviews;
    private int foiaAnalyses;
}
