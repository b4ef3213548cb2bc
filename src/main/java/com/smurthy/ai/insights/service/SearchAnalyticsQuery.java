package com.smurthy.ai.insights.service;

import java.time.LocalDate;
import java.util.List;

/**
 * A search analytics request for one property.
 *
 * @param rowLimit maximum rows the server should return
 */
public record SearchAnalyticsQuery(String siteUrl, LocalDate startDate, LocalDate endDate,
                                   List<String> dimensions, int rowLimit) {

    public SearchAnalyticsQuery {
        if (siteUrl == null || siteUrl.isBlank()) {
            throw new IllegalArgumentException("site_url is required");
        }
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("start_date and end_date are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("start_date " + startDate + " is after end_date " + endDate);
        }
        if (dimensions == null || dimensions.isEmpty()) {
            throw new IllegalArgumentException("At least one dimension is required");
        }
        if (rowLimit < 1) {
            throw new IllegalArgumentException("row_limit must be positive");
        }
        dimensions = List.copyOf(dimensions);
    }
}
