package com.smurthy.ai.insights.extract;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Performance metrics of one row, as the server reports them: ctr is a fraction and position an average rank.
 * A metric the response did not carry is null, never zero.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Metrics(Long clicks, Long impressions, Double ctr, Double position) {

    public static final Metrics NONE = new Metrics(null, null, null, null);
}
