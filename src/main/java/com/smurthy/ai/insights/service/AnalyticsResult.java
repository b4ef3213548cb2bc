package com.smurthy.ai.insights.service;

import com.smurthy.ai.insights.decode.RowShape;
import com.smurthy.ai.insights.extract.SearchConsoleProcedure;

import java.util.List;

/**
 * Rows returned by one pipeline run.
 *
 * @param skippedRows rows dropped while decoding, extracting or filtering
 * @param shape       response nesting the decoder recognised
 */
public record AnalyticsResult<T>(SearchConsoleProcedure procedure, List<T> rows, int skippedRows, RowShape shape) {

    public AnalyticsResult {
        rows = List.copyOf(rows);
    }
}
