package com.smurthy.ai.insights.extract;

import java.util.List;

/**
 * @param skippedRows rows dropped because a requested value was missing or malformed
 */
public record ExtractionResult<T>(List<T> rows, int skippedRows) {

    public ExtractionResult {
        rows = List.copyOf(rows);
    }
}
