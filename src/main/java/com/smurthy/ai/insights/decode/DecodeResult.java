package com.smurthy.ai.insights.decode;

import java.util.List;

/**
 * @param shape null when the payload held no rows at all
 */
public record DecodeResult(List<RawRow> rows, RowShape shape, int skippedRows) {

    public DecodeResult {
        rows = List.copyOf(rows);
    }

    public static DecodeResult empty() {
        return new DecodeResult(List.of(), null, 0);
    }
}
