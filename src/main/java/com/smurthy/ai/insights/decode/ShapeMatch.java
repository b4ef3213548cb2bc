package com.smurthy.ai.insights.decode;

import java.util.List;

/**
 * Outcome of trying one {@link RowShape}: either the rows it produced or why it did not apply.
 */
public record ShapeMatch(RowShape shape, boolean matched, List<RawRow> rows, int skippedRows, String mismatchReason) {

    public static ShapeMatch matched(RowShape shape, List<RawRow> rows, int skippedRows) {
        return new ShapeMatch(shape, true, List.copyOf(rows), skippedRows, null);
    }

    public static ShapeMatch mismatch(RowShape shape, String reason) {
        return new ShapeMatch(shape, false, List.of(), 0, reason);
    }
}
