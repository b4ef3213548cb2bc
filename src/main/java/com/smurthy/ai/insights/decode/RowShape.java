package com.smurthy.ai.insights.decode;

/**
 * Nesting variants observed in Search Console responses, in the order the decoder tries them.
 */
public enum RowShape {
    /** rows sit directly at the row-list path */
    A,
    /** rows sit at the row-list path, each wrapped in one or two single-element arrays */
    B,
    /** rows sit one level above the row-list path */
    C
}
