package com.raditha.cannibal.normalization;

/**
 * Counts of rows removed at each cleaning step.
 *
 * @param inputRows         Rows received
 * @param fragmentRows      Rows dropped because the page URL contains '#'
 * @param duplicateRows     Exact duplicate rows dropped
 * @param negativeClickRows Rows dropped for negative clicks
 * @param emptyRows         Rows whose page or keyword became empty after cleaning
 * @param outputRows        Rows handed to profile building
 */
public record NormalizationSummary(
        int inputRows,
        int fragmentRows,
        int duplicateRows,
        int negativeClickRows,
        int emptyRows,
        int outputRows) {

    public static NormalizationSummary empty() {
        return new NormalizationSummary(0, 0, 0, 0, 0, 0);
    }

    public int droppedRows() {
        return inputRows - outputRows;
    }

    @Override
    public String toString() {
        return String.format("%d rows in, %d out (fragment=%d, duplicate=%d, negative clicks=%d, empty=%d)",
                inputRows, outputRows, fragmentRows, duplicateRows, negativeClickRows, emptyRows);
    }
}
