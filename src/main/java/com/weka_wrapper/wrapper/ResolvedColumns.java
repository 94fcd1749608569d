package com.weka_wrapper.wrapper;

import java.util.OptionalInt;

/**
 * Column names of a {@link TesterColumns} mapping looked up against a dataset.
 *
 * @param datasetRange 1-based range of the dataset key columns, e.g. {@code "1"}
 * @param runIndex     0-based index of the run column
 * @param foldIndex    0-based index of the fold column, -1 if the dataset lacks it, empty if no fold column is configured
 * @param resultRange  1-based range of the result key columns
 */
public record ResolvedColumns(String datasetRange, int runIndex, OptionalInt foldIndex, String resultRange) {
}
