package com.weka_wrapper.wrapper;

import com.weka_wrapper.exception.ColumnNotFoundException;
import weka.core.Attribute;
import weka.core.Instances;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Which attributes of an experiment result set identify datasets, runs, folds and result sets.
 *
 * @param foldColumn may be {@code null} when the results carry no fold information
 */
public record TesterColumns(List<String> datasetColumns, String runColumn, String foldColumn, List<String> resultColumns) {

    public static final List<String> DEFAULT_DATASET_COLUMNS = List.of("Key_Dataset");
    public static final String DEFAULT_RUN_COLUMN = "Key_Run";
    public static final String DEFAULT_FOLD_COLUMN = "Key_Fold";
    public static final List<String> DEFAULT_RESULT_COLUMNS = List.of("Key_Scheme", "Key_Scheme_options", "Key_Scheme_version_ID");

    public TesterColumns {
        Objects.requireNonNull(datasetColumns, "No dataset columns set!");
        Objects.requireNonNull(runColumn, "No run column set!");
        Objects.requireNonNull(resultColumns, "No result columns set!");
        if (datasetColumns.isEmpty()) {
            throw new IllegalArgumentException("No dataset columns set!");
        }
        if (resultColumns.isEmpty()) {
            throw new IllegalArgumentException("No result columns set!");
        }
        datasetColumns = List.copyOf(datasetColumns);
        resultColumns = List.copyOf(resultColumns);
    }

    public static TesterColumns defaults() {
        return new TesterColumns(DEFAULT_DATASET_COLUMNS, DEFAULT_RUN_COLUMN, DEFAULT_FOLD_COLUMN, DEFAULT_RESULT_COLUMNS);
    }

    public TesterColumns withDatasetColumns(List<String> columns) {
        return new TesterColumns(columns, runColumn, foldColumn, resultColumns);
    }

    public TesterColumns withRunColumn(String column) {
        return new TesterColumns(datasetColumns, column, foldColumn, resultColumns);
    }

    public TesterColumns withFoldColumn(String column) {
        return new TesterColumns(datasetColumns, runColumn, column, resultColumns);
    }

    public TesterColumns withResultColumns(List<String> columns) {
        return new TesterColumns(datasetColumns, runColumn, foldColumn, columns);
    }

    /**
     * Looks up every configured column in the dataset.
     *
     * @throws ColumnNotFoundException if a dataset, run or result column is missing
     */
    public ResolvedColumns resolve(Instances data) {
        String datasetRange = toRange("Dataset", datasetColumns, data);
        int runIndex = indexOf("Run", runColumn, data);

        OptionalInt foldIndex = OptionalInt.empty();
        if (foldColumn != null) {
            Attribute fold = data.attribute(foldColumn);
            foldIndex = OptionalInt.of(fold == null ? -1 : fold.index());
        }

        String resultRange = toRange("Result", resultColumns, data);
        return new ResolvedColumns(datasetRange, runIndex, foldIndex, resultRange);
    }

    private static int indexOf(String role, String name, Instances data) {
        Attribute attribute = data.attribute(name);
        if (attribute == null) {
            throw new ColumnNotFoundException(role, name);
        }
        return attribute.index();
    }

    private static String toRange(String role, List<String> names, Instances data) {
        return names.stream()
                .map(name -> String.valueOf(indexOf(role, name, data) + 1))
                .collect(Collectors.joining(","));
    }
}
