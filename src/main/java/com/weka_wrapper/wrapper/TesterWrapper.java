package com.weka_wrapper.wrapper;

import com.weka_wrapper.enumeration.ColumnStateEnum;
import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;
import lombok.extern.slf4j.Slf4j;
import weka.core.Instances;
import weka.core.Range;
import weka.experiment.ResultMatrix;
import weka.experiment.Tester;

import java.util.List;

/**
 * Wrapper for a {@code weka.experiment.Tester}, which computes statistics over experiment results.
 * <p>
 * Column names are mapped to attribute indices of the attached result set lazily. Changing the
 * result set or any column name marks the mapping {@link ColumnStateEnum#STALE}; every query
 * resolves a stale mapping before it reaches the tester.
 */
@Slf4j
public class TesterWrapper extends OptionHandlerWrapper<Tester> {

    public static final String DEFAULT_CLASSNAME = "weka.experiment.PairedCorrectedTTester";

    private TesterColumns columns = TesterColumns.defaults();
    private ColumnStateEnum columnState = ColumnStateEnum.STALE;

    public TesterWrapper(WekaRuntime runtime, JavaObjectSource source) throws Exception {
        super(runtime, source, Tester.class);
    }

    public TesterWrapper(WekaRuntime runtime, String classname, String... options) throws Exception {
        this(runtime, JavaObjectSource.fromClassName(classname, options));
    }

    public void setResultMatrix(ResultMatrixWrapper matrix) {
        getJavaObject().setResultMatrix(matrix.getJavaObject());
    }

    public ResultMatrixWrapper getResultMatrix() throws Exception {
        ResultMatrix matrix = getJavaObject().getResultMatrix();
        if (matrix == null) {
            return null;
        }
        return new ResultMatrixWrapper(getRuntime(), JavaObjectSource.fromExisting(matrix));
    }

    public void setInstances(Instances data) {
        getJavaObject().setInstances(data);
        columnState = ColumnStateEnum.STALE;
    }

    public Instances getInstances() {
        return getJavaObject().getInstances();
    }

    public void setSignificanceLevel(double level) {
        getJavaObject().setSignificanceLevel(level);
    }

    public void setShowStdDevs(boolean show) {
        getJavaObject().setShowStdDevs(show);
    }

    /**
     * Sets the column names that uniquely identify a dataset.
     */
    public void setDatasetColumns(List<String> names) {
        updateColumns(columns.withDatasetColumns(names));
    }

    /**
     * Sets the column name that holds the run number.
     */
    public void setRunColumn(String name) {
        updateColumns(columns.withRunColumn(name));
    }

    /**
     * Sets the column name that holds the fold number, {@code null} for none.
     */
    public void setFoldColumn(String name) {
        updateColumns(columns.withFoldColumn(name));
    }

    /**
     * Sets the column names that uniquely identify a result, e.g. scheme, options and version.
     */
    public void setResultColumns(List<String> names) {
        updateColumns(columns.withResultColumns(names));
    }

    public TesterColumns getColumns() {
        return columns;
    }

    public ColumnStateEnum getColumnState() {
        return columnState;
    }

    private void updateColumns(TesterColumns updated) {
        columns = updated;
        columnState = ColumnStateEnum.STALE;
    }

    /**
     * Passes the column indices to the tester if the mapping is stale.
     *
     * @throws com.weka_wrapper.exception.ColumnNotFoundException if a configured column is missing
     */
    public void resolveColumns() {
        if (columnState == ColumnStateEnum.RESOLVED) {
            return;
        }
        Instances data = getInstances();
        if (data == null) {
            log.warn("No instances set, cannot determine columns!");
            return;
        }

        ResolvedColumns resolved = columns.resolve(data);
        log.debug("Resolved tester columns {} to {}", columns, resolved);

        Tester tester = getJavaObject();
        tester.setDatasetKeyColumns(new Range(resolved.datasetRange()));
        tester.setRunColumn(resolved.runIndex());
        resolved.foldIndex().ifPresent(tester::setFoldColumn);
        tester.setResultsetKeyColumns(new Range(resolved.resultRange()));

        columnState = ColumnStateEnum.RESOLVED;
    }

    /**
     * Creates a header describing the current result sets.
     *
     * @param comparisonColumn 0-based index of the column to compare
     */
    public String header(int comparisonColumn) throws Exception {
        resolveColumns();
        return getJavaObject().header(comparisonColumn);
    }

    /**
     * Compares a base result set (e.g. a classifier) against all others.
     *
     * @param baseResultset    0-based index of the base result set
     * @param comparisonColumn 0-based index of the column to compare
     */
    public String multiResultsetFull(int baseResultset, int comparisonColumn) throws Exception {
        resolveColumns();
        return getJavaObject().multiResultsetFull(baseResultset, comparisonColumn);
    }

    public String multiResultsetRanking(int comparisonColumn) throws Exception {
        resolveColumns();
        return getJavaObject().multiResultsetRanking(comparisonColumn);
    }

    /**
     * Counts, for every pair of result sets, the datasets on which one outperforms the other.
     */
    public String multiResultsetSummary(int comparisonColumn) throws Exception {
        resolveColumns();
        return getJavaObject().multiResultsetSummary(comparisonColumn);
    }
}
