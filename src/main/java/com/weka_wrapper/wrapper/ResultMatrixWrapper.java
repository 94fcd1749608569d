package com.weka_wrapper.wrapper;

import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;
import weka.experiment.ResultMatrix;

/**
 * Formats the output of a {@link TesterWrapper}, e.g. as plain text, CSV or LaTeX depending
 * on the {@code weka.experiment.ResultMatrix} subclass.
 */
public class ResultMatrixWrapper extends OptionHandlerWrapper<ResultMatrix> {

    public static final String DEFAULT_CLASSNAME = "weka.experiment.ResultMatrixPlainText";

    public ResultMatrixWrapper(WekaRuntime runtime, JavaObjectSource source) throws Exception {
        super(runtime, source, ResultMatrix.class);
    }

    public ResultMatrixWrapper(WekaRuntime runtime, String classname, String... options) throws Exception {
        this(runtime, JavaObjectSource.fromClassName(classname, options));
    }

    public String toStringMatrix() {
        return getJavaObject().toStringMatrix();
    }

    /**
     * A key for all the column names, for when names got cut off in the matrix.
     */
    public String toStringKey() {
        return getJavaObject().toStringKey();
    }

    public String toStringHeader() {
        return getJavaObject().toStringHeader();
    }

    public String toStringSummary() {
        return getJavaObject().toStringSummary();
    }

    public String toStringRanking() {
        return getJavaObject().toStringRanking();
    }
}
