package com.weka_wrapper.experiment;

import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;

import java.util.List;

/**
 * Cross-validation experiment writing its results to ARFF or CSV.
 */
public class SimpleCrossValidationExperiment extends SimpleExperiment {

    public static final int DEFAULT_FOLDS = 10;

    public SimpleCrossValidationExperiment(WekaRuntime runtime, List<String> datasets, List<JavaObjectSource> classifiers,
                                           boolean classification, int runs, int folds, String result) {
        super(runtime, datasets, classifiers, classification, runs, result, new CrossValidationProducerConfig(folds));
    }

    public SimpleCrossValidationExperiment(WekaRuntime runtime, List<String> datasets, List<JavaObjectSource> classifiers,
                                           String result) {
        this(runtime, datasets, classifiers, true, DEFAULT_RUNS, DEFAULT_FOLDS, result);
    }

    public int getFolds() {
        return ((CrossValidationProducerConfig) getResultProducerConfigurer()).numFolds();
    }
}
