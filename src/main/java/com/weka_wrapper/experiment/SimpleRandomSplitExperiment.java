package com.weka_wrapper.experiment;

import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;

import java.util.List;

/**
 * Train/test split experiment writing its results to ARFF or CSV.
 */
public class SimpleRandomSplitExperiment extends SimpleExperiment {

    public SimpleRandomSplitExperiment(WekaRuntime runtime, List<String> datasets, List<JavaObjectSource> classifiers,
                                       boolean classification, int runs, double percentage, boolean preserveOrder,
                                       String result) {
        super(runtime, datasets, classifiers, classification, runs, result,
                new RandomSplitProducerConfig(percentage, preserveOrder));
    }

    public SimpleRandomSplitExperiment(WekaRuntime runtime, List<String> datasets, List<JavaObjectSource> classifiers,
                                       String result) {
        this(runtime, datasets, classifiers, true, DEFAULT_RUNS, RandomSplitProducerConfig.DEFAULT_TRAIN_PERCENTAGE, false, result);
    }

    public double getPercentage() {
        return ((RandomSplitProducerConfig) getResultProducerConfigurer()).trainPercentage();
    }

    public boolean isPreserveOrder() {
        return ((RandomSplitProducerConfig) getResultProducerConfigurer()).preserveOrder();
    }
}
