package com.weka_wrapper.experiment;

import weka.classifiers.Classifier;
import weka.experiment.ClassifierSplitEvaluator;
import weka.experiment.RegressionSplitEvaluator;
import weka.experiment.SplitEvaluator;

/**
 * A split evaluator and the classifier it currently holds.
 */
public record ConfiguredSplitEvaluator(SplitEvaluator evaluator, Classifier classifier) {

    /**
     * {@code ClassifierSplitEvaluator} for classification, {@code RegressionSplitEvaluator} otherwise.
     */
    public static ConfiguredSplitEvaluator create(boolean classification) {
        if (classification) {
            ClassifierSplitEvaluator evaluator = new ClassifierSplitEvaluator();
            return new ConfiguredSplitEvaluator(evaluator, evaluator.getClassifier());
        }
        RegressionSplitEvaluator evaluator = new RegressionSplitEvaluator();
        return new ConfiguredSplitEvaluator(evaluator, evaluator.getClassifier());
    }
}
