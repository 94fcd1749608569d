package com.weka_wrapper.experiment;

import weka.experiment.PropertyNode;

import java.beans.IntrospectionException;
import java.beans.PropertyDescriptor;

public final class PropertyPaths {

    private PropertyPaths() {
    }

    /**
     * Path {@code producer.splitEvaluator.classifier}, used by WEKA's property iterator to swap in
     * each classifier of the experiment.
     */
    public static PropertyNode[] splitEvaluatorClassifier(Class<?> producerClass, ConfiguredSplitEvaluator splitEvaluator)
            throws IntrospectionException {
        Class<?> evaluatorClass = splitEvaluator.evaluator().getClass();
        PropertyNode[] path = new PropertyNode[2];
        path[0] = new PropertyNode(
                splitEvaluator.evaluator(),
                new PropertyDescriptor("splitEvaluator", producerClass),
                producerClass);
        path[1] = new PropertyNode(
                splitEvaluator.classifier(),
                new PropertyDescriptor("classifier", evaluatorClass),
                evaluatorClass);
        return path;
    }
}
