package com.weka_wrapper.experiment;

/**
 * Builds the result producer of a {@link SimpleExperiment} together with the property path that
 * tells WEKA which nested property (the classifier of the split evaluator) to iterate over.
 */
public interface ResultProducerConfigurer {

    ConfiguredResultProducer configure(boolean classification) throws Exception;
}
