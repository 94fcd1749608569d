package com.weka_wrapper.experiment;

import com.weka_wrapper.exception.ExperimentConfigurationException;
import weka.experiment.CrossValidationResultProducer;

public record CrossValidationProducerConfig(int numFolds) implements ResultProducerConfigurer {

    public CrossValidationProducerConfig {
        if (numFolds < 2) {
            throw new ExperimentConfigurationException("Number of folds must be at least 2!");
        }
    }

    @Override
    public ConfiguredResultProducer configure(boolean classification) throws Exception {
        CrossValidationResultProducer producer = new CrossValidationResultProducer();
        producer.setNumFolds(numFolds);
        ConfiguredSplitEvaluator splitEvaluator = ConfiguredSplitEvaluator.create(classification);
        producer.setSplitEvaluator(splitEvaluator.evaluator());
        return new ConfiguredResultProducer(producer,
                PropertyPaths.splitEvaluatorClassifier(CrossValidationResultProducer.class, splitEvaluator));
    }
}
