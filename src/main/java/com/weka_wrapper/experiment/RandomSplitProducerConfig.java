package com.weka_wrapper.experiment;

import com.weka_wrapper.exception.ExperimentConfigurationException;
import weka.experiment.RandomSplitResultProducer;

/**
 * @param trainPercentage percentage of each dataset used for training, exclusive bounds 0 and 100
 * @param preserveOrder   whether to split without randomizing the data first
 */
public record RandomSplitProducerConfig(double trainPercentage, boolean preserveOrder) implements ResultProducerConfigurer {

    public static final double DEFAULT_TRAIN_PERCENTAGE = 66.6;

    public RandomSplitProducerConfig {
        if (trainPercentage <= 0) {
            throw new ExperimentConfigurationException("Percentage for training must be >0!");
        }
        if (trainPercentage >= 100) {
            throw new ExperimentConfigurationException("Percentage for training must be <100!");
        }
    }

    @Override
    public ConfiguredResultProducer configure(boolean classification) throws Exception {
        RandomSplitResultProducer producer = new RandomSplitResultProducer();
        producer.setRandomizeData(!preserveOrder);
        producer.setTrainPercent(trainPercentage);
        ConfiguredSplitEvaluator splitEvaluator = ConfiguredSplitEvaluator.create(classification);
        producer.setSplitEvaluator(splitEvaluator.evaluator());
        return new ConfiguredResultProducer(producer,
                PropertyPaths.splitEvaluatorClassifier(RandomSplitResultProducer.class, splitEvaluator));
    }
}
