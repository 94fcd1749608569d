package com.weka_wrapper.experiment;

import weka.experiment.PropertyNode;
import weka.experiment.ResultProducer;

public record ConfiguredResultProducer(ResultProducer producer, PropertyNode[] propertyPath) {
}
