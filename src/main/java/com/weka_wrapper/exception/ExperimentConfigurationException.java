package com.weka_wrapper.exception;

/**
 * Raised when an experiment is configured with invalid settings, e.g. too few runs or folds,
 * no datasets, or a result file with an unsupported extension.
 */
public class ExperimentConfigurationException extends RuntimeException {

    public ExperimentConfigurationException(String message) {
        super(message);
    }

    public ExperimentConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
