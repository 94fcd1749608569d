package com.weka_wrapper.enumeration;

import com.weka_wrapper.exception.ExperimentConfigurationException;
import weka.experiment.CSVResultListener;
import weka.experiment.InstancesResultListener;
import weka.experiment.ResultListener;

import java.io.File;
import java.util.Locale;

/**
 * Result sink formats, selected by the extension of the result file.
 */
public enum ResultListenerTypeEnum {
    ARFF(".arff"),
    CSV(".csv");

    private final String extension;

    ResultListenerTypeEnum(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static ResultListenerTypeEnum fromPath(String path) {
        if (path == null) {
            throw new ExperimentConfigurationException("No filename for results provided!");
        }
        String lower = path.toLowerCase(Locale.ROOT);
        for (ResultListenerTypeEnum type : values()) {
            if (lower.endsWith(type.extension)) {
                return type;
            }
        }
        throw new ExperimentConfigurationException("Unhandled output format for results: " + path);
    }

    public ResultListener createListener(File outputFile) {
        return switch (this) {
            case ARFF -> {
                InstancesResultListener listener = new InstancesResultListener();
                listener.setOutputFile(outputFile);
                yield listener;
            }
            case CSV -> {
                CSVResultListener listener = new CSVResultListener();
                listener.setOutputFile(outputFile);
                yield listener;
            }
        };
    }
}
