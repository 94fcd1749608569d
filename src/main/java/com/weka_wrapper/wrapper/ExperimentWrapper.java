package com.weka_wrapper.wrapper;

import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;
import weka.experiment.Experiment;
import weka.experiment.PropertyNode;
import weka.experiment.ResultListener;
import weka.experiment.ResultProducer;

import javax.swing.DefaultListModel;
import java.util.ArrayList;
import java.util.List;

/**
 * Wrapper for a {@code weka.experiment.Experiment}.
 */
public class ExperimentWrapper extends OptionHandlerWrapper<Experiment> {

    public ExperimentWrapper(WekaRuntime runtime, JavaObjectSource source) throws Exception {
        super(runtime, source, Experiment.class);
    }

    public void initialize() throws Exception {
        getJavaObject().initialize();
    }

    public void runExperiment() throws Exception {
        getJavaObject().runExperiment();
    }

    public void postProcess() throws Exception {
        getJavaObject().postProcess();
    }

    public int getRunLower() {
        return getJavaObject().getRunLower();
    }

    public int getRunUpper() {
        return getJavaObject().getRunUpper();
    }

    public List<String> getDatasetFiles() {
        DefaultListModel<?> datasets = getJavaObject().getDatasets();
        List<String> files = new ArrayList<>();
        for (int i = 0; i < datasets.size(); i++) {
            files.add(String.valueOf(datasets.getElementAt(i)));
        }
        return files;
    }

    public ResultListener getResultListener() {
        return getJavaObject().getResultListener();
    }

    public ResultProducer getResultProducer() {
        return getJavaObject().getResultProducer();
    }

    public PropertyNode[] getPropertyPath() {
        return getJavaObject().getPropertyPath();
    }
}
