package com.weka_wrapper.experiment;

import com.weka_wrapper.enumeration.ExperimentStateEnum;
import com.weka_wrapper.enumeration.ResultListenerTypeEnum;
import com.weka_wrapper.exception.ExperimentConfigurationException;
import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;
import com.weka_wrapper.wrapper.ExperimentWrapper;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import weka.classifiers.Classifier;
import weka.experiment.Experiment;

import javax.swing.DefaultListModel;
import java.io.File;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs a set of classifiers over a set of datasets and writes the per-run results to an ARFF or
 * CSV file. How each dataset is split is decided by the {@link ResultProducerConfigurer}.
 * <p>
 * Usage: construct, {@link #setup()}, then {@link #run()}. All settings are validated in the
 * constructor, before any WEKA object is created.
 */
@Slf4j
@Getter
public class SimpleExperiment {

    public static final int DEFAULT_RUNS = 10;

    private final WekaRuntime runtime;
    private final List<String> datasets;
    private final List<JavaObjectSource> classifiers;
    private final boolean classification;
    private final int runs;
    private final String result;
    private final ResultProducerConfigurer resultProducerConfigurer;

    @Getter(AccessLevel.NONE)
    private ExperimentWrapper experiment;
    private ExperimentStateEnum state;

    /**
     * @param datasets                 file names of the datasets
     * @param classifiers              classifiers to evaluate, as command lines or configured objects
     * @param classification           classification or regression
     * @param runs                     number of runs, at least 1
     * @param result                   result file, ending in .arff or .csv
     * @param resultProducerConfigurer cross-validation or random split
     */
    public SimpleExperiment(WekaRuntime runtime, List<String> datasets, List<JavaObjectSource> classifiers,
                            boolean classification, int runs, String result,
                            ResultProducerConfigurer resultProducerConfigurer) {
        if (runs < 1) {
            throw new ExperimentConfigurationException("Number of runs must be at least 1!");
        }
        if (resultProducerConfigurer == null) {
            throw new ExperimentConfigurationException("No result producer configuration provided!");
        }
        if (datasets == null || datasets.isEmpty()) {
            throw new ExperimentConfigurationException("No datasets provided!");
        }
        if (classifiers == null || classifiers.isEmpty()) {
            throw new ExperimentConfigurationException("No classifiers provided!");
        }
        if (result == null) {
            throw new ExperimentConfigurationException("No filename for results provided!");
        }

        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.datasets = List.copyOf(datasets);
        this.classifiers = List.copyOf(classifiers);
        this.classification = classification;
        this.runs = runs;
        this.result = result;
        this.resultProducerConfigurer = resultProducerConfigurer;
        this.state = ExperimentStateEnum.UNCONFIGURED;
    }

    /**
     * Adopts an experiment that is already fully configured, e.g. one loaded with {@link #load}.
     */
    public SimpleExperiment(WekaRuntime runtime, Experiment existing) throws Exception {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.experiment = new ExperimentWrapper(runtime, JavaObjectSource.fromExisting(existing));
        this.datasets = List.of();
        this.classifiers = List.of();
        this.classification = true;
        this.runs = existing.getRunUpper() - existing.getRunLower() + 1;
        this.result = null;
        this.resultProducerConfigurer = null;
        this.state = ExperimentStateEnum.CONFIGURED;
    }

    /**
     * Creates and wires the WEKA experiment. Does nothing if that already happened.
     */
    public void setup() throws Exception {
        if (experiment != null) {
            log.debug("Experiment already set up, skipping");
            return;
        }
        ResultListenerTypeEnum listenerType = ResultListenerTypeEnum.fromPath(result);

        Experiment exp = new Experiment();
        exp.setPropertyArray(new Classifier[0]);
        exp.setUsePropertyIterator(true);
        exp.setRunLower(1);
        exp.setRunUpper(runs);

        ConfiguredResultProducer producer = resultProducerConfigurer.configure(classification);
        exp.setResultProducer(producer.producer());
        exp.setPropertyPath(producer.propertyPath());

        Classifier[] classifierArray = new Classifier[classifiers.size()];
        for (int i = 0; i < classifiers.size(); i++) {
            classifierArray[i] = WekaRuntime.enforceType(classifiers.get(i).resolve(runtime), Classifier.class);
        }
        exp.setPropertyArray(classifierArray);

        DefaultListModel<File> datasetModel = new DefaultListModel<>();
        for (String dataset : datasets) {
            datasetModel.addElement(new File(dataset));
        }
        exp.setDatasets(datasetModel);

        exp.setResultListener(listenerType.createListener(new File(result)));

        experiment = new ExperimentWrapper(runtime, JavaObjectSource.fromExisting(exp));
        state = ExperimentStateEnum.CONFIGURED;
        log.info("Experiment set up: {} dataset(s), {} classifier(s), {} run(s), {} results to {}",
                datasets.size(), classifiers.size(), runs, listenerType, result);
    }

    /**
     * Initializes, runs and post-processes the experiment, in that order. The first failure
     * aborts the sequence.
     */
    public void run() throws Exception {
        if (experiment == null) {
            throw new IllegalStateException("Experiment has not been set up, call setup() first");
        }
        log.info("Initializing...");
        experiment.initialize();
        state = ExperimentStateEnum.INITIALIZED;

        log.info("Running...");
        experiment.runExperiment();
        state = ExperimentStateEnum.RAN;

        log.info("Finished...");
        experiment.postProcess();
        state = ExperimentStateEnum.POST_PROCESSED;
    }

    /**
     * The WEKA experiment, empty until {@link #setup()} has been called.
     */
    public Optional<ExperimentWrapper> getExperiment() {
        return Optional.ofNullable(experiment);
    }

    public static ExperimentWrapper load(WekaRuntime runtime, String filename) throws Exception {
        log.info("Loading experiment from {}", filename);
        return new ExperimentWrapper(runtime, JavaObjectSource.fromExisting(Experiment.read(filename)));
    }

    public static void save(String filename, ExperimentWrapper experiment) throws Exception {
        log.info("Saving experiment to {}", filename);
        Experiment.write(filename, experiment.getJavaObject());
    }
}
