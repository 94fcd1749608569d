package com.weka_wrapper.cli;

import com.weka_wrapper.config.WekaRuntimeFactory;
import com.weka_wrapper.experiment.SimpleCrossValidationExperiment;
import com.weka_wrapper.experiment.SimpleExperiment;
import com.weka_wrapper.experiment.SimpleRandomSplitExperiment;
import com.weka_wrapper.runtime.WekaRuntime;
import com.weka_wrapper.util.AlgorithmUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Slf4j
@Component
@Command(name = "experiment",
        mixinStandardHelpOptions = true,
        header = "Runs a classification or regression experiment",
        description = "Either loads a saved experiment with -l, or builds one from datasets (-t), "
                + "classifiers (-W) and a result file (-o).")
public class ExperimentCommand implements Callable<Integer> {

    private final WekaRuntimeFactory runtimeFactory;

    @Spec
    CommandSpec spec;

    @Option(names = "-j", paramLabel = "CLASSPATH", description = "Additional classpath entries, separated by the path separator")
    String classpath;

    @Option(names = "-l", paramLabel = "FILE", description = "Saved experiment to load and run")
    String load;

    @Option(names = "-t", paramLabel = "FILE", description = "Dataset, may be repeated")
    List<String> datasets = new ArrayList<>();

    @Option(names = "-W", paramLabel = "CLASSIFIER", description = "Classifier command line, may be repeated")
    List<String> classifiers = new ArrayList<>();

    @Option(names = "-r", paramLabel = "RUNS", description = "Number of runs")
    int runs;

    @Option(names = "-x", paramLabel = "FOLDS", description = "Number of cross-validation folds")
    int folds;

    @Option(names = "--random-split", description = "Use a random train/test split instead of cross-validation")
    boolean randomSplit;

    @Option(names = "-P", paramLabel = "PERCENT", description = "Training percentage for --random-split")
    double percentage;

    @Option(names = "--preserve-order", description = "Do not randomize the data before a random split")
    boolean preserveOrder;

    @Option(names = "--regression", description = "Regression instead of classification")
    boolean regression;

    @Option(names = "-o", paramLabel = "FILE", description = "Result file, .arff or .csv")
    String result;

    @Option(names = "--save", paramLabel = "FILE", description = "Save the configured experiment before running it")
    String save;

    public ExperimentCommand(WekaRuntimeFactory runtimeFactory,
                             @Value("${weka.experiment.runs:10}") int defaultRuns,
                             @Value("${weka.experiment.folds:10}") int defaultFolds,
                             @Value("${weka.experiment.train-percentage:66.6}") double defaultPercentage) {
        this.runtimeFactory = runtimeFactory;
        this.runs = defaultRuns;
        this.folds = defaultFolds;
        this.percentage = defaultPercentage;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try (WekaRuntime runtime = runtimeFactory.start(WekaRuntime.splitClasspath(classpath))) {
            SimpleExperiment experiment = load != null
                    ? new SimpleExperiment(runtime, SimpleExperiment.load(runtime, load).getJavaObject())
                    : build(runtime);
            experiment.setup();
            if (save != null) {
                SimpleExperiment.save(save, experiment.getExperiment().orElseThrow());
            }
            experiment.run();
            out.println("Experiment finished" + (result != null ? ", results written to " + result : ""));
        } catch (Exception e) {
            log.debug("Experiment failed", e);
            out.println(e.getMessage());
        }
        out.flush();
        return 0;
    }

    private SimpleExperiment build(WekaRuntime runtime) throws Exception {
        if (randomSplit) {
            return new SimpleRandomSplitExperiment(runtime, datasets, AlgorithmUtil.fromCommandLines(classifiers),
                    !regression, runs, percentage, preserveOrder, result);
        }
        return new SimpleCrossValidationExperiment(runtime, datasets, AlgorithmUtil.fromCommandLines(classifiers),
                !regression, runs, folds, result);
    }
}
