package com.weka_wrapper.cli;

import com.weka_wrapper.config.WekaRuntimeFactory;
import com.weka_wrapper.runtime.WekaRuntime;
import com.weka_wrapper.util.AlgorithmUtil;
import com.weka_wrapper.wrapper.ClusterEvaluationWrapper;
import com.weka_wrapper.wrapper.ClustererWrapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Evaluates a clusterer with WEKA's own command-line evaluation. Prints the report, or the
 * error message if the evaluation fails.
 */
@Slf4j
@Component
@Command(name = "cluster",
        mixinStandardHelpOptions = true,
        header = "Builds and evaluates a clusterer",
        description = "Options after the clusterer class name are passed to the clusterer.")
public class ClusterCommand implements Callable<Integer> {

    public static final String USAGE = "Usage: weka cluster -j jar1[" + File.pathSeparator + "jar2...] "
            + "-t train [-T test] [-d output model file] [-l input model file] "
            + "[-p attribute range] [-x num folds] [-s seed] [-c classindex] "
            + "[-g graph file] clusterer classname [clusterer options]";

    private static final Set<String> EVALUATION_FLAGS = Set.of("-t", "-T", "-d", "-l", "-p", "-x", "-s", "-c", "-g");

    private final WekaRuntimeFactory runtimeFactory;

    @Spec
    CommandSpec spec;

    @Option(names = "-j", paramLabel = "CLASSPATH", description = "Additional classpath entries, separated by the path separator")
    String classpath;

    @Option(names = "-t", paramLabel = "FILE", description = "Training file")
    String train;

    @Option(names = "-T", paramLabel = "FILE", description = "Test file")
    String test;

    @Option(names = "-d", paramLabel = "FILE", description = "Output model file")
    String outputModel;

    @Option(names = "-l", paramLabel = "FILE", description = "Input model file")
    String inputModel;

    @Option(names = "-p", paramLabel = "RANGE", description = "Attribute range to output with the predictions")
    String attributeRange;

    @Option(names = "-x", paramLabel = "FOLDS", description = "Number of folds for cross-validation")
    String folds;

    @Option(names = "-s", paramLabel = "SEED", description = "Random seed for cross-validation")
    String seed;

    @Option(names = "-c", paramLabel = "INDEX", description = "Class index for classes to clusters evaluation")
    String classIndex;

    @Option(names = "-g", paramLabel = "FILE", description = "Graph output file")
    String graphFile;

    @Parameters(arity = "0..*", paramLabel = "CLASSNAME [OPTIONS]", description = "Clusterer class name and its options")
    List<String> clusterer = new ArrayList<>();

    public ClusterCommand(WekaRuntimeFactory runtimeFactory) {
        this.runtimeFactory = runtimeFactory;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (clusterer.isEmpty()) {
            out.println("No clusterer classname provided!\n" + USAGE);
            out.flush();
            return 0;
        }
        if (train == null) {
            out.println("No train file provided ('-t ...')!");
            out.flush();
            return 0;
        }

        String classname = clusterer.get(0);
        List<String> clustererOptions = clusterer.subList(1, clusterer.size());

        try (WekaRuntime runtime = runtimeFactory.start(WekaRuntime.splitClasspath(classpath))) {
            log.info("Commandline: {}", AlgorithmUtil.joinOptions(spec.commandLine().getParseResult().originalArgs()));
            ClustererWrapper wrapper = new ClustererWrapper(runtime, classname, clustererOptions.toArray(new String[0]));
            // WEKA re-applies whatever options remain after its own, so the clusterer's go last
            List<String> args = evaluationOptions();
            args.addAll(clustererOptions);
            out.println(ClusterEvaluationWrapper.evaluateClusterer(wrapper, args.toArray(new String[0])));
        } catch (Exception e) {
            log.debug("Cluster evaluation failed", e);
            out.println(e.getMessage());
        }
        out.flush();
        return 0;
    }

    /**
     * The flags meant for WEKA's evaluation, in the order they were given on the command line.
     */
    public List<String> evaluationOptions() {
        List<String> params = new ArrayList<>();
        for (OptionSpec option : spec.commandLine().getParseResult().matchedOptions()) {
            String flag = option.shortestName();
            if (EVALUATION_FLAGS.contains(flag)) {
                String value = option.getValue();
                params.add(flag);
                params.add(value);
            }
        }
        return params;
    }
}
