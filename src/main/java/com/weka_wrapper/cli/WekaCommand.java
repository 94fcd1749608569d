package com.weka_wrapper.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "weka",
        mixinStandardHelpOptions = true,
        header = "Runs WEKA clusterer evaluations and experiments",
        description = "Use the cluster subcommand to evaluate a clusterer, or the experiment subcommand "
                + "to run a cross-validation or random split experiment.")
public class WekaCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    /**
     * Builds the command hierarchy. Parsing stops at the first positional parameter so that the
     * option tail of a clusterer class name is passed on untouched.
     */
    public static CommandLine commandLine(ClusterCommand clusterCommand, ExperimentCommand experimentCommand) {
        CommandLine commandLine = new CommandLine(new WekaCommand());
        commandLine.addSubcommand("cluster", clusterCommand);
        commandLine.addSubcommand("experiment", experimentCommand);
        commandLine.setStopAtPositional(true);
        return commandLine;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
