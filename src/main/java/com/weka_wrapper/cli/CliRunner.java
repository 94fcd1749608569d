package com.weka_wrapper.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CliRunner implements CommandLineRunner {

    private final ClusterCommand clusterCommand;
    private final ExperimentCommand experimentCommand;

    @Override
    public void run(String... args) {
        WekaCommand.commandLine(clusterCommand, experimentCommand).execute(args);
    }
}
