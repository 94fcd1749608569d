package com.weka_wrapper.unit_tests.cli;

import com.weka_wrapper.cli.ClusterCommand;
import com.weka_wrapper.cli.ExperimentCommand;
import com.weka_wrapper.cli.WekaCommand;
import com.weka_wrapper.config.WekaRuntimeFactory;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class WekaCommandTest {

    @Test
    void execute_WithoutSubcommand_PrintsUsage() {
        // Given
        WekaRuntimeFactory runtimeFactory = new WekaRuntimeFactory("");
        CommandLine commandLine = WekaCommand.commandLine(new ClusterCommand(runtimeFactory),
                new ExperimentCommand(runtimeFactory, 10, 10, 66.6));
        StringWriter out = new StringWriter();
        commandLine.setOut(new PrintWriter(out));

        // When
        int exitCode = commandLine.execute();

        // Then
        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("cluster"));
        assertTrue(out.toString().contains("experiment"));
    }
}
