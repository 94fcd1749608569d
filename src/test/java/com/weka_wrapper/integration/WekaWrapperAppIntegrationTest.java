package com.weka_wrapper.integration;

import com.weka_wrapper.cli.ClusterCommand;
import com.weka_wrapper.cli.ExperimentCommand;
import com.weka_wrapper.config.WekaRuntimeFactory;
import com.weka_wrapper.runtime.WekaRuntime;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@TestPropertySource(properties = "weka.classpath=target/extra-classes")
class WekaWrapperAppIntegrationTest {

    @Autowired
    private WekaRuntimeFactory runtimeFactory;

    @Autowired
    private ClusterCommand clusterCommand;

    @Autowired
    private ExperimentCommand experimentCommand;

    @Test
    void contextLoads_WithCommandsAndConfiguredClasspath() {
        assertNotNull(clusterCommand);
        assertNotNull(experimentCommand);
        assertEquals(1, runtimeFactory.getBaseClasspath().size());

        try (WekaRuntime runtime = runtimeFactory.start(WekaRuntime.splitClasspath("target/more-classes"))) {
            assertEquals(2, runtime.getClasspath().size());
            assertTrue(runtime.isRunning());
        }
    }
}
