package com.weka_wrapper.integration.experiment;

import com.weka_wrapper.enumeration.ExperimentStateEnum;
import com.weka_wrapper.exception.ExperimentConfigurationException;
import com.weka_wrapper.experiment.SimpleExperiment;
import com.weka_wrapper.experiment.SimpleRandomSplitExperiment;
import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;
import com.weka_wrapper.util.TestData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import weka.core.Instances;
import weka.core.converters.ConverterUtils.DataSource;
import weka.experiment.PropertyNode;
import weka.experiment.RandomSplitResultProducer;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimpleRandomSplitExperimentIntegrationTest {

    private static final List<JavaObjectSource> CLASSIFIERS = List.of(
            JavaObjectSource.fromClassName("weka.classifiers.trees.J48"),
            JavaObjectSource.fromClassName("weka.classifiers.rules.ZeroR"));

    private WekaRuntime runtime;
    private List<String> datasets;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        runtime = WekaRuntime.start();
        datasets = List.of(TestData.datasetPath("a.arff"));
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    @Test
    void create_ZeroPercentage_Fails() {
        ExperimentConfigurationException ex = assertThrows(ExperimentConfigurationException.class,
                () -> new SimpleRandomSplitExperiment(runtime, datasets, CLASSIFIERS, true, 10, 0, false, "out.csv"));

        assertEquals("Percentage for training must be >0!", ex.getMessage());
    }

    @Test
    void create_HundredPercentage_Fails() {
        ExperimentConfigurationException ex = assertThrows(ExperimentConfigurationException.class,
                () -> new SimpleRandomSplitExperiment(runtime, datasets, CLASSIFIERS, true, 10, 100, false, "out.csv"));

        assertEquals("Percentage for training must be <100!", ex.getMessage());
    }

    @Test
    void create_Defaults() {
        SimpleRandomSplitExperiment experiment = new SimpleRandomSplitExperiment(runtime, datasets, CLASSIFIERS, "out.csv");

        assertEquals(66.6, experiment.getPercentage(), 1e-9);
        assertFalse(experiment.isPreserveOrder());
        assertEquals(SimpleExperiment.DEFAULT_RUNS, experiment.getRuns());
    }

    @Test
    void setup_PreserveOrder_DisablesRandomization() throws Exception {
        // Given
        SimpleRandomSplitExperiment experiment = new SimpleRandomSplitExperiment(runtime, datasets, CLASSIFIERS,
                true, 2, 80, true, tempDir.resolve("out.arff").toString());

        // When
        experiment.setup();

        // Then
        RandomSplitResultProducer producer = assertInstanceOf(RandomSplitResultProducer.class,
                experiment.getExperiment().orElseThrow().getResultProducer());
        assertFalse(producer.getRandomizeData());
        assertEquals(80, producer.getTrainPercent(), 1e-9);

        PropertyNode[] path = experiment.getExperiment().orElseThrow().getPropertyPath();
        assertEquals(RandomSplitResultProducer.class, path[0].parentClass);
    }

    @Test
    void run_WritesOneResultPerRunAndClassifier() throws Exception {
        // Given
        String result = tempDir.resolve("out.arff").toString();
        SimpleRandomSplitExperiment experiment = new SimpleRandomSplitExperiment(runtime, datasets, CLASSIFIERS,
                true, 3, 50, false, result);
        experiment.setup();

        // When
        experiment.run();

        // Then
        assertEquals(ExperimentStateEnum.POST_PROCESSED, experiment.getState());
        Instances results = DataSource.read(result);
        assertEquals(3 * 2, results.numInstances());
        assertNotNull(results.attribute("Percent_correct"));
    }
}
