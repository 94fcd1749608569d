package com.weka_wrapper.unit_tests.wrapper;

import com.weka_wrapper.exception.TypeMismatchException;
import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;
import com.weka_wrapper.util.TestData;
import com.weka_wrapper.wrapper.CapabilitiesWrapper;
import com.weka_wrapper.wrapper.ClustererWrapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import weka.clusterers.SimpleKMeans;
import weka.core.Instances;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ClustererWrapperTest {

    private WekaRuntime runtime;
    private Instances blobs;

    @BeforeEach
    void setUp() throws Exception {
        runtime = WekaRuntime.start();
        blobs = TestData.load("blobs.arff");
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    @Test
    @DisplayName("Should build SimpleKMeans and assign every instance to one of its clusters")
    void buildClusterer_SimpleKMeans_ClustersInstances() throws Exception {
        // Given
        ClustererWrapper clusterer = new ClustererWrapper(runtime, "weka.clusterers.SimpleKMeans", "-N", "2");

        // When
        clusterer.buildClusterer(blobs);

        // Then
        assertEquals(2, clusterer.numberOfClusters());
        double first = clusterer.clusterInstance(blobs.instance(0));
        double last = clusterer.clusterInstance(blobs.instance(blobs.numInstances() - 1));
        assertTrue(first == 0.0 || first == 1.0);
        assertNotEquals(first, last);

        double[] distribution = clusterer.distributionForInstance(blobs.instance(0));
        assertEquals(2, distribution.length);
        assertEquals(1.0, Arrays.stream(distribution).sum(), 1e-6);
    }

    @Test
    void options_RoundTripThroughWrapper() throws Exception {
        ClustererWrapper clusterer = new ClustererWrapper(runtime, "weka.clusterers.SimpleKMeans", "-N", "3");

        assertTrue(clusterer.isOptionHandler());
        assertTrue(Arrays.asList(clusterer.getOptions()).contains("3"));
        assertTrue(clusterer.toCommandLine().startsWith("weka.clusterers.SimpleKMeans"));

        clusterer.setOptions("-N", "5");
        assertEquals(5, ((SimpleKMeans) clusterer.getJavaObject()).getNumClusters());
    }

    @Test
    void wrapExisting_KeepsSameObject() throws Exception {
        SimpleKMeans kMeans = new SimpleKMeans();

        ClustererWrapper clusterer = new ClustererWrapper(runtime, JavaObjectSource.fromExisting(kMeans));

        assertSame(kMeans, clusterer.getJavaObject());
        assertEquals("weka.clusterers.SimpleKMeans", clusterer.getClassname());
    }

    @Test
    @DisplayName("Should reject a classifier where a clusterer is expected")
    void create_WithClassifier_ThrowsTypeMismatch() {
        assertThrows(TypeMismatchException.class,
                () -> new ClustererWrapper(runtime, "weka.classifiers.trees.J48"));
    }

    @Test
    void capabilities_DescribeSupportedData() throws Exception {
        // Given
        ClustererWrapper clusterer = new ClustererWrapper(runtime, "weka.clusterers.SimpleKMeans");

        // When
        CapabilitiesWrapper capabilities = clusterer.getCapabilities();

        // Then
        assertTrue(capabilities.handles("NUMERIC_ATTRIBUTES"));
        assertTrue(capabilities.listCapabilities().contains("NUMERIC_ATTRIBUTES"));
        assertTrue(capabilities.test(blobs));
    }

    @Test
    void getJavaObject_AfterStop_Fails() throws Exception {
        ClustererWrapper clusterer = new ClustererWrapper(runtime, "weka.clusterers.SimpleKMeans");
        runtime.stop();

        assertThrows(IllegalStateException.class, clusterer::getJavaObject);
        assertFalse(clusterer.getHandle().isValid());
    }
}
