package com.weka_wrapper.wrapper;

import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;
import weka.clusterers.Clusterer;
import weka.core.Instance;
import weka.core.Instances;

/**
 * Wrapper for a {@code weka.clusterers.Clusterer}. The training data is not validated here,
 * use {@link #getCapabilities()} for that.
 */
public class ClustererWrapper extends OptionHandlerWrapper<Clusterer> {

    public ClustererWrapper(WekaRuntime runtime, JavaObjectSource source) throws Exception {
        super(runtime, source, Clusterer.class);
    }

    public ClustererWrapper(WekaRuntime runtime, String classname, String... options) throws Exception {
        this(runtime, JavaObjectSource.fromClassName(classname, options));
    }

    public CapabilitiesWrapper getCapabilities() throws Exception {
        return new CapabilitiesWrapper(getRuntime(), getJavaObject().getCapabilities());
    }

    public void buildClusterer(Instances data) throws Exception {
        getJavaObject().buildClusterer(data);
    }

    /**
     * @return the index of the cluster the instance belongs to
     */
    public double clusterInstance(Instance instance) throws Exception {
        return getJavaObject().clusterInstance(instance);
    }

    public double[] distributionForInstance(Instance instance) throws Exception {
        return getJavaObject().distributionForInstance(instance);
    }

    public int numberOfClusters() throws Exception {
        return getJavaObject().numberOfClusters();
    }
}
