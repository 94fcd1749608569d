package com.weka_wrapper.wrapper;

import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;
import weka.clusterers.ClusterEvaluation;
import weka.core.Instances;

public class ClusterEvaluationWrapper extends JavaObjectWrapper<ClusterEvaluation> {

    public ClusterEvaluationWrapper(WekaRuntime runtime) throws Exception {
        super(runtime, JavaObjectSource.fromClassName(ClusterEvaluation.class.getName()), ClusterEvaluation.class);
    }

    /**
     * Sets the built clusterer to evaluate.
     */
    public void setModel(ClustererWrapper clusterer) {
        getJavaObject().setClusterer(clusterer.getJavaObject());
    }

    /**
     * Evaluates the current clusterer on the test set.
     */
    public void evaluateModel(Instances test) throws Exception {
        getJavaObject().evaluateClusterer(test);
    }

    public String getClusterResults() {
        return getJavaObject().clusterResultsToString();
    }

    public int getNumClusters() {
        return getJavaObject().getNumClusters();
    }

    public double getLogLikelihood() {
        return getJavaObject().getLogLikelihood();
    }

    public double[] getClusterAssignments() {
        return getJavaObject().getClusterAssignments();
    }

    /**
     * Runs WEKA's command-line cluster evaluation ({@code -t}, {@code -T}, {@code -d}, {@code -l},
     * {@code -p}, {@code -x}, {@code -s}, {@code -c}, {@code -g}) and returns the report.
     */
    public static String evaluateClusterer(ClustererWrapper clusterer, String[] args) throws Exception {
        return ClusterEvaluation.evaluateClusterer(clusterer.getJavaObject(), args.clone());
    }
}
