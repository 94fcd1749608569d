package com.weka_wrapper.enumeration;

/**
 * Lifecycle of a {@link com.weka_wrapper.experiment.SimpleExperiment}.
 * <ul>
 *   <li>UNCONFIGURED: constructed, no WEKA experiment exists yet.</li>
 *   <li>CONFIGURED: setup() created and wired the WEKA experiment.</li>
 *   <li>INITIALIZED, RAN, POST_PROCESSED: the three phases of run(), in order.</li>
 * </ul>
 */
public enum ExperimentStateEnum {
    UNCONFIGURED,
    CONFIGURED,
    INITIALIZED,
    RAN,
    POST_PROCESSED
}
