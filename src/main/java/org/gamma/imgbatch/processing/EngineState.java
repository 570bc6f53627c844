package org.gamma.imgbatch.processing;

/**
 * Lifecycle of one {@link BatchEngine} run. {@link #FATAL_ABORT} is only reachable before dispatching starts.
 */
public enum EngineState {
    CONFIGURING,
    VALIDATING_TABLE,
    SCANNING,
    DISPATCHING,
    DRAINING,
    DONE,
    FATAL_ABORT
}
