package org.gamma.imgbatch.config;

/**
 * How existing artifacts from earlier runs decide whether an image is processed again.
 */
public enum SkipPolicy {
    /** Skip when an output or a failure artifact exists. */
    SKIP_EXISTING,
    /** Skip only when an output artifact exists; images in the failure bucket are retried. */
    REDO_FAILURES,
    /** Never skip. */
    OVERWRITE
}
