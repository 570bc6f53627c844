package org.gamma.imgbatch.metrics;

/**
 * Represents the status of a processing step.
 */
public enum Status {
    PASS,    // Completed successfully
    PARTIAL, // Completed, but at least one stage failed or rejected the image
    SKIPPED, // Already processed by an earlier run
    FAIL     // Failed entirely
}
