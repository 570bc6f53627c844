package org.gamma.imgbatch.metrics;

/**
 * Receives one tick per completed item, whatever its status.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (displayName, status) -> {
    };

    void onItemCompleted(String displayName, Status status);
}
