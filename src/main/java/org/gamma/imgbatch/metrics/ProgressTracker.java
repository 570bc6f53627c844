package org.gamma.imgbatch.metrics;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Live counter against a precomputed total. Safe to call from any worker thread.
 */
public class ProgressTracker implements ProgressListener {

    private static final Logger LOGGER = Logger.getLogger(ProgressTracker.class.getName());

    private final String jobName;
    private final int total;
    private final AtomicInteger done = new AtomicInteger();

    public ProgressTracker(String jobName, int total) {
        this.jobName = jobName;
        this.total = total;
    }

    @Override
    public void onItemCompleted(String displayName, Status status) {
        int current = done.incrementAndGet();
        LOGGER.log(Level.INFO, "{0} [{1}/{2}] {3} {4}", new Object[]{jobName, current, total, status, displayName});
    }

    public int completed() {
        return done.get();
    }

    public int total() {
        return total;
    }
}
