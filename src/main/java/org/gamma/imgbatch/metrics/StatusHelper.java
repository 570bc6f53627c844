package org.gamma.imgbatch.metrics;

import java.time.Duration;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Helper methods for creating metrics instances, especially for failure cases,
 * and determining overall status.
 */
public final class StatusHelper {

    private static final Logger LOGGER = Logger.getLogger(StatusHelper.class.getName());

    private StatusHelper() {
    } // Prevent instantiation

    // --- Failure Metric Creators ---

    public static RunInfo createAbortedRunInfo(String jobName, Duration duration, Throwable cause) {
        return new RunInfo(jobName, Status.FAIL, duration, 0, 0, 0, 0, 0, 0, 0L, List.of(), cause);
    }

    // --- Status Determination ---

    /**
     * Determines the overall status based on a collection of results,
     * considering if any sub-tasks failed or if expected tasks produced no results.
     * Skipped results count as completed; partial results downgrade a pass to {@link Status#PARTIAL}.
     */
    public static <T extends HasStatus> Status determineOverallStatus(
            final List<T> results,
            final int expectedTaskCount,
            final String levelName,
            final Object identifier) {

        final String idStr = identifier != null ? identifier.toString() : "N/A";

        if (results.stream().anyMatch(r -> r.status() == Status.FAIL)) {
            LOGGER.log(Level.WARNING, "{0} {1}: Marked as FAIL because at least one sub-task reported FAIL status.",
                    new Object[]{levelName, idStr});
            return Status.FAIL;
        }

        if (results.size() < expectedTaskCount) {
            LOGGER.log(Level.WARNING, "{0} {1}: Marked as FAIL because some sub-tasks produced no result ({2}/{3}).",
                    new Object[]{levelName, idStr, results.size(), expectedTaskCount});
            return Status.FAIL;
        }

        if (results.stream().anyMatch(r -> r.status() == Status.PARTIAL)) {
            LOGGER.log(Level.INFO, "{0} {1}: Marked as PARTIAL ({2} sub-tasks).", new Object[]{levelName, idStr, results.size()});
            return Status.PARTIAL;
        }

        LOGGER.log(Level.FINE, "{0} {1}: Marked as PASS ({2}/{3} sub-tasks completed).",
                new Object[]{levelName, idStr, results.size(), expectedTaskCount});
        return Status.PASS;
    }

    public static long count(final List<? extends HasStatus> results, final Status status) {
        return results.stream().filter(r -> r.status() == status).count();
    }
}
