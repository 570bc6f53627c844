package org.gamma.imgbatch.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods for handling concurrency, executors, and futures.
 */
public final class ConcurrencyUtils {

    private static final Logger LOGGER = Logger.getLogger(ConcurrencyUtils.class.getName());
    private static final Duration SHUTDOWN_WAIT_TIMEOUT = Duration.ofSeconds(60);

    private ConcurrencyUtils() {
    } // Prevent instantiation

    /**
     * Creates a ThreadFactory for creating named platform threads ({@code prefix1}, {@code prefix2}, ...).
     */
    public static ThreadFactory createPlatformThreadFactory(final String prefix) {
        final AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            final Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
    }

    /**
     * Gracefully shuts down an ExecutorService.
     */
    public static void shutdownExecutorService(final ExecutorService executor, final String name) {
        if (executor == null) return;
        LOGGER.log(Level.FINE, "Attempting graceful shutdown of executor: {0}", name);

        executor.shutdown(); // Disable new tasks
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                LOGGER.log(Level.WARNING, "Executor {0} did not terminate in {1}s, attempting forceful shutdown...",
                        new Object[]{name, SHUTDOWN_WAIT_TIMEOUT.toSeconds()});
                final List<Runnable> droppedTasks = executor.shutdownNow(); // Cancel executing tasks
                LOGGER.log(Level.WARNING, "Executor {0} forcing shutdown. Dropped {1} waiting tasks.",
                        new Object[]{name, droppedTasks.size()});

                if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS))
                    LOGGER.log(Level.SEVERE, "Executor {0} did not terminate even after forcing.", name);
                else
                    LOGGER.log(Level.INFO, "Executor {0} terminated after forcing.", name);

            } else
                LOGGER.log(Level.FINE, "Executor {0} terminated gracefully.", name);

        } catch (final InterruptedException ie) {
            LOGGER.log(Level.WARNING, "Shutdown wait for executor {0} interrupted. Forcing shutdown now.", name);
            executor.shutdownNow(); // Re-cancel if interrupted
            Thread.currentThread().interrupt(); // Preserve interrupt status
        }
    }

    /**
     * Waits for a list of CompletableFutures to complete, collects their results, and logs errors.
     * Futures that completed exceptionally or were cancelled contribute no result.
     */
    public static <T> List<T> waitForCompletableFuturesAndCollect(
            final String levelName,
            final List<CompletableFuture<T>> futures,
            final Object identifier) {

        final String idStr = identifier != null ? identifier.toString() : "N/A";
        if (futures.isEmpty()) {
            LOGGER.log(Level.FINE, "No {0} job to wait for (ID: {1}).", new Object[]{levelName, idStr});
            return Collections.emptyList();
        }

        final List<T> results = new ArrayList<>();
        LOGGER.log(Level.FINE, "Waiting for {0} {1} jobs (ID: {2})...", new Object[]{futures.size(), levelName, idStr});

        final CompletableFuture<Void> allOf = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));

        try {
            allOf.join();
        } catch (final CancellationException e) {
            LOGGER.log(Level.WARNING, "{0} waiting (allOf) was cancelled (ID: {1}).", new Object[]{levelName, idStr});
        } catch (final CompletionException e) {
            LOGGER.log(Level.WARNING, "Unexpected error during allOf completion for {0} (ID: {1}): {2}",
                    new Object[]{levelName, idStr, e.getMessage()});
        }

        for (final CompletableFuture<T> future : futures) {
            try {
                results.add(future.join());
            } catch (final CompletionException e) {
                LOGGER.log(Level.WARNING, "{0} job (ID: {1}) completed exceptionally: {2}",
                        new Object[]{levelName, idStr, e.getCause() != null ? e.getCause().getMessage() : e.getMessage()});
            } catch (final CancellationException e) {
                LOGGER.log(Level.WARNING, "{0} job (ID: {1}) was cancelled.", new Object[]{levelName, idStr});
            }
        }

        LOGGER.log(Level.FINE, "Finished waiting for {0} (ID: {1}). Collected {2} results (out of {3} submitted).",
                new Object[]{levelName, idStr, results.size(), futures.size()});
        return results; // Return potentially partial results
    }

    /**
     * Unwraps {@link CompletionException} / {@link ExecutionException} layers to the original cause.
     */
    public static Throwable unwrap(final Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null)
            cause = cause.getCause();
        return cause;
    }
}
