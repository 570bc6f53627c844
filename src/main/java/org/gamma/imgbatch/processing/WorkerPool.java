package org.gamma.imgbatch.processing;

import org.gamma.imgbatch.plugin.ProcessingOutcome;
import org.gamma.imgbatch.util.ConcurrencyUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans work items out to a fixed pool of named platform threads and collects one {@link CompletedItem} per
 * submitted item. Completion order is not guaranteed. Faults of a task become {@code FAILED} outcomes; the pool
 * itself never throws on behalf of a worker.
 */
public class WorkerPool {

    private static final Logger LOGGER = Logger.getLogger(WorkerPool.class.getName());

    /**
     * @param stopped {@code true} when {@link #requestStop()} cut the enumeration short
     */
    public record PoolResult(List<CompletedItem> completed, int submitted, boolean stopped) {
    }

    private final String name;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public WorkerPool(String name) {
        this.name = name;
    }

    /**
     * Runs {@code task} once for every item. With {@code parallelism <= 1} items run sequentially on the
     * calling thread, in enumeration order.
     *
     * @param onComplete notified once per completed item, on the thread that completed it
     */
    public PoolResult run(Iterator<WorkItem> items, int parallelism, Function<WorkItem, ProcessingOutcome> task,
                          Consumer<CompletedItem> onComplete) {
        if (parallelism <= 1) {
            return runSequential(items, task, onComplete);
        }
        return runParallel(items, parallelism, task, onComplete);
    }

    private PoolResult runSequential(Iterator<WorkItem> items, Function<WorkItem, ProcessingOutcome> task,
                                     Consumer<CompletedItem> onComplete) {
        List<CompletedItem> completed = new ArrayList<>();
        int submitted = 0;
        while (!stopRequested.get() && items.hasNext()) {
            WorkItem item = items.next();
            submitted++;
            completed.add(execute(item, task, onComplete));
        }
        return new PoolResult(completed, submitted, stopRequested.get() && items.hasNext());
    }

    private PoolResult runParallel(Iterator<WorkItem> items, int parallelism, Function<WorkItem, ProcessingOutcome> task,
                                   Consumer<CompletedItem> onComplete) {
        final ExecutorService executor = Executors.newFixedThreadPool(parallelism,
                ConcurrencyUtils.createPlatformThreadFactory(name + "-Worker-"));
        final List<CompletableFuture<CompletedItem>> futures = new ArrayList<>();
        List<CompletedItem> completed;
        boolean stopped;
        try {
            while (!stopRequested.get() && items.hasNext()) {
                final WorkItem item = items.next();
                futures.add(CompletableFuture
                        .supplyAsync(() -> execute(item, task, onComplete), executor)
                        .exceptionally(ex -> {
                            Throwable cause = ConcurrencyUtils.unwrap(ex);
                            LOGGER.log(Level.SEVERE, "Worker failed outside the item task for " + item.displayName(), cause);
                            CompletedItem failed = new CompletedItem(item,
                                    ProcessingOutcome.failed(String.valueOf(cause), cause), Duration.ZERO,
                                    Thread.currentThread().getName());
                            notify(onComplete, failed);
                            return failed;
                        }));
            }
            stopped = stopRequested.get() && items.hasNext();
            completed = ConcurrencyUtils.waitForCompletableFuturesAndCollect("Item", futures, name);
        } finally {
            ConcurrencyUtils.shutdownExecutorService(executor, name + "-WorkerPool");
        }

        if (completed.size() != futures.size()) {
            LOGGER.log(Level.SEVERE, "{0}: collected {1} outcomes for {2} submitted items",
                    new Object[]{name, completed.size(), futures.size()});
        }
        return new PoolResult(completed, futures.size(), stopped);
    }

    private CompletedItem execute(WorkItem item, Function<WorkItem, ProcessingOutcome> task,
                                  Consumer<CompletedItem> onComplete) {
        final Instant start = Instant.now();
        ProcessingOutcome outcome;
        try {
            outcome = task.apply(item);
            if (outcome == null) outcome = ProcessingOutcome.failed("no outcome returned", null);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Unexpected error processing " + item.displayName(), e);
            outcome = ProcessingOutcome.failed(String.valueOf(e), e);
        }
        CompletedItem done = new CompletedItem(item, outcome, Duration.between(start, Instant.now()),
                Thread.currentThread().getName());
        notify(onComplete, done);
        return done;
    }

    private void notify(Consumer<CompletedItem> onComplete, CompletedItem done) {
        try {
            onComplete.accept(done);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Progress notification failed for " + done.item().displayName(), e);
        }
    }

    /**
     * Stops handing out new items. Items already submitted still complete.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true))
            LOGGER.log(Level.INFO, "{0}: stop requested, no further items will be dispatched", name);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }
}
