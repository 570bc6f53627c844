package org.gamma.imgbatch;

import org.gamma.imgbatch.config.AppConfig;
import org.gamma.imgbatch.config.BatchAbortException;
import org.gamma.imgbatch.config.BatchJobItem;
import org.gamma.imgbatch.config.ConfigManager;
import org.gamma.imgbatch.metrics.ItemInfo;
import org.gamma.imgbatch.metrics.RunInfo;
import org.gamma.imgbatch.metrics.Status;
import org.gamma.imgbatch.metrics.StatusHelper;
import org.gamma.imgbatch.processing.BatchEngine;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line runner: executes every active batch job of the configuration file, one after the other.
 * <p>
 * Usage: {@code ImgBatch [config.yaml]}, defaulting to {@code conf/config.yaml}. The exit code is non-zero when a
 * job aborted or any image failed.
 */
public class ImgBatch {

    private static final Logger LOGGER = Logger.getLogger(ImgBatch.class.getName());
    static final Path LOCK_FILE = Path.of(".imgbatch.lock");

    private final AppConfig appConfig;
    private final Function<BatchJobItem, BatchEngine> engineFactory;
    private volatile BatchEngine currentEngine;
    private volatile boolean stopRequested = false;

    public ImgBatch(final AppConfig appConfig) {
        this(appConfig, BatchEngine::new);
    }

    ImgBatch(final AppConfig appConfig, final Function<BatchJobItem, BatchEngine> engineFactory) {
        this.appConfig = Objects.requireNonNull(appConfig, "Configuration cannot be null");
        this.engineFactory = engineFactory;
        if (appConfig.batchJobs().isEmpty()) {
            LOGGER.warning("No batch jobs configured.");
        }
    }

    public static void main(final String[] args) {
        ConfigManager.configureLogging(Level.INFO);
        System.exit(run(args));
    }

    static int run(final String[] args) {
        Path configPath = args.length > 0 ? Path.of(args[0]) : ConfigManager.DEFAULT_CONFIG_PATH;

        try (RandomAccessFile raf = new RandomAccessFile(LOCK_FILE.toFile(), "rw");
             FileChannel channel = raf.getChannel();
             FileLock lock = channel.tryLock()) {
            if (lock == null) {
                System.err.printf("!!!! WARN: Could not acquire lock (%s), another instance already running ??? %n", LOCK_FILE);
                return 2;
            }

            AppConfig appConfig;
            try {
                appConfig = ConfigManager.load(configPath);
            } catch (BatchAbortException e) {
                System.err.println("Invalid configuration: " + e.getMessage());
                return 1;
            }

            final ImgBatch runner = new ImgBatch(appConfig);
            final CountDownLatch finished = new CountDownLatch(1);
            Thread hook = new Thread(() -> {
                runner.requestStop();
                try {
                    finished.await(60, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "ImgBatch-Shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            List<RunInfo> results;
            try {
                System.out.println("========================================================");
                System.out.println(" Starting batch run: " + configPath);
                System.out.println("========================================================");
                final Instant start = Instant.now();
                results = runner.execute();
                System.out.println("\n========================================================");
                System.out.println(" Batch run finished ");
                System.out.println("========================================================");
                printMetricsSummary(results, Duration.between(start, Instant.now()));
            } finally {
                finished.countDown();
                removeHook(hook);
            }
            return exitCode(results);
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            return 1;
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOGGER.fine("JVM is shutting down, shutdown hook stays registered");
        }
    }

    /**
     * Runs the active jobs in configuration order. An aborted job is recorded and the next one still runs.
     */
    public List<RunInfo> execute() {
        List<RunInfo> results = new ArrayList<>();
        for (BatchJobItem job : appConfig.batchJobs()) {
            if (!job.enabled()) {
                LOGGER.log(Level.INFO, "Skipping inactive job {0}", job.displayName());
                continue;
            }
            if (stopRequested) {
                LOGGER.log(Level.INFO, "Stop requested, not starting job {0}", job.displayName());
                continue;
            }
            final Instant start = Instant.now();
            try {
                BatchEngine engine = engineFactory.apply(job);
                currentEngine = engine;
                results.add(engine.run().runInfo());
            } catch (BatchAbortException e) {
                results.add(StatusHelper.createAbortedRunInfo(job.displayName(), Duration.between(start, Instant.now()), e));
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Uncaught exception running job " + job.displayName(), e);
                results.add(StatusHelper.createAbortedRunInfo(job.displayName(), Duration.between(start, Instant.now()), e));
            } finally {
                currentEngine = null;
            }
        }
        return results;
    }

    public void requestStop() {
        stopRequested = true;
        BatchEngine engine = currentEngine;
        if (engine != null) engine.requestStop();
    }

    static int exitCode(List<RunInfo> results) {
        boolean failed = results.stream().anyMatch(r -> r.status() == Status.FAIL || r.failed() > 0);
        return failed ? 1 : 0;
    }

    static void printMetricsSummary(final List<RunInfo> results, final Duration total) {
        System.out.println("Total Execution Time: " + total.toMillis() + " ms");
        System.out.println("---------------------- RUN SUMMARY ----------------------");
        for (final RunInfo r : results) {
            String failInfo = r.failureCause() != null ? "[ABORTED: " + r.failureCause().getMessage() + "]" : "";
            System.out.printf("Job: %-20s | Status: %-7s | Duration: %6dms | Images: %d | Passed: %d | Partial: %d | Skipped: %d | Failed: %d | Not dispatched: %d | Rows: %d %s%n",
                    r.jobName(), r.status(), r.duration().toMillis(), r.totalItems(), r.succeeded(), r.partial(),
                    r.skipped(), r.failed(), r.notDispatched(), r.rowsWritten(), failInfo);
            for (final ItemInfo item : r.itemInfo()) {
                if (item.status() == Status.FAIL) {
                    System.out.printf("    FAILED: %-40s | Thread: %-20s | %s%n", item.displayName(), item.threadName(), item.message());
                }
            }
        }
        System.out.println("---------------------------------------------------------");
    }
}
