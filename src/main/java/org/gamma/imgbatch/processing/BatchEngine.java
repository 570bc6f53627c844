package org.gamma.imgbatch.processing;

import org.gamma.imgbatch.config.AlgorithmParams;
import org.gamma.imgbatch.config.BatchAbortException;
import org.gamma.imgbatch.config.BatchJobItem;
import org.gamma.imgbatch.config.ConfigurationException;
import org.gamma.imgbatch.config.SkipPolicy;
import org.gamma.imgbatch.image.ImageCodec;
import org.gamma.imgbatch.metrics.ItemInfo;
import org.gamma.imgbatch.metrics.ProgressListener;
import org.gamma.imgbatch.metrics.ProgressTracker;
import org.gamma.imgbatch.metrics.RunInfo;
import org.gamma.imgbatch.metrics.Status;
import org.gamma.imgbatch.metrics.StatusHelper;
import org.gamma.imgbatch.plugin.AdapterFactory;
import org.gamma.imgbatch.plugin.ProcessingOutcome;
import org.gamma.imgbatch.plugin.ProcessorAdapter;
import org.gamma.imgbatch.table.ResultRow;
import org.gamma.imgbatch.table.ResultTable;
import org.gamma.imgbatch.table.SchemaIncompatibleException;
import org.gamma.imgbatch.table.TableSchema;
import org.gamma.imgbatch.util.FileUtils;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one batch job: validates the configuration and the result table, enumerates the input tree and dispatches
 * every image to the adapter through a {@link WorkerPool}. Outcomes are routed as they complete.
 * <p>
 * Fatal problems surface as {@link BatchAbortException} before any image is processed. After dispatching has
 * started, faults are confined to the item they happened on.
 */
public class BatchEngine {

    private static final Logger LOGGER = Logger.getLogger(BatchEngine.class.getName());
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH:mm:ss");

    private final BatchJobItem job;
    private final ProcessorAdapter adapter;
    private final ImageCodec codec;
    private final Clock clock;
    private final WorkerPool pool;
    private volatile EngineState state = EngineState.CONFIGURING;
    private ProgressListener progressListener = ProgressListener.NONE;

    public BatchEngine(BatchJobItem job) {
        this(job, job.algorithm() == null ? null : AdapterFactory.create(job.algorithm()), new ImageCodec(),
                Clock.systemDefaultZone());
    }

    public BatchEngine(BatchJobItem job, ProcessorAdapter adapter, ImageCodec codec, Clock clock) {
        this.job = job;
        this.adapter = adapter;
        this.codec = codec;
        this.clock = clock;
        this.pool = new WorkerPool(job.displayName());
    }

    /**
     * Additional listener notified once per completed item, besides the logging progress tracker.
     */
    public BatchEngine withProgressListener(ProgressListener listener) {
        this.progressListener = listener == null ? ProgressListener.NONE : listener;
        return this;
    }

    /**
     * Runs the job to completion.
     *
     * @throws ConfigurationException      when the job or the algorithm parameters are invalid
     * @throws SchemaIncompatibleException when an existing result table has another header
     * @throws BatchAbortException         when the result table cannot be opened
     */
    public BatchResult run() throws BatchAbortException {
        final Instant start = Instant.now();
        final String jobName = job.displayName();
        final AlgorithmParams params = job.params();

        transition(EngineState.CONFIGURING);
        final PathLayout layout;
        final Optional<TableSchema> schema;
        try {
            job.validate();
            if (adapter == null) throw new ConfigurationException("Job '" + jobName + "': no adapter for " + job.algorithm());
            adapter.validate(params);
            schema = adapter.schema(params);
            layout = PathLayout.resolve(job, adapter, schema.isPresent());
        } catch (ConfigurationException e) {
            throw abort(e);
        }
        final SkipPolicy skipPolicy = skipPolicy(layout);

        transition(EngineState.VALIDATING_TABLE);
        ResultTable table = null;
        if (schema.isPresent()) {
            try {
                table = ResultTable.openOrCreate(layout.tablePath(), schema.get(), job.delimiterChar(), job.overwriteTable());
            } catch (SchemaIncompatibleException e) {
                throw abort(e);
            } catch (IOException e) {
                throw abort(new BatchAbortException("Job '" + jobName + "': couldn't open result table "
                        + layout.tablePath() + ": " + e.getMessage(), e));
            }
        }

        try {
            transition(EngineState.SCANNING);
            boolean mirror = adapter.producesArtifacts() && job.shouldSaveArtifacts();
            if (mirror) {
                ensureRoot(layout.outputRoot());
                ensureRoot(layout.failureRoot());
            }
            PathSet paths = new PathSet(layout, job.extension(), mirror);
            int total = paths.count();
            LOGGER.log(Level.INFO, "{0}: {1} {2} image(s) to analyze in {3}",
                    new Object[]{jobName, total, job.extension(), layout.inputRoot()});

            transition(EngineState.DISPATCHING);
            final ProgressTracker tracker = new ProgressTracker(jobName, total);
            final IdempotencyGuard guard = new IdempotencyGuard(skipPolicy);
            final ConcurrentLinkedQueue<ResultRow> appended = new ConcurrentLinkedQueue<>();
            final ResultTable openTable = table;
            WorkerPool.PoolResult poolResult = pool.run(paths.iterator(), job.effectiveParallelism(),
                    item -> processItem(item, params, guard, openTable, schema.orElse(null), appended),
                    done -> {
                        Status status = statusOf(done.outcome());
                        tracker.onItemCompleted(done.item().displayName(), status);
                        progressListener.onItemCompleted(done.item().displayName(), status);
                    });

            transition(EngineState.DRAINING);
            RunInfo runInfo = buildRunInfo(jobName, start, total, poolResult);
            transition(EngineState.DONE);
            logSummary(runInfo, layout);
            return new BatchResult(List.copyOf(appended), runInfo);
        } finally {
            closeTable(table);
        }
    }

    /**
     * Per-item step, run on the worker: skip check, adapter call, then artifact and rows.
     */
    ProcessingOutcome processItem(WorkItem item, AlgorithmParams params, IdempotencyGuard guard, ResultTable table,
                                  TableSchema schema, ConcurrentLinkedQueue<ResultRow> appended) {
        if (guard.shouldSkip(item)) return ProcessingOutcome.skipped();

        ProcessingOutcome outcome = adapter.process(item, params);
        if (outcome == null) return ProcessingOutcome.failed("adapter returned no outcome", null);
        if (!outcome.isSuccess()) {
            if (outcome.kind() == ProcessingOutcome.Kind.FAILED)
                LOGGER.log(Level.WARNING, "{0} failed: {1}", new Object[]{item.displayName(), outcome.reason()});
            return outcome;
        }

        BufferedImage artifact = outcome.artifact();
        Path written = null;
        if (artifact != null && job.shouldSaveArtifacts() && adapter.producesArtifacts()) {
            Path target = outcome.isClean() ? item.outputPath() : item.failurePath();
            try {
                codec.write(artifact, target);
                written = target;
            } catch (IOException | RuntimeException e) {
                LOGGER.log(Level.WARNING, "{0}: couldn''t write {1}: {2}",
                        new Object[]{item.displayName(), target, e.getMessage()});
                return ProcessingOutcome.failed("Couldn't write artifact: " + e.getMessage(), e);
            }
        }

        // an artifact marks the item done, so it is removed again if its rows can't be appended
        List<ResultRow> rows = List.of();
        if (table != null && !outcome.rows().isEmpty()) {
            rows = stamp(outcome.rows(), schema);
            try {
                table.append(rows);
                appended.addAll(rows);
            } catch (IOException | IllegalArgumentException e) {
                LOGGER.log(Level.WARNING, "{0}: couldn''t append rows to {1}: {2}",
                        new Object[]{item.displayName(), table.path(), e.getMessage()});
                if (written != null && !written.equals(item.inputPath())) discard(written);
                return ProcessingOutcome.failed("Couldn't append rows: " + e.getMessage(), e);
            }
        }

        if (written != null) guard.removeStale(item, written);
        return new ProcessingOutcome(outcome.kind(), artifact, rows, outcome.degradedStages(), outcome.reason(),
                outcome.cause());
    }

    private void discard(Path artifact) {
        try {
            Files.deleteIfExists(artifact);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Couldn''t remove {0} after a failed append; the item will be skipped on rerun: {1}",
                    new Object[]{artifact, e.getMessage()});
        }
    }

    /**
     * The job's skip policy, except that artifacts replacing their own inputs are always rewritten: every input
     * would otherwise count as already processed.
     */
    SkipPolicy skipPolicy(PathLayout layout) {
        SkipPolicy policy = job.effectiveSkipPolicy();
        if (layout.overwritesInputs(job.extension()) && policy != SkipPolicy.OVERWRITE) {
            LOGGER.log(Level.INFO, "{0}: artifacts replace their inputs in place; using {1} instead of {2}",
                    new Object[]{job.displayName(), SkipPolicy.OVERWRITE, policy});
            return SkipPolicy.OVERWRITE;
        }
        return policy;
    }

    private List<ResultRow> stamp(List<ResultRow> rows, TableSchema schema) {
        if (schema == null || !schema.timestamped()) return rows;
        String now = TIMESTAMP_FORMAT.format(LocalDateTime.now(clock));
        List<ResultRow> stamped = new ArrayList<>(rows.size());
        for (ResultRow row : rows) stamped.add(row.prepend(TableSchema.TIMESTAMP, now));
        return stamped;
    }

    static Status statusOf(ProcessingOutcome outcome) {
        return switch (outcome.kind()) {
            case SKIPPED -> Status.SKIPPED;
            case FAILED -> Status.FAIL;
            case SUCCESS -> outcome.degradedStages() > 0 ? Status.PARTIAL : Status.PASS;
        };
    }

    private RunInfo buildRunInfo(String jobName, Instant start, int total, WorkerPool.PoolResult poolResult) {
        List<ItemInfo> items = new ArrayList<>(poolResult.completed().size());
        long rowsWritten = 0;
        for (CompletedItem done : poolResult.completed()) {
            ProcessingOutcome outcome = done.outcome();
            Status status = statusOf(outcome);
            int rows = outcome.rows().size();
            rowsWritten += rows;
            items.add(new ItemInfo(done.item().displayName(), status, done.duration(), done.threadName(), rows,
                    outcome.reason(), outcome.cause()));
        }
        Status overall = StatusHelper.determineOverallStatus(items, poolResult.submitted(), "Job", jobName);
        int notDispatched = poolResult.stopped() ? Math.max(0, total - poolResult.submitted()) : 0;
        return new RunInfo(jobName, overall, Duration.between(start, Instant.now()), total,
                (int) StatusHelper.count(items, Status.PASS),
                (int) StatusHelper.count(items, Status.PARTIAL),
                (int) StatusHelper.count(items, Status.SKIPPED),
                (int) StatusHelper.count(items, Status.FAIL),
                notDispatched, rowsWritten, List.copyOf(items), null);
    }

    private void ensureRoot(Path root) {
        try {
            FileUtils.ensureDirectory(root);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Couldn''t create {0}: {1}", new Object[]{root, e.getMessage()});
        }
    }

    private void closeTable(ResultTable table) {
        if (table == null) return;
        try {
            table.close();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Couldn''t close result table {0}: {1}", new Object[]{table.path(), e.getMessage()});
        }
    }

    private void logSummary(RunInfo info, PathLayout layout) {
        LOGGER.log(Level.INFO, "{0}: {1} in {2} ms; {3} passed, {4} partial, {5} skipped, {6} failed, {7} not dispatched",
                new Object[]{info.jobName(), info.status(), info.duration().toMillis(), info.succeeded(), info.partial(),
                        info.skipped(), info.failed(), info.notDispatched()});
        if (layout.tablePath() != null)
            LOGGER.log(Level.INFO, "{0}: {1} row(s) written to {2}", new Object[]{info.jobName(), info.rowsWritten(), layout.tablePath()});
    }

    private <E extends BatchAbortException> E abort(E e) {
        transition(EngineState.FATAL_ABORT);
        LOGGER.log(Level.SEVERE, "Job {0} aborted: {1}", new Object[]{job.displayName(), e.getMessage()});
        return e;
    }

    private void transition(EngineState next) {
        LOGGER.log(Level.FINE, "{0}: {1} -> {2}", new Object[]{job.displayName(), state, next});
        state = next;
    }

    /**
     * Stops dispatching new items; items already handed to workers still complete.
     */
    public void requestStop() {
        pool.requestStop();
    }

    public EngineState state() {
        return state;
    }
}
