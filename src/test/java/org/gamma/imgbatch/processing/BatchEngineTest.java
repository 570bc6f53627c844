package org.gamma.imgbatch.processing;

import org.gamma.imgbatch.config.AlgorithmType;
import org.gamma.imgbatch.config.BatchJobItem;
import org.gamma.imgbatch.config.ConfigurationException;
import org.gamma.imgbatch.config.SkipPolicy;
import org.gamma.imgbatch.image.ImageCodec;
import org.gamma.imgbatch.metrics.RunInfo;
import org.gamma.imgbatch.metrics.Status;
import org.gamma.imgbatch.plugin.ProcessingOutcome;
import org.gamma.imgbatch.plugin.ProcessorAdapter;
import org.gamma.imgbatch.table.ResultRow;
import org.gamma.imgbatch.table.SchemaIncompatibleException;
import org.gamma.imgbatch.table.TableSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tmp;

    @Mock
    ImageCodec mockCodec;

    @Mock
    ProcessorAdapter mockAdapter;

    private Path in;
    private Path out;
    private Path table;

    @BeforeEach
    void setUp() throws IOException {
        in = tmp.resolve("root_in");
        out = tmp.resolve("root_out");
        table = tmp.resolve("results.csv");
        touch(in.resolve("a/1.png"));
        touch(in.resolve("a/2.png"));
        touch(in.resolve("b/3.png"));
    }

    private static void touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[0]);
    }

    private BatchJobItem job(Path inputRoot, Path outputRoot, Path tablePath, int parallelism, SkipPolicy policy) {
        return new BatchJobItem("test", true, AlgorithmType.THRESHOLDING, inputRoot, ".png", outputRoot, ".png",
                null, tablePath, false, true, parallelism, policy, null, null);
    }

    private BatchJobItem job(int parallelism, SkipPolicy policy) {
        return job(in, out, table, parallelism, policy);
    }

    private static BatchEngine engine(BatchJobItem job, ProcessorAdapter adapter) {
        return new BatchEngine(job, adapter, new ImageCodec(), CLOCK);
    }

    @Test
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    void testRun_routesOutcomesAndMirrorsTree() throws Exception {
        BatchResult result = engine(job(2, null), new StubAdapter("2")).run();

        RunInfo info = result.runInfo();
        assertEquals(3, info.totalItems());
        assertEquals(2, info.succeeded());
        assertEquals(1, info.failed());
        assertEquals(0, info.skipped());
        assertEquals(2, info.rowsWritten());
        assertEquals(Status.FAIL, info.status());

        assertEquals(2, result.rows().size());
        List<String> lines = Files.readAllLines(table);
        assertEquals("ImageName,Length", lines.get(0));
        assertEquals(List.of("a/1.png,10", "b/3.png,10"), lines.subList(1, lines.size()).stream().sorted().toList());

        assertTrue(Files.isRegularFile(out.resolve("a/1.png")));
        assertTrue(Files.isRegularFile(out.resolve("b/3.png")));
        assertFalse(Files.exists(out.resolve("a/2.png")));
        assertTrue(Files.isDirectory(out.resolve("FAILED/a")));
        assertTrue(Files.isDirectory(out.resolve("FAILED/b")));
        assertFalse(Files.exists(out.resolve("FAILED/a/2.png")), "adapter failures leave no artifact");
    }

    @Test
    void testRun_secondRunSkipsProcessedItemsAndLeavesTableUnchanged() throws Exception {
        engine(job(1, null), new StubAdapter("2")).run();
        List<String> before = Files.readAllLines(table);

        StubAdapter second = new StubAdapter("2");
        RunInfo info = engine(job(1, null), second).run().runInfo();

        assertEquals(2, info.skipped());
        assertEquals(1, info.failed(), "items without an artifact are retried");
        assertEquals(0, info.rowsWritten());
        assertEquals(1, second.calls.get());
        assertEquals(before, Files.readAllLines(table));
    }

    @Test
    void testRun_skippedItemsNeverReachTheAdapter() throws Exception {
        touch(out.resolve("a/1.png"));
        touch(out.resolve("FAILED/a/2.png"));
        touch(out.resolve("b/3.png"));
        when(mockAdapter.schema(any())).thenReturn(Optional.of(StubAdapter.SCHEMA));
        lenient().when(mockAdapter.producesArtifacts()).thenReturn(true);

        BatchJobItem explicit = new BatchJobItem("test", true, AlgorithmType.THRESHOLDING, in, ".png", out, ".png",
                out.resolve("FAILED"), table, false, true, 1, SkipPolicy.SKIP_EXISTING, null, null);

        RunInfo info = new BatchEngine(explicit, mockAdapter, mockCodec, CLOCK).run().runInfo();

        assertEquals(3, info.skipped());
        assertEquals(Status.PASS, info.status());
        verify(mockAdapter, never()).process(any(), any());
        verifyNoInteractions(mockCodec);
    }

    @Test
    void testRun_incompatibleTableAbortsBeforeAnyOutput() throws Exception {
        Files.writeString(table, "Timestamp,ImageName,Length\n");
        StubAdapter adapter = new StubAdapter(null);
        BatchEngine engine = engine(job(1, null), adapter);

        assertThrows(SchemaIncompatibleException.class, engine::run);

        assertEquals(EngineState.FATAL_ABORT, engine.state());
        assertEquals(0, adapter.calls.get());
        assertFalse(Files.exists(out));
        assertEquals("Timestamp,ImageName,Length\n", Files.readString(table));
    }

    @Test
    void testRun_invalidJobAbortsWithConfigurationException() {
        BatchJobItem missingInput = job(tmp.resolve("nowhere"), out, table, 1, null);
        BatchEngine engine = engine(missingInput, new StubAdapter(null));

        assertThrows(ConfigurationException.class, engine::run);
        assertEquals(EngineState.FATAL_ABORT, engine.state());
        assertFalse(Files.exists(table));
    }

    @Test
    void testRun_missingAdapterIsAConfigurationError() {
        BatchEngine engine = new BatchEngine(job(1, null), null, new ImageCodec(), CLOCK);
        assertThrows(ConfigurationException.class, engine::run);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void testRun_resultDoesNotDependOnParallelism() throws Exception {
        Path bigIn = tmp.resolve("big");
        for (int d = 0; d < 4; d++) {
            for (int i = 0; i < 10; i++) touch(bigIn.resolve("d" + d + "/img" + i + ".png"));
        }

        BatchResult sequential = engine(job(bigIn, tmp.resolve("out1"), tmp.resolve("t1.csv"), 1, null),
                new StubAdapter("img7")).run();
        BatchResult parallel = engine(job(bigIn, tmp.resolve("out8"), tmp.resolve("t8.csv"), 8, null),
                new StubAdapter("img7")).run();

        assertEquals(sorted(sequential.rows()), sorted(parallel.rows()));
        assertEquals(sequential.runInfo().failed(), parallel.runInfo().failed());
        assertEquals(4, parallel.runInfo().failed());
        assertEquals(36, Files.readAllLines(tmp.resolve("t8.csv")).size() - 1);
        assertEquals(Files.readAllLines(tmp.resolve("t1.csv")).stream().sorted().toList(),
                Files.readAllLines(tmp.resolve("t8.csv")).stream().sorted().toList());
    }

    private static List<String> sorted(List<ResultRow> rows) {
        List<String> out = new ArrayList<>();
        for (ResultRow row : rows) out.add(row.without(TableSchema.TIMESTAMP).toString());
        out.sort(null);
        return out;
    }

    @Test
    void testRun_degradedItemGoesToFailureTreeAndCountsAsPartial() throws Exception {
        RunInfo info = engine(job(1, null), new StubAdapter(null, "3", StubAdapter.SCHEMA)).run().runInfo();

        assertEquals(2, info.succeeded());
        assertEquals(1, info.partial());
        assertEquals(Status.PARTIAL, info.status());
        assertEquals(3, info.rowsWritten());
        assertTrue(Files.isRegularFile(out.resolve("FAILED/b/3.png")));
        assertFalse(Files.exists(out.resolve("b/3.png")));
    }

    @Test
    void testRun_artifactWriteFailureFailsItemWithoutRows() throws Exception {
        doThrow(new IOException("disk full")).when(mockCodec).write(any(), any());

        BatchResult result = new BatchEngine(job(1, null), new StubAdapter(null), mockCodec, CLOCK).run();

        RunInfo info = result.runInfo();
        assertEquals(3, info.failed());
        assertEquals(0, info.rowsWritten());
        assertTrue(result.rows().isEmpty());
        assertEquals(List.of("ImageName,Length"), Files.readAllLines(table));
        assertTrue(info.itemInfo().stream().allMatch(i -> i.message().contains("disk full")));
    }

    @Test
    void testRun_rerunAfterArtifactWriteFailureWritesEachRowOnce() throws Exception {
        doThrow(new IOException("disk full")).when(mockCodec).write(any(), any());
        new BatchEngine(job(1, null), new StubAdapter(null), mockCodec, CLOCK).run();

        StubAdapter retry = new StubAdapter(null);
        RunInfo info = engine(job(1, null), retry).run().runInfo();

        assertEquals(3, retry.calls.get());
        assertEquals(3, info.succeeded());
        List<String> lines = Files.readAllLines(table);
        assertEquals("ImageName,Length", lines.get(0));
        assertEquals(List.of("a/1.png,10", "a/2.png,10", "b/3.png,10"),
                lines.subList(1, lines.size()).stream().sorted().toList());
    }

    @Test
    void testRun_rowsRejectedByTheTableRemoveTheFreshArtifact() throws Exception {
        when(mockAdapter.schema(any())).thenReturn(Optional.of(StubAdapter.SCHEMA));
        when(mockAdapter.producesArtifacts()).thenReturn(true);
        ResultRow foreign = ResultRow.builder().add("Name", "x").build();
        when(mockAdapter.process(any(), any())).thenAnswer(inv ->
                ProcessingOutcome.success(new BufferedImage(1, 1, BufferedImage.TYPE_BYTE_GRAY), List.of(foreign)));
        BatchJobItem explicit = new BatchJobItem("test", true, AlgorithmType.THRESHOLDING, in, ".png", out, ".png",
                out.resolve("FAILED"), table, false, true, 1, null, null, null);

        RunInfo info = new BatchEngine(explicit, mockAdapter, new ImageCodec(), CLOCK).run().runInfo();

        assertEquals(3, info.failed());
        assertEquals(List.of("ImageName,Length"), Files.readAllLines(table));
        assertFalse(Files.exists(out.resolve("a/1.png")));
        assertFalse(Files.exists(out.resolve("b/3.png")));
    }

    @Test
    void testRun_inPlaceRewritesEveryInputUnderDefaultPolicy() throws Exception {
        StubAdapter adapter = new StubAdapter(null);
        BatchJobItem inPlace = job(in, in, table, 1, null);

        RunInfo info = engine(inPlace, adapter).run().runInfo();

        assertEquals(3, adapter.calls.get());
        assertEquals(3, info.succeeded());
        assertEquals(0, info.skipped());
        assertTrue(Files.size(in.resolve("a/1.png")) > 0, "the input was replaced by its artifact");
        assertEquals(4, Files.readAllLines(table).size());
    }

    @Test
    void testSkipPolicy_onlyForcedWhenArtifactsReplaceInputs() {
        BatchJobItem inPlace = job(in, in, table, 1, SkipPolicy.REDO_FAILURES);
        StubAdapter adapter = new StubAdapter(null);

        BatchEngine engine = engine(inPlace, adapter);
        assertEquals(SkipPolicy.OVERWRITE, engine.skipPolicy(PathLayout.resolve(inPlace, adapter, true)));

        BatchJobItem otherExtension = new BatchJobItem("test", true, AlgorithmType.THRESHOLDING, in, ".png", in, ".tif",
                null, table, false, true, 1, SkipPolicy.REDO_FAILURES, null, null);
        assertEquals(SkipPolicy.REDO_FAILURES,
                engine(otherExtension, adapter).skipPolicy(PathLayout.resolve(otherExtension, adapter, true)));
    }

    @Test
    void testRun_incompatibleGridTableInOutputRootLeavesOutputRootAlone() throws Exception {
        Path gridTable = out.resolve("fishnet_images.csv");
        touch(gridTable);
        Files.writeString(gridTable, "ImageName,Length\n");
        BatchJobItem grids = new BatchJobItem("grids", true, AlgorithmType.FISHNET, in, ".png", out, null,
                null, null, false, true, 1, null, null, null);
        BatchEngine engine = new BatchEngine(grids);

        assertThrows(SchemaIncompatibleException.class, engine::run);

        assertEquals(EngineState.FATAL_ABORT, engine.state());
        try (var entries = Files.list(out)) {
            assertEquals(List.of(gridTable), entries.toList());
        }
        assertEquals("ImageName,Length\n", Files.readString(gridTable));
    }

    @Test
    void testRun_redoFailuresRetriesFailureBucketAndRemovesStaleArtifact() throws Exception {
        engine(job(1, null), new StubAdapter(null, "3", StubAdapter.SCHEMA)).run();
        assertTrue(Files.exists(out.resolve("FAILED/b/3.png")));

        StubAdapter retry = new StubAdapter(null);
        RunInfo info = engine(job(1, SkipPolicy.REDO_FAILURES), retry).run().runInfo();

        assertEquals(1, retry.calls.get());
        assertEquals(2, info.skipped());
        assertEquals(1, info.succeeded());
        assertTrue(Files.isRegularFile(out.resolve("b/3.png")));
        assertFalse(Files.exists(out.resolve("FAILED/b/3.png")));
    }

    @Test
    void testRun_overwriteReprocessesEverything() throws Exception {
        engine(job(1, null), new StubAdapter(null)).run();
        StubAdapter again = new StubAdapter(null);

        RunInfo info = engine(job(1, SkipPolicy.OVERWRITE), again).run().runInfo();

        assertEquals(3, again.calls.get());
        assertEquals(3, info.succeeded());
        assertEquals(7, Files.readAllLines(table).size(), "rows are appended to the existing table");
    }

    @Test
    void testRequestStop_leavesRemainingItemsUndispatched() throws Exception {
        StubAdapter adapter = new StubAdapter(null);
        BatchEngine engine = engine(job(1, null), adapter);
        engine.withProgressListener((name, status) -> engine.requestStop());

        RunInfo info = engine.run().runInfo();

        assertEquals(1, adapter.calls.get());
        assertEquals(3, info.totalItems());
        assertEquals(1, info.completed());
        assertEquals(2, info.notDispatched());
    }

    @Test
    void testRun_timestampedSchemaUsesClock() throws Exception {
        TableSchema stamped = TableSchema.timestamped("ImageName", "Length");
        BatchResult result = engine(job(1, null), new StubAdapter(null, null, stamped)).run();

        assertEquals(3, result.rows().size());
        assertTrue(result.rows().stream().allMatch(r -> "2024-05-01_10:00:00".equals(r.get(TableSchema.TIMESTAMP))));
        List<String> lines = Files.readAllLines(table);
        assertEquals("Timestamp,ImageName,Length", lines.get(0));
        assertTrue(lines.contains("2024-05-01_10:00:00,a/1.png,10"));
    }

    @Test
    void testRun_withoutArtifactsCreatesNoOutputTree() throws Exception {
        BatchJobItem noArtifacts = new BatchJobItem("test", true, AlgorithmType.THRESHOLDING, in, ".png", out, ".png",
                null, table, false, false, 1, null, null, null);

        RunInfo info = engine(noArtifacts, new StubAdapter(null)).run().runInfo();

        assertEquals(3, info.succeeded());
        assertFalse(Files.exists(out));
        assertEquals(4, Files.readAllLines(table).size());
    }

    @Test
    void testStatusOf_mapsOutcomeKinds() {
        assertEquals(Status.SKIPPED, BatchEngine.statusOf(ProcessingOutcome.skipped()));
        assertEquals(Status.FAIL, BatchEngine.statusOf(ProcessingOutcome.failed("x", null)));
        assertEquals(Status.PASS, BatchEngine.statusOf(ProcessingOutcome.success(null, List.of())));
        assertEquals(Status.PARTIAL, BatchEngine.statusOf(ProcessingOutcome.success(null, List.of(), 2)));
    }
}
