package org.gamma.imgbatch.table;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ResultTableTest {

    private static final TableSchema SCHEMA = TableSchema.plain("ImageName", "Length");

    @TempDir
    Path tempDir;

    private static ResultRow row(String name, Object length) {
        return ResultRow.builder().add("ImageName", name).add("Length", length).build();
    }

    @Test
    void testOpenOrCreate_writesHeaderOnce() throws Exception {
        Path path = tempDir.resolve("sub/results.csv");
        try (ResultTable table = ResultTable.openOrCreate(path, SCHEMA, ',', false)) {
            table.append(row("a/1.png", 1.5));
        }
        try (ResultTable table = ResultTable.openOrCreate(path, SCHEMA, ',', false)) {
            table.append(List.of(row("b/3.png", 2.0), row("b/4.png", null)));
            assertEquals(2, table.rowsWritten());
        }

        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        assertEquals(List.of("ImageName,Length", "a/1.png,1.5", "b/3.png,2.0", "b/4.png,"), lines);
    }

    @Test
    void testOpenOrCreate_incompatibleHeaderLeavesFileUntouched() throws IOException {
        Path path = tempDir.resolve("results.csv");
        String original = "ImageName,Length,Extra\nx.png,1,2\n";
        Files.writeString(path, original);

        SchemaIncompatibleException e = assertThrows(SchemaIncompatibleException.class,
                () -> ResultTable.openOrCreate(path, SCHEMA, ',', false));

        assertEquals(List.of("ImageName", "Length", "Extra"), e.existing());
        assertEquals(SCHEMA.fieldNames(), e.expected());
        assertEquals(original, Files.readString(path));
    }

    @Test
    void testOpenOrCreate_sameNamesDifferentOrderIsIncompatible() throws IOException {
        Path path = tempDir.resolve("results.csv");
        Files.writeString(path, "Length,ImageName\n");
        assertThrows(SchemaIncompatibleException.class, () -> ResultTable.openOrCreate(path, SCHEMA, ',', false));
    }

    @Test
    void testOpenOrCreate_overwriteTruncates() throws Exception {
        Path path = tempDir.resolve("results.csv");
        Files.writeString(path, "Something,Else\n1,2\n");
        try (ResultTable ignored = ResultTable.openOrCreate(path, SCHEMA, ',', true)) {
            assertEquals(0, ignored.rowsWritten());
        }
        assertEquals(List.of("ImageName,Length"), Files.readAllLines(path));
    }

    @Test
    void testOpenOrCreate_emptyFileGetsHeader() throws Exception {
        Path path = tempDir.resolve("results.csv");
        Files.createFile(path);
        try (ResultTable ignored = ResultTable.openOrCreate(path, SCHEMA, ',', false)) {
            assertEquals(path, ignored.path());
        }
        assertEquals(List.of("ImageName,Length"), Files.readAllLines(path));
    }

    @Test
    void testOpenOrCreate_toleratesBomAndTabs() throws Exception {
        Path path = tempDir.resolve("results.txt");
        Files.writeString(path, "\uFEFFImageName\tLength\r\n");
        try (ResultTable table = ResultTable.openOrCreate(path, SCHEMA, '\t', false)) {
            table.append(row("a,b.png", 3));
        }
        List<String> lines = Files.readAllLines(path);
        assertEquals("a,b.png\t3", lines.get(1), "Commas need no quoting in a tab-delimited table.");
    }

    @Test
    void testAppend_quotesDelimiterAndQuotes() throws Exception {
        Path path = tempDir.resolve("results.csv");
        try (ResultTable table = ResultTable.openOrCreate(path, SCHEMA, ',', false)) {
            table.append(row("odd, \"name\".png", 1));
        }
        assertEquals("\"odd, \"\"name\"\".png\",1", Files.readAllLines(path).get(1));
    }

    @Test
    void testAppend_rejectsMismatchingRowWithoutWriting() throws Exception {
        Path path = tempDir.resolve("results.csv");
        try (ResultTable table = ResultTable.openOrCreate(path, SCHEMA, ',', false)) {
            ResultRow wrong = ResultRow.builder().add("ImageName", "x").build();
            assertThrows(IllegalArgumentException.class, () -> table.append(List.of(row("ok.png", 1), wrong)));
            assertEquals(0, table.rowsWritten());
        }
        assertEquals(1, Files.readAllLines(path).size());
    }

    @Test
    void testAppend_afterCloseFails() throws Exception {
        ResultTable table = ResultTable.openOrCreate(tempDir.resolve("results.csv"), SCHEMA, ',', false);
        table.close();
        table.close();
        assertThrows(IOException.class, () -> table.append(row("x", 1)));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testAppend_concurrentWritersProduceWholeLines() throws Exception {
        Path path = tempDir.resolve("results.csv");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try (ResultTable table = ResultTable.openOrCreate(path, SCHEMA, ',', false)) {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                final int n = i;
                futures.add(executor.submit(() -> {
                    table.append(List.of(row("img" + n + ".png", n), row("img" + n + ".png", -n)));
                    return null;
                }));
            }
            for (Future<?> f : futures) f.get();
            assertEquals(400, table.rowsWritten());
        } finally {
            executor.shutdown();
        }

        List<String> lines = Files.readAllLines(path);
        assertEquals(401, lines.size());
        Set<String> unique = new HashSet<>(lines.subList(1, lines.size()));
        assertEquals(400, unique.size());
        for (String line : lines.subList(1, lines.size())) {
            assertTrue(line.matches("img\\d+\\.png,-?\\d+"), "Corrupt line: " + line);
        }
    }
}
