package org.gamma.imgbatch.table;

import org.gamma.imgbatch.util.FileUtils;
import org.gamma.imgbatch.util.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only delimited result table with a fixed header.
 * <p>
 * Appends are serialized on this instance and forced to disk one item at a time, so a crash loses at most
 * the rows of the item being written.
 */
public class ResultTable implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ResultTable.class.getName());

    private final Path path;
    private final TableSchema schema;
    private final char delimiter;
    private final FileChannel channel;
    private long rowsWritten = 0L;
    private boolean closed = false;

    private ResultTable(Path path, TableSchema schema, char delimiter, FileChannel channel) {
        this.path = path;
        this.schema = schema;
        this.delimiter = delimiter;
        this.channel = channel;
    }

    /**
     * Opens an existing table for appending, or creates a new one with its header.
     *
     * @throws SchemaIncompatibleException when an existing header differs from {@code schema}; the file is left untouched
     * @throws IOException                 when the table cannot be read or created
     */
    public static ResultTable openOrCreate(Path path, TableSchema schema, char delimiter, boolean overwrite)
            throws IOException, SchemaIncompatibleException {
        boolean exists = Files.isRegularFile(path) && Files.size(path) > 0;
        if (exists && !overwrite) {
            List<String> header = readHeader(path, delimiter);
            if (!header.equals(schema.fieldNames())) {
                throw new SchemaIncompatibleException(path, header, schema.fieldNames());
            }
            LOGGER.log(Level.INFO, "Appending to old data table: {0}", path);
            FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            return new ResultTable(path, schema, delimiter, channel);
        }

        if (path.getParent() != null) FileUtils.ensureDirectory(path.getParent());
        LOGGER.log(Level.INFO, exists ? "Overwriting old data table: {0}" : "Saving data table to: {0}", path);
        FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING);
        ResultTable table = new ResultTable(path, schema, delimiter, channel);
        try {
            table.writeLine(table.formatLine(schema.fieldNames()));
        } catch (IOException e) {
            table.close();
            throw e;
        }
        return table;
    }

    static List<String> readHeader(Path path, char delimiter) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String first = reader.readLine();
            if (first == null) return List.of();
            if (!first.isEmpty() && first.charAt(0) == '\uFEFF') first = first.substring(1);
            return Utils.splitDelimitedLine(first, delimiter).stream().map(String::trim).toList();
        }
    }

    /**
     * Appends the rows of one item as a single durable write.
     *
     * @throws IllegalArgumentException when a row does not match the schema; nothing is written then
     */
    public synchronized void append(List<ResultRow> rows) throws IOException {
        if (closed) throw new IOException("Attempted to write to a closed table: " + path);
        if (rows.isEmpty()) return;
        StringBuilder sb = new StringBuilder();
        for (ResultRow row : rows) {
            if (!row.names().equals(schema.fieldNames())) {
                throw new IllegalArgumentException("Row fields " + row.names() + " do not match table schema " + schema.fieldNames());
            }
            sb.append(formatLine(row.fields().stream().map(f -> render(f.value())).toList()));
        }
        writeLine(sb.toString());
        rowsWritten += rows.size();
    }

    public synchronized void append(ResultRow row) throws IOException {
        append(List.of(row));
    }

    private void writeLine(String text) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        channel.force(false);
    }

    private String formatLine(List<String> cells) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) sb.append(delimiter);
            sb.append(Utils.escapeField(cells.get(i), delimiter));
        }
        return sb.append('\n').toString();
    }

    static String render(Object value) {
        return value == null ? "" : value.toString();
    }

    public Path path() {
        return path;
    }

    public synchronized long rowsWritten() {
        return rowsWritten;
    }

    @Override
    public synchronized void close() throws IOException {
        if (!closed) {
            closed = true;
            channel.close();
        }
    }
}
