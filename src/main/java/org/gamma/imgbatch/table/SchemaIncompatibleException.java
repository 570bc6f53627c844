package org.gamma.imgbatch.table;

import org.gamma.imgbatch.config.BatchAbortException;

import java.nio.file.Path;
import java.util.List;

/**
 * An existing result table has a different header than the one the current run writes.
 */
public class SchemaIncompatibleException extends BatchAbortException {

    private final List<String> existing;
    private final List<String> expected;

    public SchemaIncompatibleException(Path table, List<String> existing, List<String> expected) {
        super("Cannot append to existing data table " + table + ": header " + existing + " does not match " + expected
              + ". Use a new table name or enable overwriteTable.");
        this.existing = List.copyOf(existing);
        this.expected = List.copyOf(expected);
    }

    public List<String> existing() {
        return existing;
    }

    public List<String> expected() {
        return expected;
    }
}
