package org.gamma.imgbatch.table;

import java.util.List;
import java.util.Objects;

/**
 * Ordered field names a result table commits to at creation time.
 * When {@code timestamped} is set, the first field is {@link #TIMESTAMP} and is filled in by the engine.
 */
public record TableSchema(List<String> fieldNames, boolean timestamped) {

    public static final String TIMESTAMP = "Timestamp";

    public static final TableSchema SEGMENTATION = timestamped("ImageName", "Length", "ObjectCount", "MeanDiameter");
    public static final TableSchema SEGMENTATION_BINNED = timestamped("ImageName", "DiameterClass", "Length");
    public static final TableSchema GRID = plain("ImageName", "GridSizePixels", "CrossingCount", "LengthPixels");

    public TableSchema {
        Objects.requireNonNull(fieldNames, "fieldNames");
        fieldNames = List.copyOf(fieldNames);
        if (fieldNames.isEmpty()) throw new IllegalArgumentException("A table schema needs at least one field");
        if (timestamped && !TIMESTAMP.equals(fieldNames.get(0)))
            throw new IllegalArgumentException("A timestamped schema must start with " + TIMESTAMP);
    }

    public static TableSchema plain(String... names) {
        return new TableSchema(List.of(names), false);
    }

    public static TableSchema timestamped(String... names) {
        String[] all = new String[names.length + 1];
        all[0] = TIMESTAMP;
        System.arraycopy(names, 0, all, 1, names.length);
        return new TableSchema(List.of(all), true);
    }

    public int size() {
        return fieldNames.size();
    }

    /**
     * Field names an adapter has to supply, i.e. without the engine-stamped timestamp.
     */
    public List<String> adapterFieldNames() {
        return timestamped ? fieldNames.subList(1, fieldNames.size()) : fieldNames;
    }
}
