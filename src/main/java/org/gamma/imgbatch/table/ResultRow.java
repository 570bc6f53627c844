package org.gamma.imgbatch.table;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of named, typed cells.
 */
public record ResultRow(List<Field> fields) {

    public record Field(String name, Object value) {
        public Field {
            Objects.requireNonNull(name, "name");
        }
    }

    public ResultRow {
        fields = List.copyOf(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> names() {
        return fields.stream().map(Field::name).toList();
    }

    public Object get(String name) {
        for (Field f : fields) {
            if (f.name().equals(name)) return f.value();
        }
        return null;
    }

    public ResultRow prepend(String name, Object value) {
        List<Field> all = new ArrayList<>(fields.size() + 1);
        all.add(new Field(name, value));
        all.addAll(fields);
        return new ResultRow(all);
    }

    /**
     * Same row without the given field; used to compare rows while ignoring timestamps.
     */
    public ResultRow without(String name) {
        return new ResultRow(fields.stream().filter(f -> !f.name().equals(name)).toList());
    }

    public static final class Builder {
        private final List<Field> fields = new ArrayList<>();

        public Builder add(String name, Object value) {
            fields.add(new Field(name, value));
            return this;
        }

        public ResultRow build() {
            return new ResultRow(fields);
        }
    }
}
