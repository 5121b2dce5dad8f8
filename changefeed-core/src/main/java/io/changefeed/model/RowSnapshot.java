package io.changefeed.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable copy of a row's column values at one point in time. Column values may be null.
 *
 * @param columns column name to value, in backend order
 */
public record RowSnapshot(Map<String, Object> columns) {

    public RowSnapshot {
        Objects.requireNonNull(columns, "columns");
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static RowSnapshot of(Map<String, Object> columns) {
        return new RowSnapshot(columns);
    }

    public Object get(String column) {
        return columns.get(column);
    }

    /**
     * Returns the column value as a string, or {@code null} if absent or null.
     */
    public String getString(String column) {
        Object value = columns.get(column);
        return value == null ? null : value.toString();
    }

    public boolean has(String column) {
        return columns.containsKey(column);
    }
}
