package io.quantum.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Tabular result returned by a data source. Rows are column-name to value maps in column order.
 * Immutable.
 */
public record RowSet(List<String> columns, List<Map<String, Object>> rows) {

    public RowSet {
        columns = List.copyOf(columns);
        rows = rows.stream()
                .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
                .collect(Collectors.toUnmodifiableList());
    }

    public static RowSet empty() {
        return new RowSet(List.of(), List.of());
    }

    /** Number of rows. */
    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
