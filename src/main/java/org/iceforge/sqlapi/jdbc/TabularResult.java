package org.iceforge.sqlapi.jdbc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fully materialized statement result.
 *
 * @param columns  column labels in select order, duplicates collapsed
 * @param rows     one map per row, keyed by column label (the last column wins on duplicate labels)
 * @param rowCount rows returned, or the update count for statements without a result set
 */
public record TabularResult(List<String> columns, List<Map<String, Object>> rows, long rowCount) {

    public TabularResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public static TabularResult empty(long updateCount) {
        return new TabularResult(List.of(), List.of(), updateCount);
    }

    /**
     * Copy of the rows with the given keys removed. Unknown keys are ignored.
     */
    public List<Map<String, Object>> rowsWithout(Set<String> skip) {
        if (skip == null || skip.isEmpty()) return rows;
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>(row);
            copy.keySet().removeAll(skip);
            out.add(copy);
        }
        return out;
    }

    public List<String> columnsWithout(Set<String> skip) {
        if (skip == null || skip.isEmpty()) return columns;
        return columns.stream().filter(c -> !skip.contains(c)).toList();
    }
}
