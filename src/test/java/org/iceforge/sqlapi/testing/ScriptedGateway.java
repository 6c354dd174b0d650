package org.iceforge.sqlapi.testing;

import org.iceforge.sqlapi.jdbc.ConnectionGateway;
import org.iceforge.sqlapi.jdbc.TabularResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * In-memory gateway answering statements from a script of (matcher, answer) pairs.
 * Every executed statement is recorded.
 */
public class ScriptedGateway implements ConnectionGateway {

    private final String role;
    private final String database;
    private final Map<Predicate<String>, Function<String, TabularResult>> script = new LinkedHashMap<>();
    private final List<String> executed = new CopyOnWriteArrayList<>();

    public ScriptedGateway(String role, String database) {
        this.role = role;
        this.database = database;
    }

    public ScriptedGateway on(Predicate<String> matcher, Function<String, TabularResult> answer) {
        script.put(matcher, answer);
        return this;
    }

    public ScriptedGateway onPrefix(String prefix, TabularResult result) {
        return on(sql -> sql.startsWith(prefix), sql -> result);
    }

    /** Answers the table extraction query with the given array literal. */
    public ScriptedGateway tables(String literal) {
        return onPrefix("SELECT CDB_QueryTables(", rows(List.of("cdb_querytables"), List.of(literal)));
    }

    @Override
    public String role() {
        return role;
    }

    @Override
    public String database() {
        return database;
    }

    @Override
    public TabularResult execute(String sql) {
        executed.add(sql);
        for (Map.Entry<Predicate<String>, Function<String, TabularResult>> e : script.entrySet()) {
            if (e.getKey().test(sql)) return e.getValue().apply(sql);
        }
        throw new IllegalStateException("Unscripted statement: " + sql);
    }

    public List<String> executed() {
        return new ArrayList<>(executed);
    }

    public long count(Predicate<String> matcher) {
        return executed.stream().filter(matcher).count();
    }

    /** Builds a result from column names and row values in column order. */
    @SafeVarargs
    public static TabularResult rows(List<String> columns, List<Object>... rows) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (List<Object> values : rows) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) row.put(columns.get(i), values.get(i));
            out.add(row);
        }
        return new TabularResult(columns, out, out.size());
    }
}
