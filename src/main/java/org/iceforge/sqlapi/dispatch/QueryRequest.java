package org.iceforge.sqlapi.dispatch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transport-neutral view of an incoming /sql request.
 *
 * @param parameters every parameter value in arrival order, query string first, then body
 * @param host       Host header, used to find the tenant
 * @param pathFormat extension of a {@code /sql.<ext>} path, or null
 */
public record QueryRequest(Map<String, List<String>> parameters, String host, String pathFormat) {

    public QueryRequest {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (parameters != null) {
            parameters.forEach((k, v) -> copy.put(k, v == null ? List.of() : List.copyOf(v)));
        }
        parameters = Map.copyOf(copy);
    }

    public List<String> values(String name) {
        return parameters.getOrDefault(name, List.of());
    }

    /** Last value given for the parameter, or null. */
    public String last(String name) {
        List<String> v = values(name);
        return v.isEmpty() ? null : v.get(v.size() - 1);
    }

    public boolean has(String name) {
        return !values(name).isEmpty();
    }
}
