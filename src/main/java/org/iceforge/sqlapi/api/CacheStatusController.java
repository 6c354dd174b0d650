package org.iceforge.sqlapi.api;

import org.iceforge.sqlapi.tables.TableExtractionCache;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("${sqlapi.base-url:/api/{version}}")
public class CacheStatusController {

    private final TableExtractionCache tableCache;

    public CacheStatusController(TableExtractionCache tableCache) {
        this.tableCache = Objects.requireNonNull(tableCache);
    }

    @GetMapping("/cachestatus")
    public Map<String, Object> cacheStatus() {
        TableExtractionCache.Stats stats = tableCache.stats();
        Map<String, Object> explain = new LinkedHashMap<>();
        explain.put("pid", ProcessHandle.current().pid());
        explain.put("hits", stats.hits());
        explain.put("keys", stats.keys());
        return Map.of("explain", explain);
    }
}
