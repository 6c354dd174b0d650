package org.iceforge.sqlapi.api;

import org.iceforge.sqlapi.export.ExportCoalescer;
import org.iceforge.sqlapi.jdbc.DataSourceRegistry;
import org.iceforge.sqlapi.tables.TableExtractionCache;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Liveness for load balancers. Besides the actuator status it reports counters for the
 * gateway's pools and caches.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final DataSourceRegistry pools;
    private final TableExtractionCache tableCache;
    private final ExportCoalescer exports;

    public HealthController(HealthEndpoint healthEndpoint,
                            DataSourceRegistry pools,
                            TableExtractionCache tableCache,
                            ExportCoalescer exports) {
        this.healthEndpoint = Objects.requireNonNull(healthEndpoint);
        this.pools = Objects.requireNonNull(pools);
        this.tableCache = Objects.requireNonNull(tableCache);
        this.exports = Objects.requireNonNull(exports);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        TableExtractionCache.Stats stats = tableCache.stats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", healthEndpoint.health().getStatus().getCode());
        body.put("pools", pools.size());
        body.put("tableCache", Map.of("keys", stats.keys(), "hits", stats.hits()));
        body.put("pendingExports", exports.pendingCount());
        return body;
    }
}
