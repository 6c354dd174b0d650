package org.iceforge.sqlapi.jdbc;

import org.iceforge.sqlapi.config.SqlApiProperties;
import org.iceforge.sqlapi.jdbc.spi.DataSourceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily created pools, one per {@link PoolKey}. Pools live for the process lifetime.
 */
public class DataSourceRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DataSourceRegistry.class);

    private final SqlApiProperties.Db cfg;
    private final DataSourceProvider provider;
    private final ConcurrentHashMap<PoolKey, DataSource> pools = new ConcurrentHashMap<>();

    public DataSourceRegistry(SqlApiProperties.Db cfg, DataSourceProvider provider) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public DataSource dataSource(String role, String database) {
        PoolKey key = new PoolKey(role, cfg.getHost(), cfg.getPort(), database);
        return pools.computeIfAbsent(key, k -> {
            log.info("Creating connection pool {} with provider '{}'", k, provider.id());
            return provider.create(k, cfg);
        });
    }

    public SqlApiProperties.Db config() {
        return cfg;
    }

    public int size() {
        return pools.size();
    }

    @Override
    public void close() {
        for (Map.Entry<PoolKey, DataSource> e : pools.entrySet()) {
            if (e.getValue() instanceof AutoCloseable c) {
                try {
                    c.close();
                } catch (Exception ex) {
                    log.warn("Failed closing pool {}: {}", e.getKey(), ex.toString());
                }
            }
        }
        pools.clear();
    }
}
