package org.iceforge.sqlapi.jdbc.spi;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.iceforge.sqlapi.config.SqlApiProperties;
import org.iceforge.sqlapi.jdbc.PoolKey;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Default provider: one HikariCP pool per role and database.
 */
public class HikariDataSourceProvider implements DataSourceProvider {

    // Hikari reads its housekeeping period once, when the first pool class is loaded.
    static final String HOUSEKEEPING_PERIOD_PROPERTY = "com.zaxxer.hikari.housekeeping.periodMs";

    public HikariDataSourceProvider(SqlApiProperties.Db cfg) {
        Duration reap = cfg.getReapInterval();
        if (reap != null && !reap.isNegative() && !reap.isZero()
                && System.getProperty(HOUSEKEEPING_PERIOD_PROPERTY) == null) {
            System.setProperty(HOUSEKEEPING_PERIOD_PROPERTY, Long.toString(reap.toMillis()));
        }
    }

    @Override
    public String id() {
        return "hikari";
    }

    @Override
    public DataSource create(PoolKey key, SqlApiProperties.Db cfg) {
        HikariConfig hc = new HikariConfig();
        hc.setPoolName("sqlapi-" + key.role() + "-" + key.database());
        hc.setJdbcUrl(key.jdbcUrl());
        hc.setUsername(key.role());
        if (cfg.getPassword() != null && !cfg.getPassword().isBlank()) {
            hc.setPassword(cfg.getPassword());
        }
        hc.setMaximumPoolSize(cfg.getPoolSize() <= 0 ? 16 : cfg.getPoolSize());
        hc.setMinimumIdle(0);

        Duration idle = cfg.getIdleTimeout() == null ? Duration.ofSeconds(30) : cfg.getIdleTimeout();
        // Hikari enforces a 10s floor on idle timeout
        hc.setIdleTimeout(Math.max(10_000L, idle.toMillis()));

        Duration ct = cfg.getConnectionTimeout() == null ? Duration.ofSeconds(30) : cfg.getConnectionTimeout();
        hc.setConnectionTimeout(ct.toMillis());

        // statements run in autocommit, like a plain psql session
        hc.setAutoCommit(true);
        return new HikariDataSource(hc);
    }
}
