package org.iceforge.sqlapi.jdbc;

import org.iceforge.sqlapi.error.ConfigurationException;
import org.iceforge.sqlapi.error.UpstreamDatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * {@link ConnectionGateway} borrowing connections from a pool per request.
 * <p>
 * Meant to be used through pgbouncer: connects as the request's role to the tenant database.
 */
public class PooledConnectionGateway implements ConnectionGateway {
    private static final Logger log = LoggerFactory.getLogger(PooledConnectionGateway.class);

    static final String ACCESS_PARAMETERS_ERROR = "Incorrect access parameters. If you are accessing via OAuth, "
            + "please check your tokens are correct. For public users, please ensure your table is published.";

    private final String role;
    private final String database;
    private final DataSourceRegistry registry;

    public PooledConnectionGateway(String role, String database, DataSourceRegistry registry) {
        if (role == null || role.isBlank() || database == null || database.isBlank()) {
            throw new ConfigurationException(ACCESS_PARAMETERS_ERROR);
        }
        this.role = role;
        this.database = database;
        this.registry = registry;
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
        StatementSanitizer.check(sql);

        DataSource ds = registry.dataSource(role, database);
        Connection conn;
        try {
            conn = ds.getConnection();
        } catch (SQLException e) {
            log.warn("Could not obtain connection for {}@{}: {}", role, database, e.getMessage());
            throw UpstreamDatabaseException.acquisition(e);
        }

        // close() hands the connection back to the pool, it is never evicted on statement errors
        try (conn; Statement st = conn.createStatement()) {
            return run(st, sql);
        } catch (SQLException e) {
            throw UpstreamDatabaseException.statement(e);
        }
    }

    private static TabularResult run(Statement st, String sql) throws SQLException {
        boolean isResultSet = st.execute(sql);
        TabularResult last = null;
        long updateCount = -1;
        while (true) {
            if (isResultSet) {
                try (ResultSet rs = st.getResultSet()) {
                    last = JdbcValues.read(rs);
                }
            } else {
                int count = st.getUpdateCount();
                if (count == -1) break;
                updateCount = count;
            }
            isResultSet = st.getMoreResults();
        }
        if (last != null) return last;
        return TabularResult.empty(Math.max(0, updateCount));
    }
}
