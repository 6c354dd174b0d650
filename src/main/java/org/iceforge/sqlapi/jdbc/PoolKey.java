package org.iceforge.sqlapi.jdbc;

import java.util.Objects;

/**
 * Identity of a connection pool: one pool per role and database on the cluster.
 */
public record PoolKey(String role, String host, int port, String database) {

    public PoolKey {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(database, "database");
    }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    /** Connection string without credentials, safe to log. */
    @Override
    public String toString() {
        return role + "@" + host + ":" + port + "/" + database;
    }
}
