package org.iceforge.sqlapi.jdbc;

/**
 * Executes statements for one (role, database) pair on a pooled connection.
 */
public interface ConnectionGateway {

    /** Database role the statements run as. */
    String role();

    /** Tenant database the statements run against. */
    String database();

    /**
     * Runs the statement and returns its full result. The connection goes back to the pool
     * whether the statement succeeds or not.
     *
     * @throws org.iceforge.sqlapi.error.AccessDeniedException     for session-mutating statements
     * @throws org.iceforge.sqlapi.error.UpstreamDatabaseException when the database rejects the statement
     *                                                             or no connection could be obtained
     */
    TabularResult execute(String sql);
}
