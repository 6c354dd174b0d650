package org.iceforge.sqlapi.error;

import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import java.sql.SQLException;

/**
 * A statement or connection failure reported by the database.
 * <p>
 * The message is the database's own text; it is never rewritten.
 */
public class UpstreamDatabaseException extends SqlApiException {
    private final String severity;
    private final String sqlState;
    private final boolean acquisition;

    public UpstreamDatabaseException(String message, String severity, String sqlState, boolean acquisition, Throwable cause) {
        super(message, 400, cause);
        this.severity = severity;
        this.sqlState = sqlState;
        this.acquisition = acquisition;
    }

    public static UpstreamDatabaseException statement(SQLException e) {
        return from(e, false);
    }

    public static UpstreamDatabaseException acquisition(SQLException e) {
        return from(e, true);
    }

    private static UpstreamDatabaseException from(SQLException e, boolean acquisition) {
        String message = e.getMessage();
        String severity = null;
        if (e instanceof PSQLException p && p.getServerErrorMessage() != null) {
            ServerErrorMessage sem = p.getServerErrorMessage();
            if (sem.getMessage() != null) message = sem.getMessage();
            severity = sem.getSeverity();
        }
        return new UpstreamDatabaseException(message, severity, e.getSQLState(), acquisition, e);
    }

    /** Server severity (ERROR, FATAL, ...) when the driver reports one. */
    public String severity() { return severity; }

    public String sqlState() { return sqlState; }

    /** True when no connection could be obtained, false when the statement itself failed. */
    public boolean acquisition() { return acquisition; }
}
