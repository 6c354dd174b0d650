package org.iceforge.sqlapi.error;

/**
 * Base class for failures that carry an HTTP status hint for the error envelope.
 */
public abstract class SqlApiException extends RuntimeException {
    private final int httpStatus;

    protected SqlApiException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    protected SqlApiException(String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public int httpStatus() { return httpStatus; }
}
