package org.iceforge.sqlapi.error;

public class ExportFailedException extends SqlApiException {
    public ExportFailedException(String message) { super(message, 500); }
    public ExportFailedException(String message, Throwable cause) { super(message, 500, cause); }
}
