package org.iceforge.sqlapi.error;

public class ValidationException extends SqlApiException {
    public ValidationException(String message) { super(message, 400); }
}
