package org.iceforge.sqlapi.error;

public class AccessDeniedException extends SqlApiException {
    public AccessDeniedException(String message) { super(message, 403); }
}
