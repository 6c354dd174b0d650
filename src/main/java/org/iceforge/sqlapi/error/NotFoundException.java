package org.iceforge.sqlapi.error;

public class NotFoundException extends SqlApiException {
    public NotFoundException(String message) { super(message, 404); }
}
