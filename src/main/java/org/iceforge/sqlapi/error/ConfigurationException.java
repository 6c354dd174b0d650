package org.iceforge.sqlapi.error;

/**
 * The request could not be mapped to a database role and database.
 */
public class ConfigurationException extends SqlApiException {
    public ConfigurationException(String message) { super(message, 400); }
}
