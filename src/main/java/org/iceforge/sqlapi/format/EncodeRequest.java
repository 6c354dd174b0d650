package org.iceforge.sqlapi.format;

import org.iceforge.sqlapi.jdbc.ConnectionGateway;

/**
 * @param sql     statement after rewrite and windowing, ready to run
 * @param options encoder options
 * @param gateway connection for the request's role and database
 */
public record EncodeRequest(String sql, EncodeOptions options, ConnectionGateway gateway) {
}
