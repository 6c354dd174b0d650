package org.iceforge.sqlapi.jdbc.spi;

import org.iceforge.sqlapi.config.SqlApiProperties;
import org.iceforge.sqlapi.jdbc.PoolKey;

import javax.sql.DataSource;

/**
 * Pluggable pool factory.
 * <p>
 * Deployments can plug in their own pooling or credential lookup (vault, IAM tokens, ...)
 * without the gateway knowing the details.
 */
public interface DataSourceProvider {

    /** A stable provider ID (e.g. "hikari"). */
    String id();

    /** Create a pool for the given role and database. Called once per key. */
    DataSource create(PoolKey key, SqlApiProperties.Db cfg);
}
