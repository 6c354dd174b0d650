package org.iceforge.sqlapi.jdbc;

import org.iceforge.sqlapi.config.SqlApiProperties;

import java.util.Objects;

/**
 * Maps a request identity to the database role it runs as and builds its gateway.
 * Anonymous requests run as the public role.
 */
public class ConnectionGatewayFactory {

    private final SqlApiProperties.Db cfg;
    private final DataSourceRegistry registry;

    public ConnectionGatewayFactory(DataSourceRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.cfg = registry.config();
    }

    public ConnectionGateway create(String userId, String database) {
        return new PooledConnectionGateway(roleFor(userId), database, registry);
    }

    String roleFor(String userId) {
        if (userId == null) return cfg.getPublicUser();
        if (userId.isBlank()) return null;
        return cfg.getUserRoleTemplate().replace("{user}", userId);
    }
}
