package org.iceforge.sqlapi.tenant;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Looks the host up in a static map: first the full host name (port stripped), then its
 * leftmost label, so {@code acme.sql.example.com} resolves through an {@code acme} entry.
 */
public class PropertiesTenantResolver implements TenantResolver {

    private final Map<String, String> tenants;

    public PropertiesTenantResolver(Map<String, String> tenants) {
        this.tenants = Map.copyOf(tenants);
    }

    @Override
    public Optional<String> resolve(String host) {
        if (host == null || host.isBlank()) return Optional.empty();
        String name = host.trim().toLowerCase(Locale.ROOT);
        int colon = name.indexOf(':');
        if (colon >= 0) name = name.substring(0, colon);

        String db = tenants.get(name);
        if (db != null) return Optional.of(db);

        int dot = name.indexOf('.');
        if (dot > 0) return Optional.ofNullable(tenants.get(name.substring(0, dot)));
        return Optional.empty();
    }
}
