package org.iceforge.sqlapi.tenant;

import java.util.Optional;

/**
 * Maps the request host to the tenant database.
 */
public interface TenantResolver {

    Optional<String> resolve(String host);
}
