package org.iceforge.sqlapi.tenant;

import java.util.Optional;

/**
 * Turns request credentials into a user identity. Empty means the request runs anonymously.
 */
public interface RequestAuthenticator {

    Optional<String> authenticate(String apiKey, String database);
}
