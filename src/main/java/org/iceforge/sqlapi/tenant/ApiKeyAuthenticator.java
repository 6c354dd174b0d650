package org.iceforge.sqlapi.tenant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Static api_key to user map. An unknown key is not an error: the request falls back to the
 * public role, which only sees published tables.
 */
public class ApiKeyAuthenticator implements RequestAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthenticator.class);

    private final Map<String, String> apiKeys;

    public ApiKeyAuthenticator(Map<String, String> apiKeys) {
        this.apiKeys = Map.copyOf(apiKeys);
    }

    @Override
    public Optional<String> authenticate(String apiKey, String database) {
        if (apiKey == null || apiKey.isEmpty()) return Optional.empty();
        String user = apiKeys.get(apiKey);
        if (user == null) {
            log.debug("Unknown api_key for database {}, continuing as public user", database);
        }
        return Optional.ofNullable(user);
    }
}
