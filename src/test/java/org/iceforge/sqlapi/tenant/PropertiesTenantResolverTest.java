package org.iceforge.sqlapi.tenant;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PropertiesTenantResolverTest {

    private final PropertiesTenantResolver resolver = new PropertiesTenantResolver(Map.of(
            "acme", "acme_db",
            "maps.example.org", "maps_db"));

    @Test
    void full_host_wins_over_subdomain() {
        assertEquals(Optional.of("maps_db"), resolver.resolve("maps.example.org"));
        assertEquals(Optional.of("maps_db"), resolver.resolve("MAPS.example.org:8080"));
    }

    @Test
    void leftmost_label_is_the_tenant() {
        assertEquals(Optional.of("acme_db"), resolver.resolve("acme.sql.example.com"));
        assertEquals(Optional.of("acme_db"), resolver.resolve("acme"));
    }

    @Test
    void unknown_hosts_resolve_to_nothing() {
        assertEquals(Optional.empty(), resolver.resolve("nobody.example.com"));
        assertEquals(Optional.empty(), resolver.resolve(null));
        assertEquals(Optional.empty(), resolver.resolve(""));
    }

    @Test
    void api_keys_map_to_users_and_unknown_keys_are_anonymous() {
        ApiKeyAuthenticator auth = new ApiKeyAuthenticator(Map.of("k1", "alice"));

        assertEquals(Optional.of("alice"), auth.authenticate("k1", "acme_db"));
        assertEquals(Optional.empty(), auth.authenticate("wrong", "acme_db"));
        assertEquals(Optional.empty(), auth.authenticate(null, "acme_db"));
    }
}
