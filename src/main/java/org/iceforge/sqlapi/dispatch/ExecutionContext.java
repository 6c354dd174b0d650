package org.iceforge.sqlapi.dispatch;

/**
 * Everything known about a request once its tenant and caller are resolved.
 *
 * @param userIdentity authenticated user, null for anonymous requests
 */
public record ExecutionContext(String userIdentity, String database, RequestParameters params, long startNanos) {

    public boolean authenticated() {
        return userIdentity != null;
    }
}
