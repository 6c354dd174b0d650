package org.iceforge.sqlapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for the SQL API.
 * <p>
 * Defaults match a local single-node setup (PostgreSQL on localhost behind pgbouncer).
 */
@ConfigurationProperties(prefix = "sqlapi")
public class SqlApiProperties {

    /** Base path the /sql endpoints are mounted under. May contain a path variable. */
    private String baseUrl = "/api/{version}";

    /** "development" adds stack traces to error bodies, "test" silences error reports. */
    private String environment = "production";

    /** Geometry column used by the geo-aware encoders. */
    private String geometryColumn = "the_geom";

    private Db db = new Db();

    private TableCache tableCache = new TableCache();

    private Export export = new Export();

    /** Host (or leftmost subdomain) -> tenant database name. */
    private Map<String, String> tenants = new HashMap<>();

    /** api_key -> user id. */
    private Map<String, String> apiKeys = new HashMap<>();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public boolean isDevelopment() {
        return "development".equalsIgnoreCase(environment);
    }

    public boolean isTest() {
        return "test".equalsIgnoreCase(environment);
    }

    public String getGeometryColumn() {
        return geometryColumn;
    }

    public void setGeometryColumn(String geometryColumn) {
        this.geometryColumn = geometryColumn;
    }

    public Db getDb() {
        return db;
    }

    public void setDb(Db db) {
        this.db = db;
    }

    public TableCache getTableCache() {
        return tableCache;
    }

    public void setTableCache(TableCache tableCache) {
        this.tableCache = tableCache;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public Map<String, String> getTenants() {
        return tenants;
    }

    public void setTenants(Map<String, String> tenants) {
        this.tenants = tenants;
    }

    public Map<String, String> getApiKeys() {
        return apiKeys;
    }

    public void setApiKeys(Map<String, String> apiKeys) {
        this.apiKeys = apiKeys;
    }

    /**
     * Database cluster connection settings. Pools are created lazily per (role, database).
     */
    public static class Db {

        private String host = "localhost";

        private int port = 5432;

        /** Role used for anonymous (public) requests. */
        private String publicUser = "publicuser";

        /** Role for an authenticated user; {user} is replaced by the user id. */
        private String userRoleTemplate = "tenant_user_{user}";

        /** Optional password; pgbouncer deployments usually trust the gateway host. */
        private String password;

        /** Max connections per pool. Callers block when the pool is exhausted. */
        private int poolSize = 16;

        private Duration idleTimeout = Duration.ofSeconds(30);

        /** How often idle connections are reaped. */
        private Duration reapInterval = Duration.ofSeconds(1);

        /** Max time a request waits for a pooled connection. */
        private Duration connectionTimeout = Duration.ofSeconds(30);

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getPublicUser() { return publicUser; }
        public void setPublicUser(String publicUser) { this.publicUser = publicUser; }

        public String getUserRoleTemplate() { return userRoleTemplate; }
        public void setUserRoleTemplate(String userRoleTemplate) { this.userRoleTemplate = userRoleTemplate; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

        public Duration getIdleTimeout() { return idleTimeout; }
        public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }

        public Duration getReapInterval() { return reapInterval; }
        public void setReapInterval(Duration reapInterval) { this.reapInterval = reapInterval; }

        public Duration getConnectionTimeout() { return connectionTimeout; }
        public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
    }

    /**
     * Table extraction cache sizing.
     */
    public static class TableCache {

        private long maxEntries = 8192;

        /** Entries expire this long after insertion. */
        private Duration maxAge = Duration.ofMinutes(10);

        /**
         * Reject requests whose affected tables could not be determined.
         * When false the request proceeds without the system table check.
         */
        private boolean failClosed = true;

        public long getMaxEntries() { return maxEntries; }
        public void setMaxEntries(long maxEntries) { this.maxEntries = maxEntries; }

        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

        public boolean isFailClosed() { return failClosed; }
        public void setFailClosed(boolean failClosed) { this.failClosed = failClosed; }
    }

    /**
     * File exports produced by ogr2ogr.
     */
    public static class Export {

        /** Working directory for generated artifacts. Defaults to java.io.tmpdir. */
        private Path tmpDir;

        private String ogr2ogrCommand = "ogr2ogr";

        /** Threads running generation jobs and fan-out. */
        private int threads = 2;

        /** Max time a request waits for its export to be generated and streamed. */
        private Duration waitTimeout = Duration.ofMinutes(10);

        public Path getTmpDir() { return tmpDir; }
        public void setTmpDir(Path tmpDir) { this.tmpDir = tmpDir; }

        public String getOgr2ogrCommand() { return ogr2ogrCommand; }
        public void setOgr2ogrCommand(String ogr2ogrCommand) { this.ogr2ogrCommand = ogr2ogrCommand; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }

        public Duration getWaitTimeout() { return waitTimeout; }
        public void setWaitTimeout(Duration waitTimeout) { this.waitTimeout = waitTimeout; }
    }
}
