package org.iceforge.sqlapi.dispatch;

import org.iceforge.sqlapi.access.AccessGuard;
import org.iceforge.sqlapi.config.SqlApiProperties;
import org.iceforge.sqlapi.error.AccessDeniedException;
import org.iceforge.sqlapi.error.NotFoundException;
import org.iceforge.sqlapi.format.EncodeOptions;
import org.iceforge.sqlapi.format.EncodeRequest;
import org.iceforge.sqlapi.format.EncoderRegistry;
import org.iceforge.sqlapi.format.ResponseSink;
import org.iceforge.sqlapi.format.ResultEncoder;
import org.iceforge.sqlapi.format.SqlWindow;
import org.iceforge.sqlapi.jdbc.ConnectionGateway;
import org.iceforge.sqlapi.jdbc.ConnectionGatewayFactory;
import org.iceforge.sqlapi.tables.TableExtractionCache;
import org.iceforge.sqlapi.tables.TableExtractionEntry;
import org.iceforge.sqlapi.tenant.RequestAuthenticator;
import org.iceforge.sqlapi.tenant.TenantResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Runs one /sql request: validate, resolve tenant and caller, look up the touched tables,
 * check them, set headers, then hand the statement to the encoder for the requested format.
 * <p>
 * Any failure before the encoder writes propagates to the caller; nothing has been written yet
 * at that point.
 */
public class QueryDispatcher {
    private static final Logger log = LoggerFactory.getLogger(QueryDispatcher.class);

    static final String TENANT_NOT_FOUND =
            "Sorry, we can't find this tenant. Please check that you have entered the correct domain.";
    static final String TABLES_UNKNOWN = "could not determine the tables affected by the query";

    private final SqlApiProperties props;
    private final TenantResolver tenants;
    private final RequestAuthenticator authenticator;
    private final ConnectionGatewayFactory gateways;
    private final TableExtractionCache tableCache;
    private final AccessGuard guard;
    private final EncoderRegistry encoders;
    private final Clock clock;

    public QueryDispatcher(SqlApiProperties props,
                           TenantResolver tenants,
                           RequestAuthenticator authenticator,
                           ConnectionGatewayFactory gateways,
                           TableExtractionCache tableCache,
                           AccessGuard guard,
                           EncoderRegistry encoders) {
        this(props, tenants, authenticator, gateways, tableCache, guard, encoders, Clock.systemUTC());
    }

    QueryDispatcher(SqlApiProperties props,
                    TenantResolver tenants,
                    RequestAuthenticator authenticator,
                    ConnectionGatewayFactory gateways,
                    TableExtractionCache tableCache,
                    AccessGuard guard,
                    EncoderRegistry encoders,
                    Clock clock) {
        this.props = Objects.requireNonNull(props);
        this.tenants = Objects.requireNonNull(tenants);
        this.authenticator = Objects.requireNonNull(authenticator);
        this.gateways = Objects.requireNonNull(gateways);
        this.tableCache = Objects.requireNonNull(tableCache);
        this.guard = Objects.requireNonNull(guard);
        this.encoders = Objects.requireNonNull(encoders);
        this.clock = Objects.requireNonNull(clock);
    }

    public void dispatch(QueryRequest request, ResponseSink sink) throws IOException {
        long start = System.nanoTime();
        RequestParameters params = RequestParameters.parse(request);

        String database = params.database() != null
                ? params.database()
                : tenants.resolve(request.host()).orElseThrow(() -> new NotFoundException(TENANT_NOT_FOUND));
        String user = authenticator.authenticate(params.apiKey(), database).orElse(null);
        ExecutionContext ctx = new ExecutionContext(user, database, params, start);

        ConnectionGateway gateway = gateways.create(user, database);

        TableExtractionEntry entry = tableCache.lookup(params.sql(), gateway).orElse(null);
        if (entry == null) {
            if (props.getTableCache().isFailClosed()) {
                throw new AccessDeniedException(TABLES_UNKNOWN);
            }
            log.warn("Tables for a statement on {} are unknown, continuing without the system table check", database);
        }
        guard.check(entry);

        ResultEncoder encoder = encoders.get(params.format());
        writeHeaders(ctx, entry, encoder, sink);

        EncodeOptions options = new EncodeOptions(props.getGeometryColumn(), params.decimalPrecision(),
                params.skipFields(), params.filename(), ctx.startNanos());
        String sql = SqlWindow.apply(encoder.rewrite(params.sql(), options), params.limit(), params.offset());
        encoder.send(new EncodeRequest(sql, options, gateway), sink);
    }

    private void writeHeaders(ExecutionContext ctx, TableExtractionEntry entry, ResultEncoder encoder, ResponseSink sink) {
        RequestParameters params = ctx.params();
        ZonedDateTime now = ZonedDateTime.now(clock);
        sink.setHeader("Content-Disposition", ResponseHeaders.contentDisposition(
                !params.explicitFormatOrFilename(), params.filename(), encoder.fileExtension(), now));
        sink.setHeader("Content-Type", encoder.contentType());
        sink.setHeader(ResponseHeaders.CACHE_CHANNEL,
                ResponseHeaders.cacheChannel(ctx.database(), entry, ctx.authenticated()));
        if (params.persist()) {
            sink.setHeader("Cache-Control", ResponseHeaders.PERSISTENT_CACHE_CONTROL);
        } else {
            sink.setHeader("Last-Modified", ResponseHeaders.httpDate(now));
            sink.setHeader("Cache-Control", ResponseHeaders.DEFAULT_CACHE_CONTROL);
        }
    }
}
