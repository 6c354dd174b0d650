package org.iceforge.sqlapi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.sqlapi.access.AccessGuard;
import org.iceforge.sqlapi.dispatch.QueryDispatcher;
import org.iceforge.sqlapi.export.ExportCoalescer;
import org.iceforge.sqlapi.export.ExternalCommand;
import org.iceforge.sqlapi.format.CsvEncoder;
import org.iceforge.sqlapi.format.EncoderRegistry;
import org.iceforge.sqlapi.format.GeoJsonEncoder;
import org.iceforge.sqlapi.format.JsonEncoder;
import org.iceforge.sqlapi.format.KmlEncoder;
import org.iceforge.sqlapi.format.ShapefileEncoder;
import org.iceforge.sqlapi.format.SvgEncoder;
import org.iceforge.sqlapi.format.binary.BinaryEncoder;
import org.iceforge.sqlapi.jdbc.ConnectionGatewayFactory;
import org.iceforge.sqlapi.jdbc.DataSourceRegistry;
import org.iceforge.sqlapi.jdbc.spi.DataSourceProvider;
import org.iceforge.sqlapi.jdbc.spi.HikariDataSourceProvider;
import org.iceforge.sqlapi.tables.TableExtractionCache;
import org.iceforge.sqlapi.tenant.ApiKeyAuthenticator;
import org.iceforge.sqlapi.tenant.PropertiesTenantResolver;
import org.iceforge.sqlapi.tenant.RequestAuthenticator;
import org.iceforge.sqlapi.tenant.TenantResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SqlApiConfig {

    @Bean
    public DataSourceProvider dataSourceProvider(SqlApiProperties props) {
        return new HikariDataSourceProvider(props.getDb());
    }

    @Bean
    public DataSourceRegistry dataSourceRegistry(SqlApiProperties props, DataSourceProvider provider) {
        return new DataSourceRegistry(props.getDb(), provider);
    }

    @Bean
    public ConnectionGatewayFactory connectionGatewayFactory(DataSourceRegistry registry) {
        return new ConnectionGatewayFactory(registry);
    }

    @Bean
    public TableExtractionCache tableExtractionCache(SqlApiProperties props) {
        SqlApiProperties.TableCache cfg = props.getTableCache();
        return new TableExtractionCache(cfg.getMaxEntries(), cfg.getMaxAge());
    }

    @Bean
    public AccessGuard accessGuard() {
        return new AccessGuard();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService exportExecutor(SqlApiProperties props) {
        int threads = Math.max(1, props.getExport().getThreads());
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "sqlapi-export");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ExportCoalescer exportCoalescer(ExecutorService exportExecutor) {
        return new ExportCoalescer(exportExecutor);
    }

    @Bean
    public EncoderRegistry encoderRegistry(SqlApiProperties props, ObjectMapper mapper, ExportCoalescer coalescer) {
        ExternalCommand ogr2ogr = new ExternalCommand(props.getExport().getWaitTimeout());
        return new EncoderRegistry(List.of(
                new JsonEncoder(mapper),
                new GeoJsonEncoder(mapper),
                new CsvEncoder(),
                new SvgEncoder(),
                new BinaryEncoder(),
                new ShapefileEncoder(coalescer, ogr2ogr, props),
                new KmlEncoder(coalescer, ogr2ogr, props)));
    }

    @Bean
    public TenantResolver tenantResolver(SqlApiProperties props) {
        return new PropertiesTenantResolver(props.getTenants());
    }

    @Bean
    public RequestAuthenticator requestAuthenticator(SqlApiProperties props) {
        return new ApiKeyAuthenticator(props.getApiKeys());
    }

    @Bean
    public QueryDispatcher queryDispatcher(SqlApiProperties props,
                                           TenantResolver tenantResolver,
                                           RequestAuthenticator authenticator,
                                           ConnectionGatewayFactory gateways,
                                           TableExtractionCache tableCache,
                                           AccessGuard guard,
                                           EncoderRegistry encoders) {
        return new QueryDispatcher(props, tenantResolver, authenticator, gateways, tableCache, guard, encoders);
    }
}
