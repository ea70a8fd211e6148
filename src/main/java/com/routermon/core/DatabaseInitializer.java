package com.routermon.core;

import com.routermon.services.AlertService;

import com.routermon.services.DeviceService;

import com.routermon.services.MetricsService;

import com.routermon.services.NetwatchService;

import com.routermon.services.SessionService;

import com.routermon.services.impl.AlertServiceImpl;

import com.routermon.services.impl.DeviceServiceImpl;

import com.routermon.services.impl.MetricsServiceImpl;

import com.routermon.services.impl.NetwatchServiceImpl;

import com.routermon.services.impl.SessionServiceImpl;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import io.vertx.pgclient.PgBuilder;

import io.vertx.pgclient.PgConnectOptions;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.PoolOptions;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.Arrays;

/**
 * DatabaseInitializer - One-time database setup at application startup

 * Tasks performed:
 * - Creates the PostgreSQL connection pool and validates connectivity
 * - Applies db/schema.sql when database.schema.apply is true
 * - Instantiates the service implementations backed by the shared pool
 */
public class DatabaseInitializer
{

    private static final Logger logger = LoggerFactory.getLogger(DatabaseInitializer.class);

    private static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final Vertx vertx;

    private final JsonObject databaseConfig;

    private final Clock clock;

    private Pool pgPool;

    private DeviceService deviceService;

    private MetricsService metricsService;

    private NetwatchService netwatchService;

    private SessionService sessionService;

    private AlertService alertService;

    /**
     * @param vertx Vert.x instance owning the pool
     * @param databaseConfig database section of application.conf
     * @param clock time source for the timestamps the services write
     */
    public DatabaseInitializer(Vertx vertx, JsonObject databaseConfig, Clock clock)
    {
        this.vertx = vertx;

        this.databaseConfig = databaseConfig;

        this.clock = clock;
    }

    /**
     * Connects, applies the schema if configured and creates the services.
     *
     * @return Future that completes when the services are usable
     */
    public Future<Void> initialize()
    {
        try
        {
            logger.info("Initializing database services");

            return setupDatabaseConnection()
                    .compose(pool ->
                    {
                        this.pgPool = pool;

                        var applySchema = databaseConfig.getJsonObject("schema", new JsonObject())
                                .getBoolean("apply", true);

                        return applySchema ? applySchema() : Future.<Void>succeededFuture();
                    })
                    .map(v ->
                    {
                        setupAllServices();

                        logger.info("Database initialization completed");

                        return (Void) null;
                    })
                    .onFailure(cause ->
                            logger.error("Failed to initialize database services: {}", cause.getMessage()));
        }
        catch (Exception exception)
        {
            logger.error("Error in initialize: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    private Future<Pool> setupDatabaseConnection()
    {
        var promise = Promise.<Pool>promise();

        try
        {
            var connectOptions = new PgConnectOptions()
                    .setPort(databaseConfig.getInteger("port", 5432))
                    .setHost(databaseConfig.getString("host", "localhost"))
                    .setDatabase(databaseConfig.getString("database", "routermon"))
                    .setUser(databaseConfig.getString("user", "routermon"))
                    .setPassword(databaseConfig.getString("password", "routermon"));

            var poolOptions = new PoolOptions()
                    .setMaxSize(databaseConfig.getInteger("maxSize", 10));

            var pool = PgBuilder.pool()
                    .with(poolOptions)
                    .connectingTo(connectOptions)
                    .using(vertx)
                    .build();

            // Test database connection
            pool.getConnection()
                    .onSuccess(connection ->
                    {
                        logger.info("Database connection established");

                        connection.close();

                        promise.complete(pool);
                    })
                    .onFailure(cause ->
                    {
                        logger.error("Database connection failed: {}", cause.getMessage());

                        pool.close();

                        promise.fail(cause);
                    });
        }
        catch (Exception exception)
        {
            logger.error("Failed to setup database connection: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    /**
     * Runs every statement of db/schema.sql in order. Statements are separated by lines
     * holding only ";;" so function bodies may contain semicolons.
     */
    private Future<Void> applySchema()
    {
        return vertx.fileSystem().readFile(SCHEMA_RESOURCE)
                .compose(buffer ->
                {
                    var statements = Arrays.stream(buffer.toString().split("(?m)^\\s*;;\\s*$"))
                            .map(String::trim)
                            .filter(statement -> !statement.isEmpty() && !isCommentOnly(statement))
                            .toList();

                    Future<Void> chain = Future.succeededFuture();

                    for (var statement : statements)
                    {
                        chain = chain.compose(v -> pgPool.query(statement).execute().<Void>mapEmpty());
                    }

                    return chain.onSuccess(v -> logger.info("Schema applied ({} statements)", statements.size()));
                });
    }

    private static boolean isCommentOnly(String statement)
    {
        return statement.lines().allMatch(line -> line.isBlank() || line.trim().startsWith("--"));
    }

    private void setupAllServices()
    {
        this.deviceService = new DeviceServiceImpl(pgPool, clock);

        this.metricsService = new MetricsServiceImpl(pgPool, clock);

        this.netwatchService = new NetwatchServiceImpl(pgPool, clock);

        this.sessionService = new SessionServiceImpl(pgPool, clock);

        this.alertService = new AlertServiceImpl(pgPool);

        logger.debug("All 5 service implementations created");
    }

    public DeviceService getDeviceService()
    {
        return deviceService;
    }

    public MetricsService getMetricsService()
    {
        return metricsService;
    }

    public NetwatchService getNetwatchService()
    {
        return netwatchService;
    }

    public SessionService getSessionService()
    {
        return sessionService;
    }

    public AlertService getAlertService()
    {
        return alertService;
    }

    /**
     * Closes the database connection pool.
     *
     * @return Future that completes when cleanup is done
     */
    public Future<Void> cleanup()
    {
        var promise = Promise.<Void>promise();

        try
        {
            logger.info("Cleaning up database resources");

            if (pgPool != null)
            {
                pgPool.close()
                        .onSuccess(v ->
                        {
                            logger.debug("Database connection pool closed");

                            promise.complete();
                        })
                        .onFailure(cause ->
                        {
                            logger.error("Failed to close database pool: {}", cause.getMessage());

                            promise.fail(cause);
                        });
            }
            else
            {
                promise.complete();
            }
        }
        catch (Exception exception)
        {
            logger.error("Error in cleanup: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

}
