package com.routermon;

import com.routermon.core.DatabaseInitializer;

import com.routermon.core.EngineConfig;

import com.routermon.core.LoggingConfigurator;

import com.routermon.core.routeros.RouterOsClient;

import com.routermon.monitoring.AlertEmitter;

import com.routermon.monitoring.LatencyProber;

import com.routermon.monitoring.MetricsCollector;

import com.routermon.monitoring.NetwatchReconciler;

import com.routermon.monitoring.RefreshOrchestrator;

import com.routermon.monitoring.SessionTracker;

import com.routermon.services.impl.EventBusNotificationDispatcher;

import com.routermon.verticles.RefreshVerticle;

import io.vertx.config.ConfigRetriever;

import io.vertx.config.ConfigRetrieverOptions;

import io.vertx.config.ConfigStoreOptions;

import io.vertx.core.DeploymentOptions;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.ArrayList;

import java.util.List;

/**
 * RouterMon Application - Main Entry Point (Vert.x 5.0.4)

 * Startup sequence:
 * 1. Load application.conf (HOCON) and apply the logging section
 * 2. Initialize the database pool, schema and services
 * 3. Wire the RouterOS client and the monitoring components
 * 4. Deploy one RefreshVerticle per shard (event bus triggers + periodic tick)

 * Shutdown: undeploy verticles, close the RouterOS client and the database pool.
 */
public class RouterMonApplication
{

    private static final Logger logger = LoggerFactory.getLogger(RouterMonApplication.class);

    private static final Clock CLOCK = Clock.systemUTC();

    private static Vertx vertx;

    private static DatabaseInitializer databaseInitializer;

    private static RouterOsClient deviceClient;

    private static final List<String> deployedVerticleIds = new ArrayList<>();

    /**
     * Main entry point for the RouterMon application.
     *
     * @param args Command line arguments (not used)
     */
    public static void main(String[] args)
    {
        logger.info("Starting RouterMon Application");

        vertx = Vertx.vertx();

        loadConfiguration()
            .compose(config ->
            {
                LoggingConfigurator.configure(config);

                logger.info("Configuration loaded successfully");

                databaseInitializer = new DatabaseInitializer(vertx, config.getJsonObject("database", new JsonObject()), CLOCK);

                return databaseInitializer.initialize()
                    .compose(v -> deployRefreshVerticle(new EngineConfig(config)));
            })
            .onSuccess(v ->
            {
                logger.info("RouterMon Application started successfully");

                Runtime.getRuntime().addShutdownHook(new Thread(() ->
                {
                    logger.info("Shutdown signal received");

                    cleanup()
                        .compose(cleanupResult -> vertx.close())
                        .onSuccess(closeResult -> logger.info("Application stopped gracefully"))
                        .onFailure(cause -> logger.error("Error during graceful shutdown", cause));
                }));
            })
            .onFailure(cause ->
            {
                logger.error("Failed to start RouterMon Application", cause);

                cleanup()
                    .compose(cleanupResult -> vertx.close())
                    .onComplete(closeResult ->
                    {
                        if (closeResult.failed())
                        {
                            logger.error("Failed to close Vertx instance", closeResult.cause());
                        }

                        System.exit(1);
                    });
            });
    }

    /**
     * Builds the monitoring components around the database services and deploys the
     * RefreshVerticle instances, one per device shard.
     *
     * @param engineConfig typed monitoring configuration
     * @return Future that completes when the verticle is deployed
     */
    private static Future<Void> deployRefreshVerticle(EngineConfig engineConfig)
    {
        deviceClient = new RouterOsClient(vertx, engineConfig);

        var dispatcher = new EventBusNotificationDispatcher(vertx, engineConfig.getNotifyAddress(),
            engineConfig.getNotifyTimeoutMs());

        var alertEmitter = new AlertEmitter(databaseInitializer.getAlertService(), dispatcher, engineConfig, CLOCK);

        var metricsCollector = new MetricsCollector(databaseInitializer.getMetricsService(), alertEmitter, engineConfig, CLOCK);

        var netwatchReconciler = new NetwatchReconciler(deviceClient, databaseInitializer.getNetwatchService(),
            alertEmitter, engineConfig, CLOCK);

        var latencyProber = new LatencyProber(vertx, databaseInitializer.getNetwatchService(), alertEmitter, engineConfig);

        var sessionTracker = new SessionTracker(databaseInitializer.getSessionService(), alertEmitter, CLOCK);

        var orchestrator = new RefreshOrchestrator(deviceClient, databaseInitializer.getDeviceService(), metricsCollector,
            netwatchReconciler, latencyProber, sessionTracker, alertEmitter, engineConfig, CLOCK);

        var instances = engineConfig.getRefreshInstances();

        Future<Void> chain = Future.succeededFuture();

        // separate deployments land on separate event loops
        for (var shard = 0; shard < instances; shard++)
        {
            var options = new DeploymentOptions()
                .setConfig(new JsonObject().put("shard", shard).put("shards", instances));

            var verticle = new RefreshVerticle(orchestrator, databaseInitializer.getDeviceService(), engineConfig);

            chain = chain.compose(v -> vertx.deployVerticle(verticle, options)
                .map(deploymentId ->
                {
                    deployedVerticleIds.add(deploymentId);

                    logger.debug("RefreshVerticle deployed: {}", deploymentId);

                    return (Void) null;
                }));
        }

        return chain
            .onSuccess(v -> logger.info("{} RefreshVerticle instances deployed", instances))
            .onFailure(cause -> logger.error("Failed to deploy verticles", cause));
    }

    /**
     * Undeploys verticles and releases the RouterOS client and database pool.
     *
     * @return Future that completes when cleanup is done
     */
    private static Future<Void> cleanup()
    {
        logger.info("Starting cleanup");

        var cleanupFutures = new ArrayList<Future<Void>>();

        for (var deploymentId : deployedVerticleIds)
        {
            cleanupFutures.add(vertx.undeploy(deploymentId)
                .onSuccess(v -> logger.debug("Verticle undeploy: {}", deploymentId))
                .onFailure(cause -> logger.error("Failed to undeploy verticle: {}", deploymentId, cause)));
        }

        if (deviceClient != null)
        {
            cleanupFutures.add(deviceClient.close());
        }

        if (databaseInitializer != null)
        {
            cleanupFutures.add(databaseInitializer.cleanup());
        }

        return Future.join(cleanupFutures)
            .onComplete(result -> deployedVerticleIds.clear())
            .onFailure(cause -> logger.error("Some cleanup operations failed", cause))
            .mapEmpty();
    }

    /**
     * Loads application configuration from application.conf (HOCON).
     *
     * @return Future containing the loaded configuration
     */
    private static Future<JsonObject> loadConfiguration()
    {
        var promise = Promise.<JsonObject>promise();

        var fileStore = new ConfigStoreOptions()
            .setType("file")
            .setFormat("hocon")
            .setConfig(new JsonObject().put("path", "application.conf"));

        var retriever = ConfigRetriever.create(vertx, new ConfigRetrieverOptions().addStore(fileStore));

        retriever.getConfig()
            .onSuccess(config ->
            {
                var dbConfig = config.getJsonObject("database", new JsonObject());

                logger.info("Configuration loaded - Database: {}:{}/{}",
                    dbConfig.getString("host"),
                    dbConfig.getInteger("port"),
                    dbConfig.getString("database"));

                promise.complete(config);
            })
            .onFailure(cause ->
            {
                logger.error("Failed to load configuration from application.conf", cause);

                promise.fail(cause);
            });

        return promise.future();
    }

}
