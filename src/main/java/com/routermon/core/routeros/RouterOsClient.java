package com.routermon.core.routeros;

import com.routermon.core.DeviceClient;

import com.routermon.core.DeviceCredentials;

import com.routermon.core.DeviceSession;

import com.routermon.core.EngineConfig;

import com.routermon.utils.ExceptionUtil;

import io.vertx.core.Future;

import io.vertx.core.Vertx;

import io.vertx.core.net.NetClient;

import io.vertx.core.net.NetClientOptions;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * RouterOsClient - DeviceClient over the RouterOS API (TCP, default port 8728)

 * Opens one TCP connection per session with a shared NetClient; the connect timeout
 * comes from routeros.connect.timeout.ms and every command is bounded by
 * routeros.command.timeout.ms.
 */
public class RouterOsClient implements DeviceClient
{

    private static final Logger logger = LoggerFactory.getLogger(RouterOsClient.class);

    private final Vertx vertx;

    private final NetClient netClient;

    private final long commandTimeoutMs;

    public RouterOsClient(Vertx vertx, EngineConfig config)
    {
        this.vertx = vertx;

        this.commandTimeoutMs = config.getCommandTimeoutMs();

        this.netClient = vertx.createNetClient(new NetClientOptions()
            .setConnectTimeout((int) config.getConnectTimeoutMs()));
    }

    @Override
    public Future<DeviceSession> open(DeviceCredentials credentials)
    {
        var target = credentials.target();

        logger.debug("Opening session to {}", credentials);

        return netClient.connect(credentials.getPort(), credentials.getAddress())
            .recover(cause -> Future.failedFuture(ExceptionUtil.classifyConnectFailure(cause, target)))
            .compose(socket ->
            {
                var session = new RouterOsSession(vertx, socket, target, commandTimeoutMs);

                return session.login(credentials.getUsername(), credentials.getPassword())
                    .map(v -> (DeviceSession) session)
                    .recover(cause -> session.close().compose(v -> Future.<DeviceSession>failedFuture(cause)));
            })
            .onSuccess(session -> logger.debug("Session to {} established", target))
            .onFailure(cause -> logger.debug("Session to {} failed: {}", target, cause.getMessage()));
    }

    @Override
    public Future<Void> close()
    {
        return netClient.close();
    }

}
