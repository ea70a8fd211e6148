package com.routermon.support;

import com.routermon.core.DeviceSession;

import com.routermon.exceptions.ProtocolException;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.json.JsonObject;

import java.util.ArrayList;

import java.util.HashMap;

import java.util.List;

import java.util.Map;

import java.util.concurrent.atomic.AtomicInteger;

import java.util.function.Function;

/**
 * DeviceSession answering from canned replies keyed by command.
 * Unscripted commands fail with a ProtocolException, like an unknown menu on the device.
 */
public class ScriptedDeviceSession implements DeviceSession
{

    private final Map<String, Function<Map<String, String>, Future<List<JsonObject>>>> handlers = new HashMap<>();

    private final List<String> executed = new ArrayList<>();

    private final List<String> abandoned = new ArrayList<>();

    private final AtomicInteger closeCount = new AtomicInteger();

    public ScriptedDeviceSession reply(String command, JsonObject... rows)
    {
        handlers.put(command, params -> Future.succeededFuture(List.of(rows)));

        return this;
    }

    public ScriptedDeviceSession fail(String command, Throwable cause)
    {
        handlers.put(command, params -> Future.failedFuture(cause));

        return this;
    }

    public ScriptedDeviceSession handle(String command, Function<Map<String, String>, Future<List<JsonObject>>> handler)
    {
        handlers.put(command, handler);

        return this;
    }

    /**
     * The command never completes.
     */
    public ScriptedDeviceSession hang(String command)
    {
        handlers.put(command, params -> Promise.<List<JsonObject>>promise().future());

        return this;
    }

    @Override
    public synchronized Future<List<JsonObject>> execute(String command, Map<String, String> params)
    {
        executed.add(command);

        var handler = handlers.get(command);

        if (handler == null)
        {
            return Future.failedFuture(new ProtocolException(command, "no such command prefix"));
        }

        return handler.apply(params);
    }

    /**
     * Records the command as abandoned once the caller gives up on it.
     */
    @Override
    public Future<List<JsonObject>> execute(String command, Map<String, String> params, Future<?> abandon)
    {
        abandon.onComplete(signal ->
        {
            synchronized (this)
            {
                abandoned.add(command + " " + params.getOrDefault("address", ""));
            }
        });

        return execute(command, params);
    }

    @Override
    public Future<Void> close()
    {
        closeCount.incrementAndGet();

        return Future.succeededFuture();
    }

    public synchronized List<String> executed()
    {
        return new ArrayList<>(executed);
    }

    public synchronized List<String> abandoned()
    {
        return new ArrayList<>(abandoned);
    }

    public int closeCount()
    {
        return closeCount.get();
    }

}
