package com.routermon.core;

import io.vertx.core.Future;

import io.vertx.core.json.JsonObject;

import java.util.List;

import java.util.Map;

/**
 * One authenticated session to a device, opened per refresh cycle and never reused.

 * Commands:
 * - command is a menu path such as "/interface/print"
 * - params map to "=key=value" attribute words; keys starting with '?' map to
 *   "?key=value" query words
 * - replies are ordered rows; keys vary between rows and RouterOS versions

 * Failures:
 * - device-side error reply → ProtocolException (session stays usable)
 * - connection lost or command timed out → ConnectivityException

 * Several commands may be in flight on one session at the same time.
 */
public interface DeviceSession
{

    Future<List<JsonObject>> execute(String command, Map<String, String> params);

    default Future<List<JsonObject>> execute(String command)
    {
        return execute(command, Map.of());
    }

    /**
     * Runs a command the caller may give up on. Once abandon completes, a still-pending
     * command is cancelled on the device and its future fails with ProtocolException.
     * Sessions without cancellation support run the command to completion.
     *
     * @param command menu path
     * @param params attribute and query words
     * @param abandon completes when the caller no longer wants the reply
     * @return Future with the reply rows
     */
    default Future<List<JsonObject>> execute(String command, Map<String, String> params, Future<?> abandon)
    {
        return execute(command, params);
    }

    /**
     * Closes the session. Idempotent; never fails.
     *
     * @return Future completed once the session is released
     */
    Future<Void> close();

}
