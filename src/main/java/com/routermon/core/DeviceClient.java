package com.routermon.core;

import io.vertx.core.Future;

/**
 * Opens management sessions to devices.

 * Failures to reach the device, or a rejected login, fail the returned future with
 * ConnectivityException (reason TIMEOUT, REFUSED, UNREACHABLE or AUTH).
 */
public interface DeviceClient
{

    /**
     * Connects and authenticates.
     *
     * @param credentials address, port and decrypted login
     * @return Future with an open session owned by the caller
     */
    Future<DeviceSession> open(DeviceCredentials credentials);

    /**
     * Releases client-wide resources.
     *
     * @return Future completed when the client is closed
     */
    Future<Void> close();

}
