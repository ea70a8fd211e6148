package com.routermon.support;

import com.routermon.core.DeviceClient;

import com.routermon.core.DeviceCredentials;

import com.routermon.core.DeviceSession;

import io.vertx.core.Future;

import java.util.ArrayList;

import java.util.List;

/**
 * DeviceClient handing out one scripted session, or failing every open.
 */
public class ScriptedDeviceClient implements DeviceClient
{

    private final ScriptedDeviceSession session;

    private Throwable openFailure;

    private final List<DeviceCredentials> opened = new ArrayList<>();

    public ScriptedDeviceClient(ScriptedDeviceSession session)
    {
        this.session = session;
    }

    public ScriptedDeviceClient failOpen(Throwable cause)
    {
        this.openFailure = cause;

        return this;
    }

    @Override
    public Future<DeviceSession> open(DeviceCredentials credentials)
    {
        opened.add(credentials);

        if (openFailure != null)
        {
            return Future.failedFuture(openFailure);
        }

        return Future.succeededFuture(session);
    }

    @Override
    public Future<Void> close()
    {
        return Future.succeededFuture();
    }

    public List<DeviceCredentials> opened()
    {
        return opened;
    }

}
