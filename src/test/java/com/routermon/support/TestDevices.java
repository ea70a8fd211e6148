package com.routermon.support;

import com.routermon.core.EngineConfig;

import com.routermon.models.Device;

import com.routermon.models.DeviceStatus;

import com.routermon.utils.PasswordUtil;

import io.vertx.core.json.JsonObject;

/**
 * Device records and configuration shared by the monitoring tests.
 */
public final class TestDevices
{

    public static final String DEVICE_ID = "7c9e6679-7425-40de-944b-e07fc1f90ae7";

    public static final String PASSWORD = "api-secret";

    private TestDevices()
    {
    }

    public static EngineConfig config()
    {
        return new EngineConfig(new JsonObject());
    }

    public static JsonObject deviceJson(String deviceId, DeviceStatus status)
    {
        return new JsonObject()
            .put("device_id", deviceId)
            .put("name", "core-router")
            .put("address", "10.0.0.1")
            .put("port", 8728)
            .put("username", "monitor")
            .put("secret_encrypted", PasswordUtil.encryptSecret(PASSWORD, config().getSecretKey()))
            .put("status", status.value());
    }

    public static Device device(DeviceStatus status)
    {
        return Device.fromJson(deviceJson(DEVICE_ID, status));
    }

}
