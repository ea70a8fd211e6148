package com.routermon.models;

import io.vertx.core.json.JsonObject;

/**
 * Identity fields read from /system/identity, /system/resource and /system/routerboard.
 * Any field may be null when the device does not report it.
 */
public class DeviceIdentity
{

    public String identity;

    public String version;

    public String model;

    public String serialNumber;

    public String boardName;

    public String architecture;

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("identity", identity)
            .put("version", version)
            .put("model", model)
            .put("serial_number", serialNumber)
            .put("board_name", boardName)
            .put("architecture", architecture);
    }

}
