package com.routermon.exceptions;

/**
 * Another refresh, sync or delete is already running for the device.
 */
public class DeviceBusyException extends RuntimeException
{

    private final String deviceId;

    public DeviceBusyException(String deviceId, String operation)
    {
        super("Device " + deviceId + " is busy, " + operation + " rejected");

        this.deviceId = deviceId;
    }

    public String getDeviceId()
    {
        return deviceId;
    }

}
