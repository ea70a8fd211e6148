package com.routermon.models;

/**
 * Health state of a netwatch target as reported by the device.
 * Only UP and DOWN are settled; transitions through UNKNOWN never raise alerts.
 */
public enum WatchStatus
{

    UP("up"),

    DOWN("down"),

    UNKNOWN("unknown");

    private final String value;

    WatchStatus(String value)
    {
        this.value = value;
    }

    public String value()
    {
        return value;
    }

    public boolean isSettled()
    {
        return this != UNKNOWN;
    }

    public static WatchStatus fromValue(String value)
    {
        if (value != null)
        {
            for (var status : values())
            {
                if (status.value.equalsIgnoreCase(value.trim()))
                {
                    return status;
                }
            }
        }

        return UNKNOWN;
    }

}
