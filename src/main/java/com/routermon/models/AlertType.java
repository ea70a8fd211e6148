package com.routermon.models;

/**
 * Alert categories. The stored value is part of the dedup key (device, target, type).
 */
public enum AlertType
{

    STATUS_CHANGE("status_change"),  // Device online/offline

    WATCH_STATUS("watch_status"),    // Netwatch host up/down

    PERFORMANCE("performance"),      // Probe latency or packet loss over threshold

    SESSION("session"),              // Subscriber session connect/disconnect

    HIGH_CPU("high_cpu"),

    HIGH_MEMORY("high_memory");

    private final String value;

    AlertType(String value)
    {
        this.value = value;
    }

    public String value()
    {
        return value;
    }

    public static AlertType fromValue(String value)
    {
        for (var type : values())
        {
            if (type.value.equalsIgnoreCase(value))
            {
                return type;
            }
        }

        throw new IllegalArgumentException("Unknown alert type: " + value);
    }

}
