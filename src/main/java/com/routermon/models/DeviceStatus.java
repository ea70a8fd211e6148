package com.routermon.models;

/**
 * Lifecycle status of a monitored device.

 * Transitions driven by the refresh cycle:
 * UNKNOWN / OFFLINE → ONLINE (session opened and identity fetched)
 * UNKNOWN / ONLINE  → OFFLINE (connectivity failure)
 * MAINTENANCE is set externally and suppresses refreshes
 */
public enum DeviceStatus
{

    UNKNOWN("unknown"),          // Never refreshed

    ONLINE("online"),            // Last refresh reached the device

    OFFLINE("offline"),          // Last refresh failed on connectivity

    MAINTENANCE("maintenance");  // Operator hold, not polled

    private final String value;

    DeviceStatus(String value)
    {
        this.value = value;
    }

    public String value()
    {
        return value;
    }

    /**
     * Resolve a stored status value, falling back to UNKNOWN for null or unrecognised input.
     *
     * @param value status column value
     * @return matching status
     */
    public static DeviceStatus fromValue(String value)
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
