package com.routermon.exceptions;

/**
 * The device could not be reached, refused the session, rejected the login,
 * or dropped the connection mid-command.

 * Any failure of this type ends the refresh cycle and marks the device offline.
 */
public class ConnectivityException extends RuntimeException
{

    public enum Reason
    {
        TIMEOUT,
        REFUSED,
        UNREACHABLE,
        AUTH
    }

    private final Reason reason;

    public ConnectivityException(Reason reason, String message)
    {
        super(message);

        this.reason = reason;
    }

    public ConnectivityException(Reason reason, String message, Throwable cause)
    {
        super(message, cause);

        this.reason = reason;
    }

    public Reason getReason()
    {
        return reason;
    }

}
