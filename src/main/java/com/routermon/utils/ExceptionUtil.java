package com.routermon.utils;

import com.routermon.exceptions.ConnectivityException;

import java.net.ConnectException;

import java.net.NoRouteToHostException;

import java.net.UnknownHostException;

/**
 * ExceptionUtil - Generic Exception Handling Utility

 * Provides consistent error handling across monitoring components
 * - Error message extraction for reports and logs
 * - Connectivity classification of transport failures
 */
public class ExceptionUtil
{

    /**
     * Extract meaningful error message from exception
     * Combines default message (context) with exception message (specific error) when both are available
     *
     * @param cause Exception cause
     * @param defaultMessage Default message providing context
     * @return Error message (combined or default only)
     */
    public static String getMessage(Throwable cause, String defaultMessage)
    {
        if (cause == null)
        {
            return defaultMessage;
        }

        var exceptionMessage = cause.getMessage();

        if (exceptionMessage != null && !exceptionMessage.trim().isEmpty())
        {
            return defaultMessage + ": " + exceptionMessage;
        }

        return defaultMessage;
    }

    /**
     * Message of the exception, or its type name when it carries none.
     *
     * @param cause Exception cause
     * @return non-null message
     */
    public static String getMessage(Throwable cause)
    {
        if (cause == null)
        {
            return "unknown error";
        }

        var exceptionMessage = cause.getMessage();

        if (exceptionMessage != null && !exceptionMessage.trim().isEmpty())
        {
            return exceptionMessage;
        }

        return cause.getClass().getSimpleName();
    }

    /**
     * Checks whether a failure, or anything in its cause chain, is a ConnectivityException.
     *
     * @param cause failure to inspect
     * @return true when the device should be considered unreachable
     */
    public static boolean isConnectivityFailure(Throwable cause)
    {
        var current = cause;

        while (current != null)
        {
            if (current instanceof ConnectivityException)
            {
                return true;
            }

            current = current.getCause();
        }

        return false;
    }

    /**
     * Maps a transport-level failure from the socket layer onto a ConnectivityException.

     * Classification:
     * - connect timeouts (including the netty ConnectTimeoutException subclass of ConnectException) → TIMEOUT
     * - unknown host, no route → UNREACHABLE
     * - other ConnectException → REFUSED
     * - anything else → UNREACHABLE
     *
     * @param cause failure raised while connecting or talking to the device
     * @param target host:port for the message
     * @return classified exception (cause itself when already classified)
     */
    public static ConnectivityException classifyConnectFailure(Throwable cause, String target)
    {
        if (cause instanceof ConnectivityException connectivityException)
        {
            return connectivityException;
        }

        var message = getMessage(cause);

        if (cause != null && (cause.getClass().getSimpleName().contains("Timeout")
            || message.toLowerCase().contains("timed out")))
        {
            return new ConnectivityException(ConnectivityException.Reason.TIMEOUT,
                "Connection to " + target + " timed out", cause);
        }

        if (cause instanceof UnknownHostException || cause instanceof NoRouteToHostException)
        {
            return new ConnectivityException(ConnectivityException.Reason.UNREACHABLE,
                "Device " + target + " unreachable: " + message, cause);
        }

        if (cause instanceof ConnectException)
        {
            return new ConnectivityException(ConnectivityException.Reason.REFUSED,
                "Connection to " + target + " refused", cause);
        }

        return new ConnectivityException(ConnectivityException.Reason.UNREACHABLE,
            "Device " + target + " unreachable: " + message, cause);
    }

}
