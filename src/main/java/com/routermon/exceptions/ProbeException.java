package com.routermon.exceptions;

/**
 * A single latency probe failed or timed out. Never escapes LatencyProber.
 */
public class ProbeException extends RuntimeException
{

    private final String host;

    public ProbeException(String host, String message)
    {
        super("Probe " + host + " failed: " + message);

        this.host = host;
    }

    public String getHost()
    {
        return host;
    }

}
