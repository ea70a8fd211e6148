package com.routermon.core;

/**
 * Decrypted login details for one device. Never persisted or logged.
 */
public class DeviceCredentials
{

    private final String address;

    private final int port;

    private final String username;

    private final String password;

    public DeviceCredentials(String address, int port, String username, String password)
    {
        this.address = address;

        this.port = port;

        this.username = username;

        this.password = password;
    }

    public String getAddress()
    {
        return address;
    }

    public int getPort()
    {
        return port;
    }

    public String getUsername()
    {
        return username;
    }

    public String getPassword()
    {
        return password;
    }

    public String target()
    {
        return address + ":" + port;
    }

    @Override
    public String toString()
    {
        return username + "@" + target();
    }

}
