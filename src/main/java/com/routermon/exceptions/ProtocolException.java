package com.routermon.exceptions;

/**
 * The device answered a command with an error reply (!trap) or sent a malformed sentence.
 * The session stays usable.
 */
public class ProtocolException extends RuntimeException
{

    private final String command;

    public ProtocolException(String command, String message)
    {
        super(command != null ? command + ": " + message : message);

        this.command = command;
    }

    public String getCommand()
    {
        return command;
    }

}
