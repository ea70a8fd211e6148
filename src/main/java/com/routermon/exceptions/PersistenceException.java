package com.routermon.exceptions;

/**
 * A store operation failed. Wraps the underlying SQL client failure.
 */
public class PersistenceException extends RuntimeException
{

    public PersistenceException(String operation, Throwable cause)
    {
        super(operation + " failed: " + cause.getMessage(), cause);
    }

}
