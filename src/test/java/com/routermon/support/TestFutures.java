package com.routermon.support;

import io.vertx.core.Future;

import java.util.concurrent.ExecutionException;

import java.util.concurrent.TimeUnit;

/**
 * Blocking helpers for tests that drive futures outside a Vert.x context.
 */
public final class TestFutures
{

    private TestFutures()
    {
    }

    public static <T> T await(Future<T> future) throws Exception
    {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    /**
     * @return the failure cause of the future, or null if it succeeded
     */
    public static Throwable awaitFailure(Future<?> future) throws Exception
    {
        try
        {
            future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);

            return null;
        }
        catch (ExecutionException exception)
        {
            return exception.getCause();
        }
    }

}
