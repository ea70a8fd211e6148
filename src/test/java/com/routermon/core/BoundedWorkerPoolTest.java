package com.routermon.core;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import java.util.LinkedHashMap;

import java.util.List;

import java.util.Map;

import static com.routermon.support.TestFutures.await;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedWorkerPoolTest
{

    /**
     * Pool whose items complete only when the test settles them.
     */
    private static class ManualPool extends BoundedWorkerPool<Integer, String>
    {

        final Map<Integer, Promise<String>> outstanding = new LinkedHashMap<>();

        int maxInFlight;

        ManualPool(List<Integer> items, int concurrency)
        {
            super(items, concurrency);
        }

        @Override
        protected Future<String> processItem(Integer item)
        {
            if (item < 0)
            {
                throw new IllegalArgumentException("negative item");
            }

            var promise = Promise.<String>promise();

            outstanding.put(item, promise);

            maxInFlight = Math.max(maxInFlight, outstanding.size());

            return promise.future();
        }

        @Override
        protected String handleItemFailure(Integer item, Throwable cause)
        {
            return "failed:" + item;
        }

        void settleNewest(boolean succeed)
        {
            var keys = new ArrayList<>(outstanding.keySet());

            var item = keys.get(keys.size() - 1);

            var promise = outstanding.remove(item);

            if (succeed)
            {
                promise.complete("ok:" + item);
            }
            else
            {
                promise.fail("boom");
            }
        }

    }

    @Test
    void neverExceedsConcurrencyAndKeepsInputOrder() throws Exception
    {
        var pool = new ManualPool(List.of(0, 1, 2, 3, 4, 5, 6), 3);

        var result = pool.run();

        assertEquals(3, pool.outstanding.size());

        while (!pool.outstanding.isEmpty())
        {
            pool.settleNewest(true);
        }

        assertEquals(3, pool.maxInFlight);

        assertEquals(List.of("ok:0", "ok:1", "ok:2", "ok:3", "ok:4", "ok:5", "ok:6"), await(result));
    }

    @Test
    void slowItemDoesNotBlockTheRest() throws Exception
    {
        var pool = new ManualPool(List.of(0, 1, 2, 3), 2);

        var result = pool.run();

        var slow = pool.outstanding.remove(0);

        while (!pool.outstanding.isEmpty())
        {
            pool.settleNewest(true);
        }

        assertFalse(result.isComplete());

        slow.complete("late");

        assertEquals(List.of("late", "ok:1", "ok:2", "ok:3"), await(result));
    }

    @Test
    void failuresAreMappedAndProcessingContinues() throws Exception
    {
        var pool = new ManualPool(List.of(0, -1, 2), 1);

        var result = pool.run();

        pool.settleNewest(false);

        pool.settleNewest(true);

        assertTrue(result.isComplete());

        assertEquals(List.of("failed:0", "failed:-1", "ok:2"), await(result));
    }

    @Test
    void emptyInputCompletesImmediately() throws Exception
    {
        var pool = new ManualPool(List.of(), 4);

        assertEquals(List.of(), await(pool.run()));

        assertEquals(0, pool.getTotalItems());
    }

}
