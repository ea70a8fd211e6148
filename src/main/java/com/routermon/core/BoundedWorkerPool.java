package com.routermon.core;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

import java.util.Collections;

import java.util.List;

import java.util.Queue;

import java.util.concurrent.ConcurrentLinkedQueue;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generic fixed-size worker pool over a shared queue.

 * At most {@code concurrency} items are in flight at any time. Each worker pulls the
 * next item as soon as its current one settles, so a slow item only occupies one
 * worker while the rest of the queue keeps draining.

 * Features:
 * - Bounded: never more than concurrency calls to processItem() outstanding
 * - Fail-tolerant: a failed item is mapped to a fallback result by handleItemFailure()
 * - Ordered: results are returned in input order regardless of completion order
 * - Thread-safe: uses ConcurrentLinkedQueue for queue operations

 * Usage Pattern:
 * 1. Extend this class and implement processItem() and handleItemFailure()
 * 2. Create instance with items and concurrency
 * 3. Call run(); the future completes once every item has settled
 *
 * @param <T> Type of items to process
 * @param <R> Type of per-item result
 */
public abstract class BoundedWorkerPool<T, R>
{

    private static final Logger logger = LoggerFactory.getLogger(BoundedWorkerPool.class);

    private final Queue<Integer> remainingIndexes;

    private final List<T> items;

    private final List<R> results;

    private final int concurrency;

    private final AtomicInteger settledCount = new AtomicInteger();

    /**
     * @param items Items to process
     * @param concurrency Maximum number of items in flight
     */
    public BoundedWorkerPool(List<T> items, int concurrency)
    {
        this.items = new ArrayList<>(items);

        this.results = new ArrayList<>(Collections.nCopies(items.size(), null));

        this.remainingIndexes = new ConcurrentLinkedQueue<>();

        for (var index = 0; index < items.size(); index++)
        {
            remainingIndexes.add(index);
        }

        this.concurrency = Math.max(1, concurrency);
    }

    /**
     * Starts min(concurrency, items) workers and completes when all items have settled.
     *
     * @return Future with one result per item, in input order
     */
    public Future<List<R>> run()
    {
        var promise = Promise.<List<R>>promise();

        if (items.isEmpty())
        {
            promise.complete(List.of());

            return promise.future();
        }

        var workers = Math.min(concurrency, items.size());

        logger.debug("Worker pool started: {} items, {} workers", items.size(), workers);

        for (var worker = 0; worker < workers; worker++)
        {
            processNext(promise);
        }

        return promise.future();
    }

    /**
     * Pull the next item from the queue and process it; recurse on settlement.
     *
     * @param promise Completed with all results once the last item settles
     */
    private void processNext(Promise<List<R>> promise)
    {
        var index = remainingIndexes.poll();

        if (index == null)
        {
            return;
        }

        var item = items.get(index);

        Future<R> future;

        try
        {
            future = processItem(item);
        }
        catch (Exception exception)
        {
            future = Future.failedFuture(exception);
        }

        future.onComplete(result ->
        {
            if (result.succeeded())
            {
                store(index, result.result());
            }
            else
            {
                logger.debug("Worker pool item {} failed: {}", index, result.cause().getMessage());

                store(index, handleItemFailure(item, result.cause()));
            }

            if (settledCount.incrementAndGet() == items.size())
            {
                promise.tryComplete(snapshot());
            }
            else
            {
                processNext(promise);
            }
        });
    }

    private synchronized void store(int index, R result)
    {
        results.set(index, result);
    }

    private synchronized List<R> snapshot()
    {
        return new ArrayList<>(results);
    }

    /**
     * Process a single item.
     *
     * @param item Item to process
     * @return Future with the item's result
     */
    protected abstract Future<R> processItem(T item);

    /**
     * Map a failed item to its fallback result. Processing continues with the next item.
     *
     * @param item The item that failed
     * @param cause The failure
     * @return Result recorded for the item
     */
    protected abstract R handleItemFailure(T item, Throwable cause);

    public int getTotalItems()
    {
        return items.size();
    }

}
