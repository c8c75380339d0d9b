/*******************************************************************************
 * MGDB Series - indexed series transforms, queries and factorization
 * Copyright (C) 2016 - 2025, <CIRAD> <IRD>
 *
 * This program is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Affero General Public License, version 3 as published by
 * the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
 * FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * See <http://www.gnu.org/licenses/agpl.html> for details about GNU General
 * Public License V3.
 *******************************************************************************/
package fr.cirad.series.parallel;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.log4j.Logger;

import fr.cirad.series.config.EngineConfig;
import fr.cirad.series.exceptions.SeriesException;

/**
 * Entry point to the in-JVM substrate: owns the worker pool shared by every
 * {@link LocalParallelCollection} it creates.
 */
public class SeriesContext implements Closeable {

    static private final Logger LOG = Logger.getLogger(SeriesContext.class);

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final EngineConfig config;
    private final ExecutorService pool;
    private final int threads;

    public SeriesContext() {
        this(EngineConfig.getDefault());
    }

    public SeriesContext(EngineConfig config) {
        this.config = config;
        this.threads = config.getThreadCount();
        final int poolId = POOL_COUNTER.incrementAndGet();
        final AtomicInteger threadCounter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "series-" + poolId + "-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.pool = Executors.newFixedThreadPool(threads, factory);
        LOG.debug("Started series context #" + poolId + " with " + threads + " worker threads");
    }

    public EngineConfig getConfig() {
        return config;
    }

    public int getThreadCount() {
        return threads;
    }

    public <T> ParallelCollection<T> parallelize(List<T> data) {
        return parallelize(data, config.getDefaultPartitionCount());
    }

    /**
     * Splits data into contiguous partitions, so that collection order is the order of data.
     */
    public <T> ParallelCollection<T> parallelize(List<T> data, int numPartitions) {
        if (numPartitions < 1)
            throw new IllegalArgumentException("Partition count must be positive: " + numPartitions);

        int n = data.size();
        int partitionCount = Math.max(1, Math.min(numPartitions, n));
        List<List<T>> partitions = new ArrayList<>(partitionCount);
        for (int p = 0; p < partitionCount; p++) {
            int from = (int) ((long) n * p / partitionCount);
            int to = (int) ((long) n * (p + 1) / partitionCount);
            partitions.add(new ArrayList<>(data.subList(from, to)));
        }
        return new LocalParallelCollection<>(this, partitions);
    }

    /**
     * Runs one task per partition and waits for all of them. Results are returned in task order.
     * The first failure is rethrown unwrapped when it is unchecked, so that callers see engine errors as is.
     */
    <R> List<R> runAll(List<Callable<R>> tasks) {
        List<Future<R>> futures = new ArrayList<>(tasks.size());
        for (Callable<R> task : tasks)
            futures.add(pool.submit(task));

        List<R> results = new ArrayList<>(tasks.size());
        try {
            for (Future<R> f : futures)
                results.add(f.get());
        }
        catch (InterruptedException ie) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new SeriesException("Interrupted while waiting for partition tasks", ie);
        }
        catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            if (cause instanceof Error)
                throw (Error) cause;
            throw new SeriesException("Partition task failed: " + cause.getMessage(), cause);
        }
        return results;
    }

    private void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> f : futures)
            f.cancel(true);
    }

    public boolean isClosed() {
        return pool.isShutdown();
    }

    @Override
    public void close() {
        pool.shutdownNow();
        LOG.debug("Series context closed");
    }
}
