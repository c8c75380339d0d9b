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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Thread-pool backed collection: each partition is handled by one task of the owning context's pool.
 * Instances are immutable; map returns a new collection with the same partitioning.
 */
public class LocalParallelCollection<T> implements ParallelCollection<T> {

    private final SeriesContext context;
    private final List<List<T>> partitions;

    LocalParallelCollection(SeriesContext context, List<List<T>> partitions) {
        this.context = context;
        this.partitions = partitions;
    }

    @Override
    public <R> ParallelCollection<R> map(Function<? super T, ? extends R> fn) {
        List<Callable<List<R>>> tasks = new ArrayList<>(partitions.size());
        for (final List<T> partition : partitions)
            tasks.add(() -> {
                List<R> out = new ArrayList<>(partition.size());
                for (T t : partition)
                    out.add(fn.apply(t));
                return out;
            });
        return new LocalParallelCollection<>(context, context.runAll(tasks));
    }

    @Override
    public <A> A aggregate(Supplier<A> zero, BiFunction<A, ? super T, A> seqOp, BinaryOperator<A> combOp) {
        List<Callable<A>> tasks = new ArrayList<>(partitions.size());
        for (final List<T> partition : partitions)
            tasks.add(() -> {
                A acc = zero.get();
                for (T t : partition)
                    acc = seqOp.apply(acc, t);
                return acc;
            });

        A result = zero.get();
        for (A partial : context.runAll(tasks))
            result = combOp.apply(result, partial);
        return result;
    }

    @Override
    public List<T> collectOrdered() {
        List<T> all = new ArrayList<>();
        for (List<T> partition : partitions)
            all.addAll(partition);
        return all;
    }

    @Override
    public List<T> sample(int n, long seed) {
        if (n < 0)
            throw new IllegalArgumentException("Sample size must not be negative: " + n);
        List<T> all = collectOrdered();
        Collections.shuffle(all, new Random(seed));
        return new ArrayList<>(all.subList(0, Math.min(n, all.size())));
    }

    @Override
    public T first() {
        for (List<T> partition : partitions)
            if (!partition.isEmpty())
                return partition.get(0);
        return null;
    }

    @Override
    public long count() {
        long n = 0;
        for (List<T> partition : partitions)
            n += partition.size();
        return n;
    }

    @Override
    public int getNumPartitions() {
        return partitions.size();
    }

    public SeriesContext getContext() {
        return context;
    }
}
