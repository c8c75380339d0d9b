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

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The only view the engine has of the partitioned execution substrate.
 *
 * Functions passed to {@link #map} must be stateless, and operators passed to {@link #aggregate}
 * must be associative and commutative: neither the partition count nor the order in which
 * partitions are processed may change a result.
 *
 * @param <T> element type
 */
public interface ParallelCollection<T> {

    /**
     * Applies fn to every element, partition by partition. Element order is preserved in the result.
     */
    <R> ParallelCollection<R> map(Function<? super T, ? extends R> fn);

    /**
     * Folds each partition into its own accumulator obtained from zero, then merges the accumulators.
     * Blocks until every partition has been folded.
     *
     * @param zero supplies a fresh, neutral accumulator for each partition
     * @param seqOp folds one element into an accumulator (may mutate and return it)
     * @param combOp merges two accumulators (may mutate and return the first one)
     */
    <A> A aggregate(Supplier<A> zero, BiFunction<A, ? super T, A> seqOp, BinaryOperator<A> combOp);

    /**
     * Materializes every element, in collection order.
     */
    List<T> collectOrdered();

    /**
     * Draws up to n distinct elements, uniformly and without replacement.
     */
    List<T> sample(int n, long seed);

    /**
     * @return the first element, or null if the collection is empty
     */
    T first();

    long count();

    int getNumPartitions();

    default T reduce(BinaryOperator<T> op) {
        Object[] holder = aggregate(() -> new Object[1], (acc, t) -> {
            @SuppressWarnings("unchecked") T current = (T) acc[0];
            acc[0] = current == null ? t : op.apply(current, t);
            return acc;
        }, (a, b) -> {
            @SuppressWarnings("unchecked") T left = (T) a[0];
            @SuppressWarnings("unchecked") T right = (T) b[0];
            a[0] = left == null ? right : (right == null ? left : op.apply(left, right));
            return a;
        });
        @SuppressWarnings("unchecked") T result = (T) holder[0];
        return result;
    }
}
