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
package fr.cirad.series.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import fr.cirad.series.exceptions.ShapeMismatchException;
import fr.cirad.series.model.RecordKey;
import fr.cirad.series.model.SeriesRecord;
import fr.cirad.series.parallel.ParallelCollection;
import fr.cirad.series.rdd.Series;

/**
 * Averages records by groups of linear indices.
 *
 * Multi-dimensional keys are read as 1-based subscripts and flattened with the first dimension varying
 * fastest, using the largest coordinate observed in each dimension as its extent:
 * ind = k0 + (k1 - 1) * d0 + (k2 - 1) * d0 * d1 + ...
 * Single-integer keys already are linear indices.
 *
 * Query indices that match no record are skipped. A group matching no record averages to NaN.
 */
public class SubscriptQuery {

    private final List<Set<Long>> groups;

    public SubscriptQuery(List<? extends Collection<Integer>> groups) {
        this.groups = new ArrayList<>(groups.size());
        for (Collection<Integer> group : groups) {
            if (group == null)
                throw new IllegalArgumentException("Query groups must not be null");
            Set<Long> indices = new LinkedHashSet<>();
            for (Integer i : group)
                indices.add(i.longValue());
            this.groups.add(indices);
        }
    }

    public QueryResult run(Series series) {
        ParallelCollection<SeriesRecord> records = series.getRecords();
        final int ncols = series.getIndex().size();
        final int groupCount = groups.size();

        final int[] extent = discoverExtent(records);

        final Map<Long, int[]> membership = new HashMap<>();
        for (int g = 0; g < groupCount; g++)
            for (Long ind : groups.get(g)) {
                int[] ids = membership.get(ind);
                ids = ids == null ? new int[] {g} : appendTo(ids, g);
                membership.put(ind, ids);
            }

        GroupSums sums = records.aggregate(() -> new GroupSums(groupCount, ncols), (acc, r) -> {
            int[] ids = membership.get(toLinearIndex(r.getKey(), extent));
            if (ids != null) {
                double[] x = r.getValues();
                for (int g : ids)
                    acc.add(g, x);
            }
            return acc;
        }, GroupSums::merge);

        return new QueryResult(sums.means());
    }

    /**
     * Largest coordinate in each key dimension (a reduce over all keys).
     *
     * @return an empty array for an empty collection
     * @throws ShapeMismatchException if keys do not all have the same number of dimensions
     */
    public static int[] discoverExtent(ParallelCollection<SeriesRecord> records) {
        return records.aggregate(() -> new int[0], (acc, r) -> maxOf(acc, r.getKey().getCoordinates()), SubscriptQuery::maxOf);
    }

    private static int[] maxOf(int[] a, int[] b) {
        if (a.length == 0)
            return b.clone();
        if (b.length == 0)
            return a;
        if (a.length != b.length)
            throw new ShapeMismatchException("Keys have differing dimension counts: " + a.length + " and " + b.length);
        for (int d = 0; d < a.length; d++)
            a[d] = Math.max(a[d], b[d]);
        return a;
    }

    /**
     * @return the 1-based linear index of the key within the given extent
     */
    public static long toLinearIndex(RecordKey key, int[] extent) {
        if (key.isLinear())
            return key.get(0);
        if (key.getDimensionCount() != extent.length)
            throw new ShapeMismatchException("Key " + key + " does not match extent " + Arrays.toString(extent));

        long ind = 0, stride = 1;
        for (int d = 0; d < extent.length; d++) {
            int k = key.get(d);
            if (k < 1)
                throw new IllegalArgumentException("Subscript keys are 1-based, got " + key);
            ind += (k - 1) * stride;
            stride *= extent[d];
        }
        return ind + 1;
    }

    private static int[] appendTo(int[] ids, int g) {
        int[] result = Arrays.copyOf(ids, ids.length + 1);
        result[ids.length] = g;
        return result;
    }

    private static class GroupSums {
        private final double[][] sums;
        private final long[] counts;

        GroupSums(int groupCount, int ncols) {
            sums = new double[groupCount][ncols];
            counts = new long[groupCount];
        }

        void add(int g, double[] x) {
            double[] s = sums[g];
            for (int c = 0; c < s.length; c++)
                s[c] += x[c];
            counts[g]++;
        }

        GroupSums merge(GroupSums other) {
            for (int g = 0; g < sums.length; g++) {
                for (int c = 0; c < sums[g].length; c++)
                    sums[g][c] += other.sums[g][c];
                counts[g] += other.counts[g];
            }
            return this;
        }

        double[][] means() {
            double[][] means = new double[sums.length][];
            for (int g = 0; g < sums.length; g++) {
                means[g] = new double[sums[g].length];
                for (int c = 0; c < means[g].length; c++)
                    means[g][c] = counts[g] == 0 ? Double.NaN : sums[g][c] / counts[g];
            }
            return means;
        }
    }
}
