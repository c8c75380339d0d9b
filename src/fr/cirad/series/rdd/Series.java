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
package fr.cirad.series.rdd;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import org.apache.log4j.Logger;

import fr.cirad.series.config.EngineConfig;
import fr.cirad.series.exceptions.EmptySelectionException;
import fr.cirad.series.exceptions.LabelNotFoundException;
import fr.cirad.series.exceptions.ShapeMismatchException;
import fr.cirad.series.model.Index;
import fr.cirad.series.model.RecordKey;
import fr.cirad.series.model.SeriesRecord;
import fr.cirad.series.normalization.DetrendMethod;
import fr.cirad.series.normalization.NormalizationMethod;
import fr.cirad.series.normalization.Standardizer;
import fr.cirad.series.parallel.ParallelCollection;
import fr.cirad.series.parallel.SeriesContext;
import fr.cirad.series.query.QueryResult;
import fr.cirad.series.query.SubscriptQuery;
import fr.cirad.series.stats.Axis;
import fr.cirad.series.stats.ColumnStatistics;
import fr.cirad.series.stats.Percentiles;
import fr.cirad.series.stats.StatCounter;
import fr.cirad.series.stats.Statistic;

/**
 * A distributed collection of (key, vector) records sharing one {@link Index}.
 *
 * A Series is never modified: every transform runs as a partition-parallel map
 * (preceded, for across-record operations, by one blocking aggregate) and returns a new Series
 * of the same kind, so a {@link TimeSeries} transform yields a TimeSeries.
 *
 * @author sempere
 */
public class Series {

    static private final Logger LOG = Logger.getLogger(Series.class);

    protected final ParallelCollection<SeriesRecord> records;
    protected final Index index;
    protected final EngineConfig config;

    /**
     * Wraps records whose vectors are already known to match the index.
     */
    protected Series(ParallelCollection<SeriesRecord> records, Index index, EngineConfig config) {
        this.records = records;
        this.index = index;
        this.config = config;
    }

    /**
     * Shares the records, index and configuration of another series.
     */
    protected Series(Series source) {
        this(source.records, source.index, source.config);
    }

    /**
     * Wraps records with the default index 0..n-1, n being the length of the first record.
     */
    public static Series of(ParallelCollection<SeriesRecord> records) {
        return of(records, null, EngineConfig.getDefault());
    }

    public static Series of(ParallelCollection<SeriesRecord> records, Index index) {
        return of(records, index, EngineConfig.getDefault());
    }

    /**
     * @param index may be null to use the default index
     * @throws ShapeMismatchException if any record's length differs from the index's
     */
    public static Series of(ParallelCollection<SeriesRecord> records, Index index, EngineConfig config) {
        if (index == null) {
            SeriesRecord first = records.first();
            index = Index.identity(first == null ? 0 : first.size());
        }
        checkShape(records, index.size());
        return new Series(records, index, config);
    }

    public static Series fromRecords(SeriesContext context, List<SeriesRecord> records) {
        return of(context.parallelize(records), null, context.getConfig());
    }

    public static Series fromRecords(SeriesContext context, List<SeriesRecord> records, Index index) {
        return of(context.parallelize(records), index, context.getConfig());
    }

    private static void checkShape(ParallelCollection<SeriesRecord> records, final int expected) {
        records.aggregate(() -> Boolean.TRUE, (ok, r) -> {
            if (r.size() != expected)
                throw new ShapeMismatchException(expected, r.size(), r.getKey());
            return ok;
        }, (a, b) -> a);
    }

    /**
     * Builds an instance of this same kind around transformed records.
     */
    protected Series newInstance(ParallelCollection<SeriesRecord> newRecords, Index newIndex) {
        return new Series(newRecords, newIndex, config);
    }

    public ParallelCollection<SeriesRecord> getRecords() {
        return records;
    }

    public Index getIndex() {
        return index;
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * @return the same records and index, governed by another configuration
     */
    public Series withConfig(EngineConfig newConfig) {
        return new Series(records, index, newConfig).retag(this);
    }

    /**
     * Keeps the runtime kind of the given series when re-wrapping its records.
     */
    private Series retag(Series original) {
        if (original instanceof RowMatrix)
            return new RowMatrix(this);
        if (original instanceof TimeSeries)
            return new TimeSeries(this);
        return this;
    }

    public long count() {
        return records.count();
    }

    public SeriesRecord first() {
        return records.first();
    }

    public List<SeriesRecord> collect() {
        return records.collectOrdered();
    }

    public List<RecordKey> keys() {
        List<RecordKey> keys = new ArrayList<>();
        for (SeriesRecord r : records.collectOrdered())
            keys.add(r.getKey());
        return keys;
    }

    public List<double[]> values() {
        List<double[]> values = new ArrayList<>();
        for (SeriesRecord r : records.collectOrdered())
            values.add(r.getValues());
        return values;
    }

    public List<SeriesRecord> takeSample(int n, long seed) {
        return records.sample(n, seed);
    }

    /**
     * Maps every record to a new vector of newIndex.size() values.
     *
     * @throws ShapeMismatchException if fn returns a vector of another length
     */
    public Series mapValues(Function<SeriesRecord, double[]> fn, Index newIndex) {
        final int expected = newIndex.size();
        ParallelCollection<SeriesRecord> mapped = records.map(r -> {
            double[] out = fn.apply(r);
            if (out.length != expected)
                throw new ShapeMismatchException(expected, out.length, r.getKey());
            return r.withValues(out);
        });
        return newInstance(mapped, newIndex);
    }

    /**
     * Applies a length-preserving function to every vector.
     */
    public Series apply(UnaryOperator<double[]> fn) {
        return mapValues(r -> fn.apply(r.getValues()), index);
    }

    /**
     * Applies a function that may change the vector length, together with the index describing its output.
     */
    public Series applyValues(UnaryOperator<double[]> fn, Index newIndex) {
        return mapValues(r -> fn.apply(r.getValues()), newIndex);
    }

    /* ----------------------------------------------------------------------
     * selection
     * ---------------------------------------------------------------------- */

    /**
     * Keeps the positions whose label lies within [lower, upper].
     *
     * @throws EmptySelectionException if no label does
     */
    public Series between(Object lower, Object upper) {
        int[] positions = index.positionsBetween(lower, upper);
        if (positions.length == 0)
            throw new EmptySelectionException(lower, upper);
        return slice(positions);
    }

    /**
     * Selects by one label, or by a list of labels (concatenated in request order).
     * select(x) and select(List.of(x)) give the same result.
     *
     * @throws LabelNotFoundException for a label absent from the index
     */
    public Series select(Object labels) {
        if (labels instanceof List)
            return select((List<?>) labels);
        return select(Collections.singletonList(labels));
    }

    public Series select(List<?> labels) {
        if (labels.isEmpty())
            throw new IllegalArgumentException("At least one label must be selected");
        int[] positions = new int[labels.size()];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = index.positionOf(labels.get(i));
            if (positions[i] < 0)
                throw new LabelNotFoundException(labels.get(i));
        }
        return slice(positions);
    }

    private Series slice(final int[] positions) {
        return mapValues(r -> {
            double[] out = new double[positions.length];
            for (int i = 0; i < positions.length; i++)
                out[i] = r.get(positions[i]);
            return out;
        }, index.subset(positions));
    }

    /* ----------------------------------------------------------------------
     * per-record statistics
     * ---------------------------------------------------------------------- */

    public Series seriesMean() {
        return seriesStat(Statistic.MEAN);
    }

    public Series seriesSum() {
        return seriesStat(Statistic.SUM);
    }

    public Series seriesStdev() {
        return seriesStat(Statistic.STDEV);
    }

    public Series seriesVariance() {
        return seriesStat(Statistic.VARIANCE);
    }

    public Series seriesCount() {
        return seriesStat(Statistic.COUNT);
    }

    public Series seriesMin() {
        return seriesStat(Statistic.MIN);
    }

    public Series seriesMax() {
        return seriesStat(Statistic.MAX);
    }

    public Series seriesStat(String name) {
        return seriesStat(Statistic.fromName(name));
    }

    public Series seriesStat(final Statistic stat) {
        return mapValues(r -> new double[] {stat.of(StatCounter.of(r.getValues()))}, Index.of(stat.getLabel()));
    }

    /**
     * Every supported statistic, computed in a single pass over each record.
     * The index holds the statistic names, so that select("mean") retrieves one of them.
     */
    public Series seriesStats() {
        final Statistic[] stats = Statistic.values();
        return mapValues(r -> {
            StatCounter counter = StatCounter.of(r.getValues());
            double[] out = new double[stats.length];
            for (int i = 0; i < stats.length; i++)
                out[i] = stats[i].of(counter);
            return out;
        }, Index.of(Statistic.labels()));
    }

    /**
     * @param q percentile within [0, 100], linearly interpolated
     */
    public Series seriesPercentile(double q) {
        return percentileSeries(q, "percentile");
    }

    public Series seriesMedian() {
        return percentileSeries(50, "median");
    }

    private Series percentileSeries(final double q, String label) {
        if (Double.isNaN(q) || q < 0 || q > 100)
            throw new IllegalArgumentException("Percentile must lie within [0, 100], got " + q);
        return mapValues(r -> new double[] {Percentiles.linear(r.getValues(), q)}, Index.of(label));
    }

    /**
     * Per-position mean and sample deviation over all records (one blocking aggregate).
     */
    public ColumnStatistics columnStatistics() {
        return records.aggregate(ColumnStatistics::new, (acc, r) -> acc.add(r.getValues()), ColumnStatistics::merge);
    }

    /* ----------------------------------------------------------------------
     * centering / standardization
     * ---------------------------------------------------------------------- */

    public Series center(int axis) {
        return center(Axis.of(axis));
    }

    public Series center(Axis axis) {
        return new Standardizer(axis, true, false).apply(this);
    }

    /**
     * Divides the original values by the standard deviation of the given axis.
     */
    public Series standardize(int axis) {
        return standardize(Axis.of(axis));
    }

    public Series standardize(Axis axis) {
        return new Standardizer(axis, false, true).apply(this);
    }

    public Series zscore(int axis) {
        return zscore(Axis.of(axis));
    }

    public Series zscore(Axis axis) {
        return new Standardizer(axis, true, true).apply(this);
    }

    /* ----------------------------------------------------------------------
     * normalization / detrending
     * ---------------------------------------------------------------------- */

    /**
     * Percentile normalization with the configured percentile and offset.
     */
    public Series normalize() {
        return normalize(NormalizationMethod.PERCENTILE, config.getNormalizePercentile(), config.getNormalizeOffset());
    }

    public Series normalize(String method) {
        return normalize(NormalizationMethod.fromName(method), config.getNormalizePercentile(), config.getNormalizeOffset());
    }

    public Series normalize(String method, double percentile, double offset) {
        return normalize(NormalizationMethod.fromName(method), percentile, offset);
    }

    /**
     * Rescales each record as (x - baseline) / (baseline + offset).
     */
    public Series normalize(final NormalizationMethod method, final double percentile, final double offset) {
        if (method == NormalizationMethod.PERCENTILE && (Double.isNaN(percentile) || percentile < 0 || percentile > 100))
            throw new IllegalArgumentException("Percentile must lie within [0, 100], got " + percentile);
        return mapValues(r -> method.normalize(r.getValues(), percentile, offset), index);
    }

    public Series detrend() {
        return detrend(DetrendMethod.LINEAR);
    }

    public Series detrend(String method) {
        return detrend(DetrendMethod.fromName(method));
    }

    public Series detrend(final DetrendMethod method) {
        return mapValues(r -> method.detrend(r.getValues()), index);
    }

    /* ----------------------------------------------------------------------
     * subscript queries
     * ---------------------------------------------------------------------- */

    /**
     * Averages, for each group of 1-based linear indices, the records whose key maps into the group.
     *
     * @see SubscriptQuery
     */
    public QueryResult query(List<? extends Collection<Integer>> groups) {
        long before = System.currentTimeMillis();
        QueryResult result = new SubscriptQuery(groups).run(this);
        LOG.debug("Query over " + groups.size() + " groups done in " + (System.currentTimeMillis() - before) / 1000d + "s");
        return result;
    }

    public QueryResult query(int[][] groups) {
        List<List<Integer>> asLists = new ArrayList<>(groups.length);
        for (int[] group : groups) {
            List<Integer> list = new ArrayList<>(group.length);
            for (int i : group)
                list.add(i);
            asLists.add(list);
        }
        return query(asLists);
    }

    /* ----------------------------------------------------------------------
     * conversions
     * ---------------------------------------------------------------------- */

    /**
     * Views the records as matrix rows, without copying them.
     */
    public RowMatrix toRowMatrix() {
        return new RowMatrix(this);
    }

    public TimeSeries toTimeSeries() {
        return new TimeSeries(this);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " (" + records.getNumPartitions() + " partitions, index " + index + ")";
    }
}
