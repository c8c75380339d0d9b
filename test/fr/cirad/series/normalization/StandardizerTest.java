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
package fr.cirad.series.normalization;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import fr.cirad.series.config.EngineConfig;
import fr.cirad.series.config.ZeroVariancePolicy;
import fr.cirad.series.exceptions.DegenerateVarianceException;
import fr.cirad.series.model.RecordKey;
import fr.cirad.series.model.SeriesRecord;
import fr.cirad.series.parallel.SeriesContext;
import fr.cirad.series.rdd.Series;
import fr.cirad.series.stats.Axis;

public class StandardizerTest {

    private SeriesContext context;

    @Before
    public void setUp() {
        context = new SeriesContext(EngineConfig.getDefault().with(EngineConfig.THREADS, 3));
    }

    @After
    public void tearDown() {
        context.close();
    }

    private Series randomSeries(int rows, int cols, long seed, int partitions) {
        Random rng = new Random(seed);
        List<SeriesRecord> records = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            double[] x = new double[cols];
            for (int c = 0; c < cols; c++)
                x[c] = rng.nextGaussian() * (c + 1) + 10 * c;
            records.add(new SeriesRecord(RecordKey.linear(r + 1), x));
        }
        return Series.of(context.parallelize(records, partitions), null, context.getConfig());
    }

    @Test
    public void testAcrossRecordZscoreHasZeroMeanUnitSampleVariance() {
        List<double[]> z = randomSeries(50, 4, 3, 5).zscore(Axis.ACROSS_RECORDS).values();
        for (int c = 0; c < 4; c++) {
            double mean = 0;
            for (double[] row : z)
                mean += row[c] / z.size();
            double sq = 0;
            for (double[] row : z)
                sq += (row[c] - mean) * (row[c] - mean);
            assertEquals(0, mean, 1e-9);
            assertEquals(1, sq / (z.size() - 1), 1e-9);
        }
    }

    @Test
    public void testResultsDoNotDependOnPartitioning() {
        List<double[]> onePartition = randomSeries(40, 3, 11, 1).zscore(1).values();
        List<double[]> manyPartitions = randomSeries(40, 3, 11, 7).zscore(1).values();
        assertEquals(onePartition.size(), manyPartitions.size());
        for (int i = 0; i < onePartition.size(); i++)
            assertArrayEquals(onePartition.get(i), manyPartitions.get(i), 1e-9);
    }

    @Test(expected = DegenerateVarianceException.class)
    public void testConstantRecordFailsByDefault() {
        Series.fromRecords(context, Arrays.asList(new SeriesRecord(RecordKey.linear(1), new double[] {2, 2, 2}))).zscore(0);
    }

    @Test(expected = DegenerateVarianceException.class)
    public void testConstantColumnFailsByDefault() {
        Series.fromRecords(context, Arrays.asList(new SeriesRecord(RecordKey.linear(1), new double[] {1, 5}),
                new SeriesRecord(RecordKey.linear(2), new double[] {2, 5}))).standardize(1);
    }

    @Test(expected = DegenerateVarianceException.class)
    public void testSingleRecordAcrossRecordsIsDegenerate() {
        Series.fromRecords(context, Arrays.asList(new SeriesRecord(RecordKey.linear(1), new double[] {1, 5}))).zscore(1);
    }

    @Test
    public void testCenteringNeverNeedsVariance() {
        Series s = Series.fromRecords(context, Arrays.asList(new SeriesRecord(RecordKey.linear(1), new double[] {2, 2, 2})));
        assertArrayEquals(new double[3], s.center(0).values().get(0), 0);
        assertArrayEquals(new double[3], s.center(1).values().get(0), 0);
    }

    @Test
    public void testEpsilonPolicy() {
        EngineConfig config = context.getConfig().with(EngineConfig.ZERO_VARIANCE_POLICY, ZeroVariancePolicy.EPSILON).with(EngineConfig.ZERO_VARIANCE_EPSILON, 0.5);
        Series s = Series.fromRecords(context, Arrays.asList(new SeriesRecord(RecordKey.linear(1), new double[] {1, 5}),
                new SeriesRecord(RecordKey.linear(2), new double[] {3, 5}))).withConfig(config);
        List<double[]> z = s.zscore(1).values();
        assertArrayEquals(new double[] {-0.70710, 0}, z.get(0), 1e-4);
        assertArrayEquals(new double[] {0.70710, 0}, z.get(1), 1e-4);

        double[] standardized = s.standardize(1).values().get(0);
        assertEquals(10, standardized[1], 1e-9);
        assertTrue(standardized[0] > 0);
    }

    @Test
    public void testEmptySeriesAcrossRecords() {
        Series empty = Series.fromRecords(context, new ArrayList<SeriesRecord>());
        assertEquals(0, empty.zscore(1).count());
    }
}
