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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import fr.cirad.series.config.EngineConfig;
import fr.cirad.series.exceptions.ShapeMismatchException;
import fr.cirad.series.model.RecordKey;
import fr.cirad.series.model.SeriesRecord;
import fr.cirad.series.parallel.SeriesContext;
import fr.cirad.series.rdd.Series;

public class SubscriptQueryTest {

    private SeriesContext context;

    @Before
    public void setUp() {
        context = new SeriesContext(EngineConfig.getDefault().with(EngineConfig.THREADS, 2));
    }

    @After
    public void tearDown() {
        context.close();
    }

    private Series series(RecordKey... keys) {
        double[][] values = {{1, 2}, {3, 4}, {6, 0}};
        List<SeriesRecord> records = new ArrayList<>();
        for (int i = 0; i < keys.length; i++)
            records.add(new SeriesRecord(keys[i], values[i]));
        return Series.fromRecords(context, records);
    }

    @Test
    public void testQueryWithSubscriptKeys() {
        QueryResult result = series(RecordKey.of(1, 1), RecordKey.of(2, 1), RecordKey.of(1, 2)).query(new int[][] {{1, 2}, {3}});
        assertEquals(2, result.size());
        assertArrayEquals(new int[] {1, 2}, result.getKeys());
        assertArrayEquals(new double[] {2, 3}, result.getValues()[0], 1e-12);
        assertArrayEquals(new double[] {6, 0}, result.getValues()[1], 1e-12);
    }

    @Test
    public void testQueryWithLinearKeys() {
        QueryResult result = series(RecordKey.linear(1), RecordKey.linear(2), RecordKey.linear(3)).query(Arrays.asList(Arrays.asList(1, 2), Arrays.asList(3)));
        assertArrayEquals(new double[] {2, 3}, result.getGroup(1), 1e-12);
        assertArrayEquals(new double[] {6, 0}, result.getGroup(2), 1e-12);
    }

    @Test
    public void testSubscriptAndLinearKeysAgree() {
        int[][] groups = {{1, 3}, {2}};
        QueryResult subscripts = series(RecordKey.of(1, 1), RecordKey.of(2, 1), RecordKey.of(1, 2)).query(groups);
        QueryResult linear = series(RecordKey.linear(1), RecordKey.linear(2), RecordKey.linear(3)).query(groups);
        for (int g = 1; g <= 2; g++)
            assertArrayEquals(linear.getGroup(g), subscripts.getGroup(g), 1e-12);
    }

    @Test
    public void testMissingIndicesAreSkipped() {
        QueryResult result = series(RecordKey.linear(1), RecordKey.linear(2), RecordKey.linear(3)).query(new int[][] {{2, 42}});
        assertArrayEquals(new double[] {3, 4}, result.getGroup(1), 1e-12);
    }

    @Test
    public void testEmptyGroupIsNaN() {
        QueryResult result = series(RecordKey.linear(1), RecordKey.linear(2), RecordKey.linear(3)).query(new int[][] {{1}, {99}});
        assertArrayEquals(new double[] {1, 2}, result.getGroup(1), 1e-12);
        assertTrue(Double.isNaN(result.getGroup(2)[0]));
        assertTrue(Double.isNaN(result.getGroup(2)[1]));
    }

    @Test
    public void testDuplicateKeysAreAveraged() {
        QueryResult result = series(RecordKey.linear(1), RecordKey.linear(1), RecordKey.linear(2)).query(new int[][] {{1}});
        assertArrayEquals(new double[] {2, 3}, result.getGroup(1), 1e-12);
    }

    @Test
    public void testLinearIndexIsFastestVaryingFirst() {
        int[] extent = {2, 3, 4};
        assertEquals(1, SubscriptQuery.toLinearIndex(RecordKey.of(1, 1, 1), extent));
        assertEquals(2, SubscriptQuery.toLinearIndex(RecordKey.of(2, 1, 1), extent));
        assertEquals(3, SubscriptQuery.toLinearIndex(RecordKey.of(1, 2, 1), extent));
        assertEquals(7, SubscriptQuery.toLinearIndex(RecordKey.of(1, 1, 2), extent));
        assertEquals(24, SubscriptQuery.toLinearIndex(RecordKey.of(2, 3, 4), extent));
        assertEquals(5, SubscriptQuery.toLinearIndex(RecordKey.linear(5), new int[] {9}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroSubscriptIsRejected() {
        series(RecordKey.of(0, 1), RecordKey.of(2, 1)).query(new int[][] {{1}});
    }

    @Test(expected = ShapeMismatchException.class)
    public void testMixedDimensionsAreRejected() {
        series(RecordKey.of(1, 1), RecordKey.linear(2)).query(new int[][] {{1}});
    }

    @Test
    public void testExtentDiscovery() {
        Series s = series(RecordKey.of(1, 4), RecordKey.of(3, 1), RecordKey.of(2, 2));
        assertArrayEquals(new int[] {3, 4}, SubscriptQuery.discoverExtent(s.getRecords()));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testUnknownGroup() {
        series(RecordKey.linear(1)).query(new int[][] {{1}}).getGroup(2);
    }
}
