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
package fr.cirad.series.stats;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import fr.cirad.series.exceptions.ShapeMismatchException;
import fr.cirad.series.exceptions.UnknownStatisticException;

public class StatCounterTest {

    @Test
    public void testPopulationStatistics() {
        StatCounter counter = StatCounter.of(new double[] {1, 2, 3, 4, 5});
        assertEquals(5, counter.count());
        assertEquals(15, counter.sum(), 1e-12);
        assertEquals(3, counter.mean(), 1e-12);
        assertEquals(2, counter.variance(), 1e-12);
        assertEquals(Math.sqrt(2), counter.stdev(), 1e-12);
        assertEquals(2.5, counter.sampleVariance(), 1e-12);
        assertEquals(1, counter.min(), 0);
        assertEquals(5, counter.max(), 0);
    }

    @Test
    public void testMergeMatchesSinglePass() {
        StatCounter left = StatCounter.of(new double[] {1, 2, 3});
        StatCounter right = StatCounter.of(new double[] {10, -4});
        StatCounter all = StatCounter.of(new double[] {1, 2, 3, 10, -4});
        left.merge(right);
        assertEquals(all.count(), left.count());
        assertEquals(all.mean(), left.mean(), 1e-12);
        assertEquals(all.variance(), left.variance(), 1e-12);
        assertEquals(-4, left.min(), 0);
        assertEquals(10, left.max(), 0);
        assertEquals(all.mean(), left.merge(new StatCounter()).mean(), 1e-12);
    }

    @Test
    public void testEmptyCounter() {
        StatCounter counter = new StatCounter();
        assertEquals(0, counter.count());
        assertEquals(0, counter.sum(), 0);
        assertTrue(Double.isNaN(counter.mean()));
        assertTrue(Double.isNaN(counter.stdev()));
        assertTrue(Double.isNaN(counter.min()));
        assertTrue(Double.isNaN(Statistic.MAX.of(counter)));
        assertEquals(0, Statistic.COUNT.of(counter), 0);
    }

    @Test
    public void testStatisticNames() {
        assertEquals(Statistic.STDEV, Statistic.fromName("stdev"));
        assertEquals(7, Statistic.labels().size());
        assertEquals("mean", Statistic.labels().get(0));
    }

    @Test(expected = UnknownStatisticException.class)
    public void testUnknownStatisticName() {
        Statistic.fromName("mode");
    }

    @Test
    public void testColumnStatistics() {
        ColumnStatistics left = new ColumnStatistics().add(new double[] {1, 10}).add(new double[] {3, 10});
        ColumnStatistics right = new ColumnStatistics().add(new double[] {5, 40});
        ColumnStatistics merged = new ColumnStatistics().merge(left).merge(right);
        assertEquals(3, merged.count());
        assertArrayEquals(new double[] {3, 20}, merged.means(), 1e-12);
        assertArrayEquals(new double[] {2, Math.sqrt(300)}, merged.sampleStdevs(), 1e-9);
    }

    @Test(expected = ShapeMismatchException.class)
    public void testColumnStatisticsShapeMismatch() {
        new ColumnStatistics().add(new double[] {1, 2}).add(new double[] {1});
    }

    @Test
    public void testPercentiles() {
        double[] values = {5, 1, 4, 2, 3};
        assertEquals(1, Percentiles.linear(values, 0), 0);
        assertEquals(1.8, Percentiles.linear(values, 20), 1e-12);
        assertEquals(3, Percentiles.linear(values, 50), 1e-12);
        assertEquals(5, Percentiles.linear(values, 100), 1e-12);
        assertTrue(Double.isNaN(Percentiles.linear(new double[0], 50)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPercentileOutOfRange() {
        Percentiles.linear(new double[] {1}, -1);
    }

    @Test
    public void testAxis() {
        assertEquals(Axis.WITHIN_RECORD, Axis.of(0));
        assertEquals(Axis.ACROSS_RECORDS, Axis.of(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidAxis() {
        Axis.of(-1);
    }
}
