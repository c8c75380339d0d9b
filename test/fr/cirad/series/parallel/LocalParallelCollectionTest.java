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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import fr.cirad.series.config.EngineConfig;
import fr.cirad.series.exceptions.LabelNotFoundException;

public class LocalParallelCollectionTest {

    private SeriesContext context;
    private List<Integer> data;

    @Before
    public void setUp() {
        context = new SeriesContext(EngineConfig.getDefault().with(EngineConfig.THREADS, 4));
        data = new ArrayList<>();
        for (int i = 1; i <= 100; i++)
            data.add(i);
    }

    @After
    public void tearDown() {
        context.close();
        assertTrue(context.isClosed());
    }

    @Test
    public void testPartitioning() {
        assertEquals(7, context.parallelize(data, 7).getNumPartitions());
        assertEquals(3, context.parallelize(Arrays.asList(1, 2, 3), 10).getNumPartitions());
        assertEquals(4, context.parallelize(data).getNumPartitions());
        assertEquals(1, context.parallelize(new ArrayList<Integer>(), 5).getNumPartitions());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPartitionCountMustBePositive() {
        context.parallelize(data, 0);
    }

    @Test
    public void testMapPreservesOrder() {
        List<Integer> squares = context.parallelize(data, 6).map(i -> i * i).collectOrdered();
        assertEquals(100, squares.size());
        for (int i = 0; i < squares.size(); i++)
            assertEquals((i + 1) * (i + 1), (int) squares.get(i));
    }

    @Test
    public void testAggregateIsPartitionInvariant() {
        for (int partitions = 1; partitions <= 12; partitions++) {
            long sum = context.parallelize(data, partitions).aggregate(() -> 0L, (acc, i) -> acc + i, Long::sum);
            assertEquals(5050, sum);
        }
    }

    @Test
    public void testReduce() {
        assertEquals(100, (int) context.parallelize(data, 5).reduce(Integer::max));
        assertNull(context.parallelize(new ArrayList<Integer>(), 3).reduce(Integer::max));
    }

    @Test
    public void testFirstAndCount() {
        ParallelCollection<Integer> collection = context.parallelize(data, 9);
        assertEquals(1, (int) collection.first());
        assertEquals(100, collection.count());
        assertNull(context.parallelize(new ArrayList<Integer>()).first());
    }

    @Test
    public void testSample() {
        ParallelCollection<Integer> collection = context.parallelize(data, 3);
        List<Integer> sample = collection.sample(10, 5);
        assertEquals(10, sample.size());
        assertEquals(10, new HashSet<>(sample).size());
        assertEquals(sample, collection.sample(10, 5));
        assertEquals(100, collection.sample(1000, 5).size());
    }

    @Test
    public void testEngineErrorsAreRethrownUnwrapped() {
        final LabelNotFoundException error = new LabelNotFoundException("x");
        try {
            context.parallelize(data, 4).map(i -> {
                if (i == 77)
                    throw error;
                return i;
            });
            fail("Expected LabelNotFoundException");
        }
        catch (LabelNotFoundException lnfe) {
            assertSame(error, lnfe);
        }
    }

    @Test
    public void testContextThreadCount() {
        assertEquals(4, context.getThreadCount());
    }
}
