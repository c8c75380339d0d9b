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
package fr.cirad.series.factorization;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import fr.cirad.series.config.EngineConfig;
import fr.cirad.series.model.RecordKey;
import fr.cirad.series.model.SeriesRecord;
import fr.cirad.series.parallel.SeriesContext;
import fr.cirad.series.rdd.Series;
import fr.cirad.series.stats.Axis;

public class PCATest {

    private SeriesContext context;
    private Series data;

    @Before
    public void setUp() {
        context = new SeriesContext(EngineConfig.getDefault().with(EngineConfig.THREADS, 2));
        List<SeriesRecord> records = SVDTest.lowRankRecords(40, 0.2, 11);
        // shift every column so that centering matters
        for (int i = 0; i < records.size(); i++) {
            double[] x = records.get(i).getValues();
            for (int c = 0; c < x.length; c++)
                x[c] += 100 + c;
            records.set(i, records.get(i).withValues(x));
        }
        data = Series.fromRecords(context, records);
    }

    @After
    public void tearDown() {
        context.close();
    }

    @Test
    public void testDefaults() {
        PCA pca = new PCA().fit(data);
        assertEquals(3, pca.getK());
        assertEquals(SVDMethod.DIRECT, pca.getSvdMethod());
        assertEquals(3, pca.getLatent().length);
        assertEquals(3, pca.getComps().length);
        assertEquals(5, pca.getComps()[0].length);
        assertEquals(data.count(), pca.getScores().count());
        assertEquals(data.keys(), pca.getScores().keys());
    }

    @Test
    public void testEqualsSvdOfCenteredData() {
        PCA pca = new PCA(2).fit(data);
        FactorizationResult svd = new SVD(2).calc(data.toRowMatrix().center(Axis.ACROSS_RECORDS));
        assertArrayEquals(svd.getSingularValues(), pca.getLatent(), 1e-9);
        for (int i = 0; i < 2; i++)
            assertArrayEquals(svd.getComponents()[i], pca.getComps()[i], 1e-9);
    }

    @Test
    public void testScoresHaveZeroColumnMeans() {
        List<double[]> scores = new PCA(2).fit(data).getScores().values();
        for (int i = 0; i < 2; i++) {
            double mean = 0;
            for (double[] row : scores)
                mean += row[i] / scores.size();
            assertEquals(0, mean, 1e-9);
        }
    }

    @Test
    public void testComponentsAreOrthonormal() {
        double[][] comps = new PCA(3, "direct").fit(data).getComps();
        for (int i = 0; i < comps.length; i++)
            for (int j = 0; j < comps.length; j++) {
                double dot = 0;
                for (int c = 0; c < comps[i].length; c++)
                    dot += comps[i][c] * comps[j][c];
                assertEquals(i == j ? 1 : 0, dot, 1e-9);
            }
    }

    @Test
    public void testExpectationMaximizationPCA() {
        PCA direct = new PCA(2).fit(data);
        PCA em = new PCA(2, SVDMethod.EM).fit(data.withConfig(context.getConfig().with(EngineConfig.SVD_TOLERANCE, 1e-14).with(EngineConfig.SVD_MAX_ITERATIONS, 1000)));
        assertArrayEquals(direct.getLatent(), em.getLatent(), 1e-6 * direct.getLatent()[0]);
    }

    @Test
    public void testExpectationMaximizationWithFewerRecordsThanComponents() {
        Series small = Series.fromRecords(context, Arrays.asList(
                new SeriesRecord(RecordKey.linear(1), new double[] {1, 2, 3, 4, 5}),
                new SeriesRecord(RecordKey.linear(2), new double[] {2, 0, 1, 7, 3}),
                new SeriesRecord(RecordKey.linear(3), new double[] {5, 5, 1, 0, 2})));
        double[] direct = new PCA(3, "direct").fit(small).getLatent();
        PCA em = new PCA(3, "em").fit(small);
        double[] latent = em.getLatent();
        assertEquals(direct[0], latent[0], 1e-6 * direct[0]);
        assertEquals(direct[1], latent[1], 1e-6 * direct[0]);
        assertTrue(latent[2] < 1e-6 * latent[0]);
        for (double[] row : em.getScores().values())
            assertEquals(0, row[2], 0);
    }

    @Test(expected = IllegalStateException.class)
    public void testResultBeforeFit() {
        new PCA().getScores();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTooManyComponents() {
        new PCA(6).fit(data);
    }
}
