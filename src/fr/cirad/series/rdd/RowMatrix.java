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

import java.util.Arrays;

import fr.cirad.series.exceptions.ShapeMismatchException;
import fr.cirad.series.model.Index;
import fr.cirad.series.model.SeriesRecord;
import fr.cirad.series.parallel.ParallelCollection;
import fr.cirad.series.stats.Axis;

/**
 * A series seen as a matrix with one row per record (nrows = record count, ncols = index length).
 * Shares the records of the series it was built from; matrix operations return new matrices.
 */
public class RowMatrix extends Series {

    public RowMatrix(Series series) {
        super(series);
    }

    @Override
    protected Series newInstance(ParallelCollection<SeriesRecord> newRecords, Index newIndex) {
        return new RowMatrix(new Series(newRecords, newIndex, config));
    }

    public long nrows() {
        return count();
    }

    public int ncols() {
        return index.size();
    }

    @Override
    public RowMatrix center(int axis) {
        return (RowMatrix) super.center(axis);
    }

    @Override
    public RowMatrix center(Axis axis) {
        return (RowMatrix) super.center(axis);
    }

    @Override
    public RowMatrix toRowMatrix() {
        return this;
    }

    /**
     * @return AᵀA (ncols x ncols), summed over partitions
     */
    public double[][] gramian() {
        final int n = ncols();
        double[] flat = records.aggregate(() -> new double[n * n], (acc, r) -> {
            double[] x = r.getValues();
            for (int i = 0; i < n; i++) {
                double xi = x[i];
                if (xi == 0)
                    continue;
                int base = i * n;
                for (int j = i; j < n; j++)
                    acc[base + j] += xi * x[j];
            }
            return acc;
        }, (a, b) -> {
            for (int i = 0; i < a.length; i++)
                a[i] += b[i];
            return a;
        });

        double[][] gram = new double[n][n];
        for (int i = 0; i < n; i++)
            for (int j = i; j < n; j++) {
                gram[i][j] = flat[i * n + j];
                gram[j][i] = gram[i][j];
            }
        return gram;
    }

    /**
     * Sample covariance of the columns (ddof = 1). NaN everywhere with fewer than two rows.
     */
    public double[][] covariance() {
        long rows = nrows();
        int n = ncols();
        if (rows < 2) {
            double[][] nan = new double[n][n];
            for (double[] row : nan)
                Arrays.fill(row, Double.NaN);
            return nan;
        }
        double[][] cov = center(Axis.ACROSS_RECORDS).gramian();
        for (double[] row : cov)
            for (int j = 0; j < row.length; j++)
                row[j] /= rows - 1;
        return cov;
    }

    /**
     * Right-multiplies every row by other (ncols x m).
     *
     * @return a matrix with the same keys and m columns
     */
    public RowMatrix times(final double[][] other) {
        final int n = ncols();
        if (other.length != n)
            throw new ShapeMismatchException("Cannot multiply a matrix with " + n + " columns by one with " + other.length + " rows");
        final int m = n == 0 ? 0 : other[0].length;
        for (double[] row : other)
            if (row.length != m)
                throw new ShapeMismatchException("Right-hand matrix rows have differing lengths");

        return (RowMatrix) mapValues(r -> {
            double[] x = r.getValues();
            double[] out = new double[m];
            for (int i = 0; i < n; i++) {
                double xi = x[i];
                if (xi == 0)
                    continue;
                double[] otherRow = other[i];
                for (int j = 0; j < m; j++)
                    out[j] += xi * otherRow[j];
            }
            return out;
        }, Index.identity(m));
    }
}
