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

import fr.cirad.series.exceptions.ShapeMismatchException;

/**
 * Per-position mean and M2 accumulated over many vectors of the same length.
 * Used as the reduce phase of across-record (axis 1) operations.
 */
public class ColumnStatistics {

    private long count = 0;
    private double[] means;
    private double[] m2;

    public ColumnStatistics add(double[] row) {
        if (means == null) {
            means = new double[row.length];
            m2 = new double[row.length];
        }
        else if (row.length != means.length)
            throw new ShapeMismatchException("Cannot accumulate a vector of length " + row.length + " with vectors of length " + means.length);

        count++;
        for (int c = 0; c < row.length; c++) {
            double delta = row[c] - means[c];
            means[c] += delta / count;
            m2[c] += delta * (row[c] - means[c]);
        }
        return this;
    }

    public ColumnStatistics merge(ColumnStatistics other) {
        if (other.count == 0)
            return this;
        if (count == 0) {
            count = other.count;
            means = other.means.clone();
            m2 = other.m2.clone();
            return this;
        }
        if (other.means.length != means.length)
            throw new ShapeMismatchException("Cannot merge column statistics of " + other.means.length + " and " + means.length + " positions");

        long n = count + other.count;
        for (int c = 0; c < means.length; c++) {
            double delta = other.means[c] - means[c];
            means[c] += delta * other.count / n;
            m2[c] += other.m2[c] + delta * delta * count * other.count / n;
        }
        count = n;
        return this;
    }

    public long count() {
        return count;
    }

    public double[] means() {
        return means == null ? new double[0] : means.clone();
    }

    /**
     * @return sample standard deviations (ddof = 1), NaN everywhere when fewer than two vectors were seen
     */
    public double[] sampleStdevs() {
        if (means == null)
            return new double[0];
        double[] result = new double[means.length];
        for (int c = 0; c < result.length; c++)
            result[c] = count < 2 ? Double.NaN : Math.sqrt(m2[c] / (count - 1));
        return result;
    }
}
