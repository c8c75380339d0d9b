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

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Percentiles with linear interpolation between closest ranks,
 * i.e. the value at position (n - 1) * q / 100 of the sorted vector.
 */
public final class Percentiles {

    private Percentiles() {
    }

    public static double linear(double[] values, double q) {
        if (Double.isNaN(q) || q < 0 || q > 100)
            throw new IllegalArgumentException("Percentile must lie within [0, 100], got " + q);
        if (values.length == 0)
            return Double.NaN;
        if (q == 0) {
            double min = Double.POSITIVE_INFINITY;
            for (double v : values)
                min = Math.min(min, v);
            return min;
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, q);
    }
}
