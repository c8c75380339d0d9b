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

import org.apache.log4j.Logger;

import fr.cirad.series.config.ZeroVariancePolicy;
import fr.cirad.series.exceptions.DegenerateVarianceException;
import fr.cirad.series.rdd.Series;
import fr.cirad.series.stats.Axis;
import fr.cirad.series.stats.ColumnStatistics;
import fr.cirad.series.stats.StatCounter;

/**
 * Centering and/or scaling along one axis.
 *
 * Within a record the mean and population deviation of that record are used.
 * Across records, a blocking aggregate first computes per-position means and sample deviations,
 * which are then applied by a map. A zero or undefined deviation is handled according to the
 * series' {@link ZeroVariancePolicy}.
 */
public class Standardizer {

    static private final Logger LOG = Logger.getLogger(Standardizer.class);

    private final Axis axis;
    private final boolean subtractMean;
    private final boolean divideByStdev;

    public Standardizer(Axis axis, boolean subtractMean, boolean divideByStdev) {
        this.axis = axis;
        this.subtractMean = subtractMean;
        this.divideByStdev = divideByStdev;
    }

    public Series apply(Series series) {
        final ZeroVariancePolicy policy = series.getConfig().getZeroVariancePolicy();
        final double epsilon = series.getConfig().getZeroVarianceEpsilon();

        if (axis == Axis.WITHIN_RECORD)
            return series.mapValues(r -> {
                double[] x = r.getValues();
                if (x.length == 0)
                    return x;
                StatCounter counter = StatCounter.of(x);
                double mean = subtractMean ? counter.mean() : 0;
                double divisor = divideByStdev ? divisor(counter.stdev(), policy, epsilon, "record " + r.getKey()) : 1;
                for (int i = 0; i < x.length; i++)
                    x[i] = (x[i] - mean) / divisor;
                return x;
            }, series.getIndex());

        long before = System.currentTimeMillis();
        ColumnStatistics stats = series.columnStatistics();
        if (stats.count() == 0)
            return series.mapValues(r -> r.getValues(), series.getIndex());
        int n = series.getIndex().size();
        final double[] means = subtractMean ? stats.means() : new double[n];
        final double[] divisors = new double[n];
        double[] stdevs = divideByStdev ? stats.sampleStdevs() : null;
        int substituted = 0;
        for (int c = 0; c < n; c++) {
            if (!divideByStdev)
                divisors[c] = 1;
            else {
                divisors[c] = divisor(stdevs[c], policy, epsilon, "index position " + c + " (" + series.getIndex().get(c) + ")");
                if (divisors[c] != stdevs[c])
                    substituted++;
            }
        }
        if (substituted > 0)
            LOG.warn("Substituted epsilon " + epsilon + " for " + substituted + " zero standard deviation(s) across " + stats.count() + " records");
        LOG.debug("Across-record statistics for " + stats.count() + " records computed in " + (System.currentTimeMillis() - before) / 1000d + "s");

        return series.mapValues(r -> {
            double[] x = r.getValues();
            for (int c = 0; c < x.length; c++)
                x[c] = (x[c] - means[c]) / divisors[c];
            return x;
        }, series.getIndex());
    }

    private static double divisor(double stdev, ZeroVariancePolicy policy, double epsilon, String where) {
        if (stdev > 0)
            return stdev;
        if (policy == ZeroVariancePolicy.EPSILON)
            return epsilon;
        throw new DegenerateVarianceException("Standard deviation is " + stdev + " for " + where + ", cannot scale");
    }
}
