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

/**
 * One-pass accumulator of count, sum, mean, variance, min and max (Welford's update).
 * Two counters can be merged, which makes it usable as a partition-level aggregate.
 */
public class StatCounter {

    private long count = 0;
    private double mean = 0;
    private double m2 = 0;
    private double sum = 0;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    public static StatCounter of(double[] values) {
        StatCounter counter = new StatCounter();
        for (double v : values)
            counter.add(v);
        return counter;
    }

    public StatCounter add(double x) {
        count++;
        double delta = x - mean;
        mean += delta / count;
        m2 += delta * (x - mean);
        sum += x;
        min = Math.min(min, x);
        max = Math.max(max, x);
        return this;
    }

    public StatCounter merge(StatCounter other) {
        if (other.count == 0)
            return this;
        if (count == 0) {
            count = other.count;
            mean = other.mean;
            m2 = other.m2;
            sum = other.sum;
            min = other.min;
            max = other.max;
            return this;
        }
        long n = count + other.count;
        double delta = other.mean - mean;
        mean += delta * other.count / n;
        m2 += other.m2 + delta * delta * count * other.count / n;
        count = n;
        sum += other.sum;
        min = Math.min(min, other.min);
        max = Math.max(max, other.max);
        return this;
    }

    public long count() {
        return count;
    }

    public double sum() {
        return sum;
    }

    public double mean() {
        return count == 0 ? Double.NaN : mean;
    }

    /**
     * Population variance (denominator n).
     */
    public double variance() {
        return count == 0 ? Double.NaN : m2 / count;
    }

    /**
     * Population standard deviation (denominator n).
     */
    public double stdev() {
        return Math.sqrt(variance());
    }

    /**
     * Sample variance (denominator n - 1), NaN below two values.
     */
    public double sampleVariance() {
        return count < 2 ? Double.NaN : m2 / (count - 1);
    }

    public double sampleStdev() {
        return Math.sqrt(sampleVariance());
    }

    public double min() {
        return count == 0 ? Double.NaN : min;
    }

    public double max() {
        return count == 0 ? Double.NaN : max;
    }

    @Override
    public String toString() {
        return "(count: " + count + ", mean: " + mean() + ", stdev: " + stdev() + ", min: " + min() + ", max: " + max() + ")";
    }
}
