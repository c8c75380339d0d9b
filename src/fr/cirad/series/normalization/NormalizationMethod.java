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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.StringUtils;

import fr.cirad.series.exceptions.UnsupportedMethodException;
import fr.cirad.series.stats.Percentiles;
import fr.cirad.series.stats.StatCounter;

/**
 * How the per-record baseline of a normalization is obtained.
 * The record is then rescaled as (x - baseline) / (baseline + offset).
 */
public enum NormalizationMethod {

    PERCENTILE("percentile") {
        @Override
        public double baseline(double[] values, double percentile) {
            return Percentiles.linear(values, percentile);
        }
    },
    MEAN("mean") {
        @Override
        public double baseline(double[] values, double percentile) {
            return StatCounter.of(values).mean();
        }
    };

    private final String label;

    NormalizationMethod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @param percentile only used by PERCENTILE
     */
    public abstract double baseline(double[] values, double percentile);

    public double[] normalize(double[] values, double percentile, double offset) {
        double baseline = baseline(values, percentile);
        double denominator = baseline + offset;
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++)
            result[i] = (values[i] - baseline) / denominator;
        return result;
    }

    public static NormalizationMethod fromName(String name) {
        List<String> labels = new ArrayList<>();
        for (NormalizationMethod method : values()) {
            if (name != null && method.label.equalsIgnoreCase(name.trim()))
                return method;
            labels.add(method.label);
        }
        throw new UnsupportedMethodException("normalization", name, StringUtils.join(labels, ", "));
    }
}
