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
import org.apache.commons.math3.stat.regression.SimpleRegression;

import fr.cirad.series.exceptions.UnsupportedMethodException;

/**
 * Trend removal applied to each record independently, against positions 0..n-1.
 */
public enum DetrendMethod {

    LINEAR("linear") {
        @Override
        public double[] detrend(double[] values) {
            if (values.length == 0)
                return values.clone();
            if (values.length == 1)
                return new double[] {0};

            SimpleRegression regression = new SimpleRegression(true);
            for (int i = 0; i < values.length; i++)
                regression.addData(i, values[i]);
            double intercept = regression.getIntercept();
            double slope = regression.getSlope();

            double[] result = new double[values.length];
            for (int i = 0; i < values.length; i++)
                result[i] = values[i] - (intercept + slope * i);
            return result;
        }
    };

    private final String label;

    DetrendMethod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public abstract double[] detrend(double[] values);

    public static DetrendMethod fromName(String name) {
        List<String> labels = new ArrayList<>();
        for (DetrendMethod method : values()) {
            if (name != null && method.label.equalsIgnoreCase(name.trim()))
                return method;
            labels.add(method.label);
        }
        throw new UnsupportedMethodException("detrend", name, StringUtils.join(labels, ", "));
    }
}
