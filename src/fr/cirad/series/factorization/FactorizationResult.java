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

import fr.cirad.series.rdd.Series;

/**
 * Output of a truncated SVD, created once and never modified:
 * scores (u, one k-vector per input record), singular values (s, descending)
 * and components (v, k rows of ncols values).
 */
public class FactorizationResult {

    private final Series scores;
    private final double[] singularValues;
    private final double[][] components;

    public FactorizationResult(Series scores, double[] singularValues, double[][] components) {
        if (components.length != singularValues.length)
            throw new IllegalArgumentException(components.length + " components for " + singularValues.length + " singular values");
        this.scores = scores;
        this.singularValues = singularValues.clone();
        this.components = new double[components.length][];
        for (int i = 0; i < components.length; i++)
            this.components[i] = components[i].clone();
    }

    public int getK() {
        return singularValues.length;
    }

    public Series getScores() {
        return scores;
    }

    public double[] getSingularValues() {
        return singularValues.clone();
    }

    public double[][] getComponents() {
        double[][] copy = new double[components.length][];
        for (int i = 0; i < components.length; i++)
            copy[i] = components[i].clone();
        return copy;
    }

    public Series getU() {
        return getScores();
    }

    public double[] getS() {
        return getSingularValues();
    }

    public double[][] getV() {
        return getComponents();
    }
}
