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
package fr.cirad.series.query;

import java.util.Arrays;

/**
 * Averaged vectors of a subscript query, one per group, in group order.
 * Group identifiers run from 1 to the number of groups.
 */
public class QueryResult {

    private final int[] keys;
    private final double[][] values;

    public QueryResult(double[][] values) {
        this.values = new double[values.length][];
        this.keys = new int[values.length];
        for (int g = 0; g < values.length; g++) {
            this.keys[g] = g + 1;
            this.values[g] = values[g].clone();
        }
    }

    public int size() {
        return keys.length;
    }

    public int[] getKeys() {
        return keys.clone();
    }

    /**
     * @return one row per group
     */
    public double[][] getValues() {
        double[][] copy = new double[values.length][];
        for (int g = 0; g < values.length; g++)
            copy[g] = values[g].clone();
        return copy;
    }

    /**
     * @param key 1-based group identifier
     */
    public double[] getGroup(int key) {
        if (key < 1 || key > keys.length)
            throw new IndexOutOfBoundsException("No group " + key + ", groups are 1 to " + keys.length);
        return values[key - 1].clone();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int g = 0; g < keys.length; g++)
            sb.append(g == 0 ? "" : "\n").append(keys[g]).append("\t").append(Arrays.toString(values[g]));
        return sb.toString();
    }
}
