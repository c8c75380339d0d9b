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
package fr.cirad.series.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered labels of vector positions, shared by every record of a series.
 *
 * Labels are numbers or strings. Numbers are matched and ordered by numeric value
 * (2, 2L and 2.0 are the same label), strings lexicographically; numbers and strings never compare.
 */
public final class Index {

    private final List<Object> labels;

    private Index(List<Object> labels) {
        for (Object label : labels)
            if (!(label instanceof Number) && !(label instanceof String))
                throw new IllegalArgumentException("Index labels must be numbers or strings, got " + label);
        this.labels = Collections.unmodifiableList(labels);
    }

    public static Index of(List<?> labels) {
        return new Index(new ArrayList<>(labels));
    }

    public static Index of(Object... labels) {
        return of(Arrays.asList(labels));
    }

    /**
     * @return the index 0, 1, ..., size - 1
     */
    public static Index identity(int size) {
        List<Object> labels = new ArrayList<>(size);
        for (int i = 0; i < size; i++)
            labels.add(i);
        return new Index(labels);
    }

    public int size() {
        return labels.size();
    }

    public Object get(int position) {
        return labels.get(position);
    }

    public List<Object> getLabels() {
        return labels;
    }

    /**
     * @return positions, in index order, of the labels within [lower, upper]
     */
    public int[] positionsBetween(Object lower, Object upper) {
        int[] positions = new int[labels.size()];
        int n = 0;
        for (int i = 0; i < labels.size(); i++) {
            Object label = labels.get(i);
            Integer cmpLow = compare(label, lower);
            Integer cmpHigh = compare(label, upper);
            if (cmpLow != null && cmpHigh != null && cmpLow >= 0 && cmpHigh <= 0)
                positions[n++] = i;
        }
        return Arrays.copyOf(positions, n);
    }

    /**
     * @return position of the first label equal to the given one, or -1
     */
    public int positionOf(Object label) {
        for (int i = 0; i < labels.size(); i++) {
            Integer cmp = compare(labels.get(i), label);
            if (cmp != null && cmp == 0)
                return i;
        }
        return -1;
    }

    /**
     * @return a new index made of the labels at the given positions
     */
    public Index subset(int[] positions) {
        List<Object> subset = new ArrayList<>(positions.length);
        for (int p : positions)
            subset.add(labels.get(p));
        return new Index(subset);
    }

    /**
     * @return the sign of a - b, or null when the two labels are not comparable
     */
    static Integer compare(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            if (isIntegral(a) && isIntegral(b))
                return Integer.signum(Long.compare(((Number) a).longValue(), ((Number) b).longValue()));
            return Integer.signum(Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue()));
        }
        if (a instanceof String && b instanceof String)
            return Integer.signum(((String) a).compareTo((String) b));
        return null;
    }

    private static boolean isIntegral(Object n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Index))
            return false;
        List<Object> other = ((Index) o).labels;
        if (other.size() != labels.size())
            return false;
        for (int i = 0; i < labels.size(); i++) {
            Integer cmp = compare(labels.get(i), other.get(i));
            if (cmp == null || cmp != 0)
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Object label : labels)
            h = 31 * h + (label instanceof Number ? Double.hashCode(((Number) label).doubleValue()) : label.hashCode());
        return h;
    }

    @Override
    public String toString() {
        return labels.toString();
    }
}
