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

import java.util.Arrays;

/**
 * Coordinate of a record: an ordered tuple of non-negative integers.
 * A single integer key is a one-element tuple and is then its own linear position.
 */
public final class RecordKey {

    private final int[] coordinates;

    private RecordKey(int[] coordinates) {
        for (int c : coordinates)
            if (c < 0)
                throw new IllegalArgumentException("Key coordinates must not be negative: " + Arrays.toString(coordinates));
        this.coordinates = coordinates;
    }

    public static RecordKey of(int... coordinates) {
        if (coordinates.length == 0)
            throw new IllegalArgumentException("A key needs at least one coordinate");
        return new RecordKey(coordinates.clone());
    }

    public static RecordKey linear(int position) {
        return new RecordKey(new int[] {position});
    }

    public int getDimensionCount() {
        return coordinates.length;
    }

    public int get(int dimension) {
        return coordinates[dimension];
    }

    public int[] getCoordinates() {
        return coordinates.clone();
    }

    public boolean isLinear() {
        return coordinates.length == 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RecordKey))
            return false;
        return Arrays.equals(coordinates, ((RecordKey) o).coordinates);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coordinates);
    }

    @Override
    public String toString() {
        if (isLinear())
            return String.valueOf(coordinates[0]);
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < coordinates.length; i++)
            sb.append(i == 0 ? "" : ", ").append(coordinates[i]);
        return sb.append(")").toString();
    }
}
