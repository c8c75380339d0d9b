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
 * A (key, vector) pair. The vector is copied in and out so a record can be shared between collections.
 */
public final class SeriesRecord {

    private final RecordKey key;
    private final double[] values;

    public SeriesRecord(RecordKey key, double[] values) {
        if (key == null)
            throw new IllegalArgumentException("Record key must not be null");
        this.key = key;
        this.values = values.clone();
    }

    public RecordKey getKey() {
        return key;
    }

    public double[] getValues() {
        return values.clone();
    }

    public double get(int position) {
        return values[position];
    }

    public int size() {
        return values.length;
    }

    /**
     * @return a record with the same key and the given values
     */
    public SeriesRecord withValues(double[] newValues) {
        return new SeriesRecord(key, newValues);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesRecord))
            return false;
        SeriesRecord other = (SeriesRecord) o;
        return key.equals(other.key) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return key + " -> " + Arrays.toString(values);
    }
}
