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
 * Scope of the statistic used by centering and standardization.
 */
public enum Axis {

    /** axis 0: each record's own mean and population standard deviation (ddof = 0) */
    WITHIN_RECORD(0),

    /** axis 1: per-position mean and sample standard deviation over all records (ddof = 1) */
    ACROSS_RECORDS(1);

    private final int number;

    Axis(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    public static Axis of(int axis) {
        for (Axis a : values())
            if (a.number == axis)
                return a;
        throw new IllegalArgumentException("Axis must be 0 (within record) or 1 (across records), got " + axis);
    }
}
