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
package fr.cirad.series.exceptions;

public class ConvergenceException extends SeriesException {

    private static final long serialVersionUID = 1L;

    private final int iterations;
    private final double error;

    public ConvergenceException(int iterations, double error, double tolerance) {
        super("No convergence after " + iterations + " iterations: error " + error + " still above tolerance " + tolerance);
        this.iterations = iterations;
        this.error = error;
    }

    public int getIterations() {
        return iterations;
    }

    public double getError() {
        return error;
    }
}
