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

/**
 * Raised when a normalization, detrending or SVD method is requested by a name the engine does not implement.
 */
public class UnsupportedMethodException extends SeriesException {

    private static final long serialVersionUID = 1L;

    public UnsupportedMethodException(String kind, String name, String supported) {
        super("Unsupported " + kind + " method '" + name + "', supported are: " + supported);
    }
}
