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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.StringUtils;

import fr.cirad.series.exceptions.UnsupportedMethodException;

public enum SVDMethod {

    /** eigendecomposition of the Gram matrix, for matrices with few columns */
    DIRECT("direct"),

    /** expectation-maximization subspace iteration, for very tall matrices */
    EM("em");

    private final String label;

    SVDMethod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static SVDMethod fromName(String name) {
        List<String> labels = new ArrayList<>();
        for (SVDMethod method : values()) {
            if (name != null && method.label.equalsIgnoreCase(name.trim()))
                return method;
            labels.add(method.label);
        }
        throw new UnsupportedMethodException("SVD", name, StringUtils.join(labels, ", "));
    }
}
