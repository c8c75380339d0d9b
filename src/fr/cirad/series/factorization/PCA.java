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

import org.apache.log4j.Logger;

import fr.cirad.series.rdd.RowMatrix;
import fr.cirad.series.rdd.Series;
import fr.cirad.series.stats.Axis;

/**
 * Principal component analysis via a truncated SVD of the column-centered data.
 *
 * After {@link #fit}, scores hold one k-vector per record, latent the k singular values
 * and comps the k principal components (k x ncols).
 */
public class PCA {

    static private final Logger LOG = Logger.getLogger(PCA.class);

    private final int k;
    private final SVDMethod svdMethod;

    private FactorizationResult result;

    public PCA() {
        this(3);
    }

    public PCA(int k) {
        this(k, SVDMethod.DIRECT);
    }

    public PCA(int k, String svdMethod) {
        this(k, SVDMethod.fromName(svdMethod));
    }

    public PCA(int k, SVDMethod svdMethod) {
        if (k < 1)
            throw new IllegalArgumentException("Number of components must be positive, got " + k);
        this.k = k;
        this.svdMethod = svdMethod;
    }

    public PCA fit(Series data) {
        long before = System.currentTimeMillis();
        RowMatrix centered = data.toRowMatrix().center(Axis.ACROSS_RECORDS);
        result = new SVD(k, svdMethod, data.getConfig()).calc(centered);
        LOG.info("PCA with " + k + " components fitted in " + (System.currentTimeMillis() - before) / 1000d + "s");
        return this;
    }

    public int getK() {
        return k;
    }

    public SVDMethod getSvdMethod() {
        return svdMethod;
    }

    public FactorizationResult getResult() {
        if (result == null)
            throw new IllegalStateException("PCA has not been fitted yet");
        return result;
    }

    public Series getScores() {
        return getResult().getScores();
    }

    public double[] getLatent() {
        return getResult().getSingularValues();
    }

    public double[][] getComps() {
        return getResult().getComponents();
    }
}
