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

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;

import org.apache.log4j.Logger;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;

import cern.colt.matrix.tdouble.DoubleMatrix1D;
import cern.colt.matrix.tdouble.DoubleMatrix2D;
import cern.colt.matrix.tdouble.algo.decomposition.DenseDoubleEigenvalueDecomposition;
import cern.colt.matrix.tdouble.impl.DenseDoubleMatrix2D;
import fr.cirad.series.config.EngineConfig;
import fr.cirad.series.exceptions.ConvergenceException;
import fr.cirad.series.exceptions.SeriesException;
import fr.cirad.series.rdd.RowMatrix;

/**
 * Truncated singular value decomposition of a distributed row matrix.
 *
 * Both methods reduce the rows to small matrices (ncols x ncols for DIRECT, k x k and ncols x k for EM)
 * through aggregates, decompose those locally, then recover u = A vᵀ / s with one map.
 * Singular values below {@link #RELATIVE_RANK_THRESHOLD} times the largest one are treated as zero
 * and get an all-zero column in u.
 */
public class SVD {

    static private final Logger LOG = Logger.getLogger(SVD.class);

    static final double RELATIVE_RANK_THRESHOLD = 1e-7;

    private final int k;
    private final SVDMethod method;
    private int maxIterations;
    private double tolerance;
    private long seed;

    public SVD(int k) {
        this(k, SVDMethod.DIRECT);
    }

    public SVD(int k, String method) {
        this(k, SVDMethod.fromName(method));
    }

    public SVD(int k, SVDMethod method) {
        this(k, method, EngineConfig.getDefault());
    }

    public SVD(int k, SVDMethod method, EngineConfig config) {
        if (k < 1)
            throw new IllegalArgumentException("Number of singular vectors must be positive, got " + k);
        this.k = k;
        this.method = method;
        this.maxIterations = config.getSvdMaxIterations();
        this.tolerance = config.getSvdTolerance();
        this.seed = config.getSvdSeed();
    }

    public SVD setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
        return this;
    }

    public SVD setTolerance(double tolerance) {
        this.tolerance = tolerance;
        return this;
    }

    public SVD setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    public int getK() {
        return k;
    }

    public SVDMethod getMethod() {
        return method;
    }

    public FactorizationResult calc(RowMatrix mat) {
        long nrows = mat.nrows();
        int ncols = mat.ncols();
        if (nrows == 0 || ncols == 0)
            throw new IllegalArgumentException("Cannot decompose an empty matrix (" + nrows + " x " + ncols + ")");
        if (k > ncols)
            throw new IllegalArgumentException("Cannot compute " + k + " singular vectors of a matrix with " + ncols + " columns");

        long before = System.currentTimeMillis();
        LOG.info("Computing " + method.getLabel() + " SVD with k=" + k + " on a " + nrows + " x " + ncols + " matrix");
        FactorizationResult result = method == SVDMethod.DIRECT ? direct(mat, nrows, ncols) : em(mat, nrows, ncols);
        LOG.info("SVD computed in " + (System.currentTimeMillis() - before) / 1000d + "s, singular values: " + Arrays.toString(result.getSingularValues()));
        return result;
    }

    private FactorizationResult direct(RowMatrix mat, long nrows, int ncols) {
        double[][] gram = mat.gramian();
        for (double[] row : gram)
            for (int j = 0; j < ncols; j++)
                row[j] /= nrows;

        DenseDoubleEigenvalueDecomposition eig = new DenseDoubleEigenvalueDecomposition(new DenseDoubleMatrix2D(gram));
        DoubleMatrix1D eigenValues = eig.getRealEigenvalues();
        DoubleMatrix2D eigenVectors = eig.getV();

        double[] w = eigenValues.toArray();
        Integer[] order = descendingOrder(w);

        double[] s = new double[k];
        double[][] v = new double[k][ncols];
        for (int i = 0; i < k; i++) {
            s[i] = Math.sqrt(Math.max(w[order[i]], 0)) * Math.sqrt(nrows);
            for (int j = 0; j < ncols; j++)
                v[i][j] = eigenVectors.getQuick(j, order[i]);
        }
        return project(mat, s, v);
    }

    private FactorizationResult em(RowMatrix mat, long nrows, int ncols) {
        Random rng = new Random(seed);
        DMatrixRMaj c = new DMatrixRMaj(k, ncols);
        for (int i = 0; i < c.data.length; i++)
            c.data[i] = rng.nextDouble();

        // e-step: x = (c'c)^+ c' y
        // m-step: c = y x' (xx')^+
        // pseudo-inverses keep the iteration defined when the data has rank below k
        int iteration = 0;
        double error = Double.POSITIVE_INFINITY;
        while (iteration < maxIterations && !(error <= tolerance)) {
            DMatrixRMaj cct = new DMatrixRMaj(k, k);
            CommonOps_DDRM.multTransB(c, c, cct);
            DMatrixRMaj cInv = new DMatrixRMaj(ncols, k);
            CommonOps_DDRM.multTransA(c, pseudoInverse(cct, "c c'", iteration), cInv);

            DMatrixRMaj xx = new DMatrixRMaj(mat.times(toArray(cInv)).gramian());
            DMatrixRMaj premult = new DMatrixRMaj(ncols, k);
            CommonOps_DDRM.mult(cInv, pseudoInverse(xx, "x x'", iteration), premult);

            DMatrixRMaj updated = CommonOps_DDRM.transpose(new DMatrixRMaj(maximization(mat, toArray(premult))), null);
            error = 0;
            for (int i = 0; i < updated.data.length; i++) {
                double d = updated.data[i] - c.data[i];
                error += d * d;
            }
            c = updated;
            iteration++;
            LOG.debug("EM iteration " + iteration + ": squared change " + error);
        }
        if (!(error <= tolerance))
            throw new ConvergenceException(iteration, error, tolerance);
        LOG.debug("EM converged after " + iteration + " iterations");

        // orthonormal basis of a k-dimensional space containing the rows of c (c may be rank deficient)
        SingularValueDecomposition_F64<DMatrixRMaj> basisSvd = DecompositionFactory_DDRM.svd(ncols, k, true, false, true);
        if (!basisSvd.decompose(CommonOps_DDRM.transpose(c, null)))
            throw new SeriesException("Orthonormalization of the EM subspace failed");
        DMatrixRMaj q = basisSvd.getU(null, false);

        double[][] projectedCov = mat.times(toArray(q)).gramian();
        for (double[] row : projectedCov)
            for (int j = 0; j < k; j++)
                row[j] /= nrows;

        EigenDecomposition_F64<DMatrixRMaj> eig = DecompositionFactory_DDRM.eig(k, true, true);
        if (!eig.decompose(new DMatrixRMaj(projectedCov)))
            throw new SeriesException("Eigendecomposition of the projected covariance failed");

        double[] w = new double[k];
        for (int i = 0; i < k; i++)
            w[i] = eig.getEigenvalue(i).getReal();
        Integer[] order = descendingOrder(w);

        double[] s = new double[k];
        double[][] v = new double[k][ncols];
        for (int i = 0; i < k; i++) {
            s[i] = Math.sqrt(Math.max(w[order[i]], 0)) * Math.sqrt(nrows);
            DMatrixRMaj eigenVector = eig.getEigenVector(order[i]);
            for (int j = 0; j < ncols; j++) {
                double sum = 0;
                for (int l = 0; l < k; l++)
                    sum += eigenVector.get(l, 0) * q.get(j, l);
                v[i][j] = sum;
            }
        }
        return project(mat, s, v);
    }

    /**
     * Sum over rows of outer(x, x premult), i.e. the new subspace basis transposed (ncols x k).
     */
    private double[][] maximization(RowMatrix mat, final double[][] premult) {
        final int ncols = mat.ncols();
        double[] flat = mat.getRecords().aggregate(() -> new double[ncols * k], (acc, r) -> {
            double[] x = r.getValues();
            double[] y = new double[k];
            for (int i = 0; i < ncols; i++)
                for (int j = 0; j < k; j++)
                    y[j] += x[i] * premult[i][j];
            for (int i = 0; i < ncols; i++) {
                if (x[i] == 0)
                    continue;
                int base = i * k;
                for (int j = 0; j < k; j++)
                    acc[base + j] += x[i] * y[j];
            }
            return acc;
        }, (a, b) -> {
            for (int i = 0; i < a.length; i++)
                a[i] += b[i];
            return a;
        });

        double[][] result = new double[ncols][k];
        for (int i = 0; i < ncols; i++)
            System.arraycopy(flat, i * k, result[i], 0, k);
        return result;
    }

    /**
     * u = A vᵀ / s, the division being skipped (zero column) for negligible singular values.
     */
    private FactorizationResult project(RowMatrix mat, double[] s, double[][] v) {
        int ncols = mat.ncols();
        double threshold = s[0] * RELATIVE_RANK_THRESHOLD;
        double[][] scaled = new double[ncols][k];
        for (int i = 0; i < k; i++) {
            if (!(s[i] > threshold))
                continue;
            for (int j = 0; j < ncols; j++)
                scaled[j][i] = v[i][j] / s[i];
        }
        return new FactorizationResult(mat.times(scaled), s, v);
    }

    /**
     * Moore-Penrose inverse of a symmetric positive semi-definite matrix. Eigenvalues at or below
     * RELATIVE_RANK_THRESHOLD² times the largest one are dropped, matching the rank cut applied to singular values.
     */
    private static DMatrixRMaj pseudoInverse(DMatrixRMaj sym, String what, int iteration) {
        int n = sym.numRows;
        EigenDecomposition_F64<DMatrixRMaj> eig = DecompositionFactory_DDRM.eig(n, true, true);
        if (!eig.decompose(sym.copy()))
            throw new SeriesException("Eigendecomposition of " + what + " failed at EM iteration " + iteration);

        double max = 0;
        for (int i = 0; i < n; i++)
            max = Math.max(max, eig.getEigenvalue(i).getReal());
        DMatrixRMaj inverse = new DMatrixRMaj(n, n);
        if (!(max > 0))
            return inverse;

        double threshold = max * RELATIVE_RANK_THRESHOLD * RELATIVE_RANK_THRESHOLD;
        for (int i = 0; i < n; i++) {
            double lambda = eig.getEigenvalue(i).getReal();
            if (!(lambda > threshold))
                continue;
            DMatrixRMaj vector = eig.getEigenVector(i);
            for (int a = 0; a < n; a++)
                for (int b = 0; b < n; b++)
                    inverse.add(a, b, vector.get(a, 0) * vector.get(b, 0) / lambda);
        }
        return inverse;
    }

    private static double[][] toArray(DMatrixRMaj m) {
        double[][] result = new double[m.numRows][m.numCols];
        for (int i = 0; i < m.numRows; i++)
            for (int j = 0; j < m.numCols; j++)
                result[i][j] = m.get(i, j);
        return result;
    }

    private static Integer[] descendingOrder(final double[] w) {
        Integer[] order = new Integer[w.length];
        for (int i = 0; i < order.length; i++)
            order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> w[i]).reversed());
        return order;
    }
}
