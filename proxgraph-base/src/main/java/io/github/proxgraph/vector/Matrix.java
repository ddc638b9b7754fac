/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.proxgraph.vector;

import io.github.proxgraph.vector.types.VectorFloat;
import io.github.proxgraph.vector.types.VectorTypeSupport;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Matrix object where each row is a VectorFloat; this makes multiplication of a matrix by a vector
 * a series of efficient dot products.
 */
public class Matrix {
    private static final VectorTypeSupport vts = VectorizationProvider.getInstance().getVectorTypeSupport();

    /** Sweeps of the Jacobi eigenvalue iteration before giving up on convergence. */
    private static final int MAX_JACOBI_SWEEPS = 100;

    VectorFloat<?>[] data;

    public Matrix(int m, int n) {
        data = new VectorFloat[m];
        for (int i = 0; i < m; i++) {
            data[i] = vts.createFloatVector(n);
        }
    }

    private Matrix(VectorFloat<?>[] rows) {
        this.data = rows;
    }

    public static Matrix identity(int n) {
        var result = new Matrix(n, n);
        for (int i = 0; i < n; i++) {
            result.set(i, i, 1);
        }
        return result;
    }

    /**
     * Creates a matrix from a 2D array of float values. Each row of the array becomes a row in the matrix.
     */
    public static Matrix from(float[][] values) {
        var rows = new VectorFloat<?>[values.length];
        for (int i = 0; i < values.length; i++) {
            rows[i] = vts.createFloatVector(Arrays.copyOf(values[i], values[i].length));
        }
        return new Matrix(rows);
    }

    public int rows() {
        return data.length;
    }

    public int columns() {
        return data.length == 0 ? 0 : data[0].length();
    }

    public float get(int i, int j) {
        return data[i].get(j);
    }

    public void set(int i, int j, float value) {
        data[i].set(j, value);
    }

    public void addTo(int i, int j, float delta) {
        data[i].set(j, data[i].get(j) + delta);
    }

    public VectorFloat<?> getRow(int i) {
        return data[i];
    }

    /**
     * Multiplies this matrix by a column vector. For an m-by-n matrix and an n-dimensional vector,
     * this returns an m-dimensional vector of row dot products.
     *
     * @throws IllegalArgumentException if the vector dimension doesn't match the matrix column count
     */
    public VectorFloat<?> multiply(VectorFloat<?> v) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot multiply empty matrix");
        }
        if (v.length() != columns()) {
            throw new IllegalArgumentException("vector dimension " + v.length() + " != matrix columns " + columns());
        }

        var result = vts.createFloatVector(data.length);
        for (int i = 0; i < data.length; i++) {
            result.set(i, VectorUtil.dotProduct(data[i], v));
        }
        return result;
    }

    public Matrix transpose() {
        var result = new Matrix(columns(), rows());
        for (int i = 0; i < rows(); i++) {
            for (int j = 0; j < columns(); j++) {
                result.set(j, i, get(i, j));
            }
        }
        return result;
    }

    public void scale(float multiplier) {
        for (var row : data) {
            VectorUtil.scale(row, multiplier);
        }
    }

    /**
     * Decomposes a symmetric matrix into its eigenvalues and eigenvectors using cyclic Jacobi rotations.
     * The work is done in double precision.
     *
     * @return eigenvalues in descending order, with the matching unit eigenvectors as the rows of
     * {@link EigenDecomposition#vectors}
     */
    public EigenDecomposition symmetricEigen() {
        int n = rows();
        if (n == 0 || n != columns()) {
            throw new IllegalArgumentException("matrix must be square");
        }

        double[][] a = new double[n][n];
        double[][] v = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                a[i][j] = get(i, j);
            }
            v[i][i] = 1;
        }

        for (int sweep = 0; sweep < MAX_JACOBI_SWEEPS; sweep++) {
            double offDiagonal = 0;
            double diagonal = 0;
            for (int p = 0; p < n; p++) {
                diagonal += a[p][p] * a[p][p];
                for (int q = p + 1; q < n; q++) {
                    offDiagonal += a[p][q] * a[p][q];
                }
            }
            if (offDiagonal <= 1e-22 * Math.max(diagonal, 1e-300)) {
                break;
            }

            for (int p = 0; p < n - 1; p++) {
                for (int q = p + 1; q < n; q++) {
                    if (a[p][q] == 0) {
                        continue;
                    }
                    double theta = (a[q][q] - a[p][p]) / (2 * a[p][q]);
                    double t = Math.signum(theta) / (Math.abs(theta) + Math.sqrt(theta * theta + 1));
                    if (theta == 0) {
                        t = 1;
                    }
                    double c = 1 / Math.sqrt(t * t + 1);
                    double s = t * c;
                    rotate(a, v, n, p, q, c, s);
                }
            }
        }

        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = a[i][i];
        }
        // v holds eigenvectors as columns; emit them as rows sorted by eigenvalue
        int[] order = IntStream.range(0, n)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> -values[i]).thenComparingInt(i -> i))
                .mapToInt(Integer::intValue)
                .toArray();
        float[] sortedValues = new float[n];
        float[][] vectors = new float[n][n];
        for (int r = 0; r < n; r++) {
            int col = order[r];
            sortedValues[r] = (float) values[col];
            for (int i = 0; i < n; i++) {
                vectors[r][i] = (float) v[i][col];
            }
        }
        return new EigenDecomposition(sortedValues, from(vectors));
    }

    private static void rotate(double[][] a, double[][] v, int n, int p, int q, double c, double s) {
        for (int k = 0; k < n; k++) {
            double akp = a[k][p];
            double akq = a[k][q];
            a[k][p] = c * akp - s * akq;
            a[k][q] = s * akp + c * akq;
        }
        for (int k = 0; k < n; k++) {
            double apk = a[p][k];
            double aqk = a[q][k];
            a[p][k] = c * apk - s * aqk;
            a[q][k] = s * apk + c * aqk;
        }
        for (int k = 0; k < n; k++) {
            double vkp = v[k][p];
            double vkq = v[k][q];
            v[k][p] = c * vkp - s * vkq;
            v[k][q] = s * vkp + c * vkq;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Matrix)) {
            return false;
        }
        return Arrays.equals(data, ((Matrix) obj).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (VectorFloat<?> row : data) {
            sb.append(row).append("\n");
        }
        return sb.toString();
    }

    /**
     * Eigenvalues of a symmetric matrix, descending, and the corresponding eigenvectors as matrix rows.
     */
    public static final class EigenDecomposition {
        public final float[] values;
        public final Matrix vectors;

        EigenDecomposition(float[] values, Matrix vectors) {
            this.values = values;
            this.vectors = vectors;
        }
    }
}
