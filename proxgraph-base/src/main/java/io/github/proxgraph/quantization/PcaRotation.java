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

package io.github.proxgraph.quantization;

import io.github.proxgraph.annotations.Experimental;
import io.github.proxgraph.vector.Matrix;
import io.github.proxgraph.vector.VectorizationProvider;
import io.github.proxgraph.vector.types.VectorFloat;
import io.github.proxgraph.vector.types.VectorTypeSupport;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.List;

/**
 * Orthonormal rotation applied before product quantization so that each subspace carries a similar
 * share of the variance.
 * <p>
 * The principal axes of the sample are dealt out to subspaces greedily, largest eigenvalue first,
 * each going to the non-full subspace whose eigenvalue product is currently smallest.  The rotation
 * is about the origin, so inner products and norms are unchanged.
 */
@Experimental
public class PcaRotation {
    private static final VectorTypeSupport vectorTypeSupport = VectorizationProvider.getInstance().getVectorTypeSupport();

    // rows are the new basis vectors
    private final Matrix rotation;

    PcaRotation(Matrix rotation) {
        if (rotation.rows() != rotation.columns()) {
            throw new IllegalArgumentException("rotation must be square");
        }
        this.rotation = rotation;
    }

    /**
     * @param subspaceSizes the number of consecutive output dimensions assigned to each subspace
     */
    public static PcaRotation fit(List<? extends VectorFloat<?>> sample, int[] subspaceSizes) {
        int dimension = sample.get(0).length();

        double[] mean = new double[dimension];
        for (VectorFloat<?> v : sample) {
            for (int i = 0; i < dimension; i++) {
                mean[i] += v.get(i);
            }
        }
        for (int i = 0; i < dimension; i++) {
            mean[i] /= sample.size();
        }

        double[][] covariance = new double[dimension][dimension];
        double[] centered = new double[dimension];
        for (VectorFloat<?> v : sample) {
            for (int i = 0; i < dimension; i++) {
                centered[i] = v.get(i) - mean[i];
            }
            for (int i = 0; i < dimension; i++) {
                for (int j = i; j < dimension; j++) {
                    covariance[i][j] += centered[i] * centered[j];
                }
            }
        }
        var covarianceMatrix = new Matrix(dimension, dimension);
        for (int i = 0; i < dimension; i++) {
            for (int j = i; j < dimension; j++) {
                float value = (float) (covariance[i][j] / sample.size());
                covarianceMatrix.set(i, j, value);
                covarianceMatrix.set(j, i, value);
            }
        }

        var eigen = covarianceMatrix.symmetricEigen();
        return new PcaRotation(allocate(eigen, subspaceSizes));
    }

    private static Matrix allocate(Matrix.EigenDecomposition eigen, int[] subspaceSizes) {
        int dimension = eigen.values.length;
        int subspaces = subspaceSizes.length;
        int[] filled = new int[subspaces];
        double[] logProduct = new double[subspaces];
        int[] offsets = new int[subspaces];
        for (int s = 1; s < subspaces; s++) {
            offsets[s] = offsets[s - 1] + subspaceSizes[s - 1];
        }

        var rotation = new Matrix(dimension, dimension);
        for (int e = 0; e < dimension; e++) {
            int best = -1;
            for (int s = 0; s < subspaces; s++) {
                if (filled[s] < subspaceSizes[s] && (best < 0 || logProduct[s] < logProduct[best])) {
                    best = s;
                }
            }
            int row = offsets[best] + filled[best];
            filled[best]++;
            logProduct[best] += Math.log(Math.max(eigen.values[e], 1e-12f));
            for (int j = 0; j < dimension; j++) {
                rotation.set(row, j, eigen.vectors.get(e, j));
            }
        }
        return rotation;
    }

    public VectorFloat<?> apply(VectorFloat<?> v) {
        return rotation.multiply(v);
    }

    public VectorFloat<?> applyInverse(VectorFloat<?> rotated) {
        int dimension = rotation.rows();
        var result = vectorTypeSupport.createFloatVector(dimension);
        for (int i = 0; i < dimension; i++) {
            float yi = rotated.get(i);
            for (int j = 0; j < dimension; j++) {
                result.set(j, result.get(j) + yi * rotation.get(i, j));
            }
        }
        return result;
    }

    public int getDimension() {
        return rotation.rows();
    }

    Matrix getMatrix() {
        return rotation;
    }

    void write(DataOutput out) throws IOException {
        int dimension = rotation.rows();
        out.writeInt(dimension);
        for (int i = 0; i < dimension; i++) {
            vectorTypeSupport.writeFloatVector(out, rotation.getRow(i));
        }
    }

    static PcaRotation load(DataInput in) throws IOException {
        int dimension = in.readInt();
        float[][] rows = new float[dimension][];
        for (int i = 0; i < dimension; i++) {
            rows[i] = vectorTypeSupport.readFloatVector(in, dimension).toArray();
        }
        return new PcaRotation(Matrix.from(rows));
    }
}
