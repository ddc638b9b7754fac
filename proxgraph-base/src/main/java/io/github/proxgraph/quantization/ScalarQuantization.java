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

import io.github.proxgraph.exceptions.DimensionMismatchException;
import io.github.proxgraph.exceptions.InsufficientSamplesException;
import io.github.proxgraph.util.MathUtil;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import io.github.proxgraph.vector.VectorizationProvider;
import io.github.proxgraph.vector.types.ByteSequence;
import io.github.proxgraph.vector.types.VectorFloat;
import io.github.proxgraph.vector.types.VectorTypeSupport;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * Scalar quantization: each dimension is mapped independently onto 256 evenly spaced levels between
 * the minimum and maximum seen for that dimension in the training sample.  Values outside the trained
 * range are clamped.
 */
public class ScalarQuantization implements VectorCompressor<ByteSequence<?>> {
    private static final VectorTypeSupport vectorTypeSupport = VectorizationProvider.getInstance().getVectorTypeSupport();

    static final int LEVELS = 256;

    private final float[] min;
    private final float[] step;
    // decoded level values squared, per dimension; the query-independent half of cosine scoring
    private final VectorFloat<?> squaredLevels;

    ScalarQuantization(float[] min, float[] step) {
        if (min.length != step.length) {
            throw new IllegalArgumentException("min and step must have the same length");
        }
        this.min = min;
        this.step = step;
        this.squaredLevels = vectorTypeSupport.createFloatVector(min.length * LEVELS);
        for (int d = 0; d < min.length; d++) {
            for (int j = 0; j < LEVELS; j++) {
                float value = level(d, j);
                squaredLevels.set(d * LEVELS + j, value * value);
            }
        }
    }

    /**
     * Learns per-dimension ranges from the sample.  Pure: the sample is not modified.
     *
     * @throws InsufficientSamplesException if the sample is smaller than {@link QuantizerConfig#requiredSamples()}
     */
    public static ScalarQuantization train(List<? extends VectorFloat<?>> sample, QuantizerConfig config) {
        if (config.getType() != QuantizerConfig.Type.SCALAR) {
            throw new IllegalArgumentException("Not a scalar quantizer configuration: " + config);
        }
        int required = Math.max(1, config.requiredSamples());
        if (sample.size() < required) {
            throw new InsufficientSamplesException(required, sample.size());
        }

        int dimension = sample.get(0).length();
        float[] min = new float[dimension];
        float[] max = new float[dimension];
        Arrays.fill(min, Float.POSITIVE_INFINITY);
        Arrays.fill(max, Float.NEGATIVE_INFINITY);
        for (VectorFloat<?> v : sample) {
            DimensionMismatchException.check(dimension, v.length());
            for (int d = 0; d < dimension; d++) {
                float value = v.get(d);
                min[d] = Math.min(min[d], value);
                max[d] = Math.max(max[d], value);
            }
        }

        float[] step = new float[dimension];
        for (int d = 0; d < dimension; d++) {
            step[d] = (max[d] - min[d]) / (LEVELS - 1);
        }
        return new ScalarQuantization(min, step);
    }

    private float level(int dimension, int level) {
        return min[dimension] + level * step[dimension];
    }

    @Override
    public MutableCompressedVectors<ByteSequence<?>> createCompressedVectors(int initialCapacity) {
        return new SQVectors(this, initialCapacity);
    }

    @Override
    public ByteSequence<?> encode(VectorFloat<?> v) {
        var code = vectorTypeSupport.createByteSequence(min.length);
        encodeTo(v, code);
        return code;
    }

    @Override
    public void encodeTo(VectorFloat<?> v, ByteSequence<?> dest) {
        DimensionMismatchException.check(min.length, v.length());
        for (int d = 0; d < min.length; d++) {
            int q = 0;
            if (step[d] > 0) {
                q = Math.round(MathUtil.clamp((v.get(d) - min[d]) / step[d], 0, LEVELS - 1));
            }
            dest.set(d, (byte) q);
        }
    }

    @Override
    public VectorFloat<?> decode(ByteSequence<?> code) {
        var v = vectorTypeSupport.createFloatVector(min.length);
        for (int d = 0; d < min.length; d++) {
            v.set(d, level(d, Byte.toUnsignedInt(code.get(d))));
        }
        return v;
    }

    /**
     * @return per-dimension table of {@value #LEVELS} partial results for the query
     */
    VectorFloat<?> partialTable(VectorFloat<?> q, VectorSimilarityFunction vsf) {
        DimensionMismatchException.check(min.length, q.length());
        var table = vectorTypeSupport.createFloatVector(min.length * LEVELS);
        for (int d = 0; d < min.length; d++) {
            float qd = q.get(d);
            for (int j = 0; j < LEVELS; j++) {
                float value = level(d, j);
                if (vsf == VectorSimilarityFunction.EUCLIDEAN) {
                    table.set(d * LEVELS + j, MathUtil.square(qd - value));
                } else {
                    table.set(d * LEVELS + j, qd * value);
                }
            }
        }
        return table;
    }

    VectorFloat<?> squaredLevels() {
        return squaredLevels;
    }

    @Override
    public int getDimension() {
        return min.length;
    }

    @Override
    public QuantizerConfig.Type getType() {
        return QuantizerConfig.Type.SCALAR;
    }

    @Override
    public int compressedVectorSize() {
        return min.length;
    }

    @Override
    public void write(DataOutput out) throws IOException {
        out.writeByte(getType().ordinal());
        out.writeInt(min.length);
        for (int d = 0; d < min.length; d++) {
            out.writeFloat(min[d]);
            out.writeFloat(step[d]);
        }
    }

    /**
     * Reads a codebook written by {@link #write}, after the type tag has been consumed.
     */
    static ScalarQuantization load(DataInput in) throws IOException {
        int dimension = in.readInt();
        if (dimension <= 0) {
            throw new IOException("Invalid scalar quantizer dimension " + dimension);
        }
        float[] min = new float[dimension];
        float[] step = new float[dimension];
        for (int d = 0; d < dimension; d++) {
            min[d] = in.readFloat();
            step[d] = in.readFloat();
        }
        return new ScalarQuantization(min, step);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarQuantization)) return false;
        ScalarQuantization that = (ScalarQuantization) o;
        return Arrays.equals(min, that.min) && Arrays.equals(step, that.step);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(min) + Arrays.hashCode(step);
    }

    @Override
    public String toString() {
        return "ScalarQuantization(dimension=" + min.length + ")";
    }
}
