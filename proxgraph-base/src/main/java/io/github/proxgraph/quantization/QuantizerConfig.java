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

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Objects;

/**
 * Describes which compression scheme an index uses and how to train it.  Immutable.
 * <p>
 * For product quantization, training needs at least {@code minSamplesPerCentroid * 2^bitsPerCode}
 * sample vectors.  For scalar quantization {@code minSamples} is an absolute minimum.
 */
public final class QuantizerConfig {
    public enum Type {
        NONE,
        SCALAR,
        PRODUCT
    }

    public static final int DEFAULT_BITS_PER_CODE = 8;
    public static final int DEFAULT_ITERATIONS = 25;
    public static final int DEFAULT_MIN_SAMPLES_PER_CENTROID = 4;
    public static final int DEFAULT_MIN_SCALAR_SAMPLES = 100;

    private static final QuantizerConfig NONE = new QuantizerConfig(Type.NONE, 0, 0, false, 0, 0, 0);

    private final Type type;
    private final int subspaceCount;
    private final int bitsPerCode;
    private final boolean rotate;
    private final int iterations;
    private final int minSamplesPerCentroid;
    private final int minSamples;

    private QuantizerConfig(Type type, int subspaceCount, int bitsPerCode, boolean rotate,
                            int iterations, int minSamplesPerCentroid, int minSamples) {
        this.type = type;
        this.subspaceCount = subspaceCount;
        this.bitsPerCode = bitsPerCode;
        this.rotate = rotate;
        this.iterations = iterations;
        this.minSamplesPerCentroid = minSamplesPerCentroid;
        this.minSamples = minSamples;
    }

    /** Full-precision vectors only. */
    public static QuantizerConfig none() {
        return NONE;
    }

    /** One byte per dimension, trained on at least {@value #DEFAULT_MIN_SCALAR_SAMPLES} vectors. */
    public static QuantizerConfig scalar() {
        return scalar(DEFAULT_MIN_SCALAR_SAMPLES);
    }

    public static QuantizerConfig scalar(int minSamples) {
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be positive, got " + minSamples);
        }
        return new QuantizerConfig(Type.SCALAR, 0, 8, false, 0, 0, minSamples);
    }

    public static QuantizerConfig product(int subspaceCount) {
        return product(subspaceCount, DEFAULT_BITS_PER_CODE, false);
    }

    public static QuantizerConfig product(int subspaceCount, int bitsPerCode, boolean rotate) {
        return product(subspaceCount, bitsPerCode, rotate, DEFAULT_ITERATIONS, DEFAULT_MIN_SAMPLES_PER_CENTROID);
    }

    public static QuantizerConfig product(int subspaceCount, int bitsPerCode, boolean rotate,
                                          int iterations, int minSamplesPerCentroid) {
        if (subspaceCount < 1) {
            throw new IllegalArgumentException("subspaceCount must be positive, got " + subspaceCount);
        }
        if (bitsPerCode < 1 || bitsPerCode > 8) {
            throw new IllegalArgumentException("bitsPerCode must be in [1, 8], got " + bitsPerCode);
        }
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive, got " + iterations);
        }
        if (minSamplesPerCentroid < 1) {
            throw new IllegalArgumentException("minSamplesPerCentroid must be positive, got " + minSamplesPerCentroid);
        }
        return new QuantizerConfig(Type.PRODUCT, subspaceCount, bitsPerCode, rotate, iterations, minSamplesPerCentroid, 0);
    }

    public Type getType() {
        return type;
    }

    public int getSubspaceCount() {
        return subspaceCount;
    }

    public int getBitsPerCode() {
        return bitsPerCode;
    }

    public int getClusterCount() {
        return 1 << bitsPerCode;
    }

    public boolean isRotate() {
        return rotate;
    }

    public int getIterations() {
        return iterations;
    }

    public int getMinSamplesPerCentroid() {
        return minSamplesPerCentroid;
    }

    /**
     * @return the smallest training sample this configuration accepts
     */
    public int requiredSamples() {
        switch (type) {
            case SCALAR:
                return minSamples;
            case PRODUCT:
                return minSamplesPerCentroid * getClusterCount();
            default:
                return 0;
        }
    }

    public void write(DataOutput out) throws IOException {
        out.writeByte(type.ordinal());
        out.writeInt(subspaceCount);
        out.writeInt(bitsPerCode);
        out.writeBoolean(rotate);
        out.writeInt(iterations);
        out.writeInt(minSamplesPerCentroid);
        out.writeInt(minSamples);
    }

    public static QuantizerConfig read(DataInput in) throws IOException {
        int ordinal = in.readByte();
        if (ordinal < 0 || ordinal >= Type.values().length) {
            throw new IOException("Unknown quantizer type " + ordinal);
        }
        Type type = Type.values()[ordinal];
        int subspaceCount = in.readInt();
        int bitsPerCode = in.readInt();
        boolean rotate = in.readBoolean();
        int iterations = in.readInt();
        int minSamplesPerCentroid = in.readInt();
        int minSamples = in.readInt();
        switch (type) {
            case SCALAR:
                return scalar(minSamples);
            case PRODUCT:
                return product(subspaceCount, bitsPerCode, rotate, iterations, minSamplesPerCentroid);
            default:
                return NONE;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuantizerConfig)) return false;
        QuantizerConfig that = (QuantizerConfig) o;
        return subspaceCount == that.subspaceCount
                && bitsPerCode == that.bitsPerCode
                && rotate == that.rotate
                && iterations == that.iterations
                && minSamplesPerCentroid == that.minSamplesPerCentroid
                && minSamples == that.minSamples
                && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, subspaceCount, bitsPerCode, rotate, iterations, minSamplesPerCentroid, minSamples);
    }

    @Override
    public String toString() {
        switch (type) {
            case SCALAR:
                return "SQ(minSamples=" + minSamples + ")";
            case PRODUCT:
                return String.format("PQ(M=%d, bits=%d, rotate=%s, iterations=%d)", subspaceCount, bitsPerCode, rotate, iterations);
            default:
                return "NONE";
        }
    }
}
