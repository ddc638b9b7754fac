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

import io.github.proxgraph.graph.RandomAccessVectorValues;
import io.github.proxgraph.util.PhysicalCoreExecutor;
import io.github.proxgraph.vector.types.ByteSequence;
import io.github.proxgraph.vector.types.VectorFloat;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/**
 * Interface for vector compression.  T is the encoded (compressed) vector type.
 * <p>
 * A compressor is a trained, immutable codebook: every method may be called concurrently.
 */
public interface VectorCompressor<T> {

    default MutableCompressedVectors<T> encodeAll(RandomAccessVectorValues ravv) {
        return encodeAll(ravv, PhysicalCoreExecutor.pool());
    }

    /**
     * Encode all vectors in the RandomAccessVectorValues.  Empty ordinals are left empty in the result.
     *
     * @param simdExecutor ForkJoinPool to spread the encoding over
     */
    default MutableCompressedVectors<T> encodeAll(RandomAccessVectorValues ravv, ForkJoinPool simdExecutor) {
        var cv = createCompressedVectors(ravv.size());
        simdExecutor.submit(() -> IntStream.range(0, ravv.size())
                        .parallel()
                        .forEach(i -> {
                            var v = ravv.getVector(i);
                            if (v != null) {
                                cv.encodeAndSet(i, v);
                            }
                        }))
                .join();
        return cv;
    }

    /**
     * @return an empty, growable collection of vectors encoded by this compressor
     */
    MutableCompressedVectors<T> createCompressedVectors(int initialCapacity);

    T encode(VectorFloat<?> v);

    void encodeTo(VectorFloat<?> v, T dest);

    /**
     * Reconstructs an approximation of the original vector.  Diagnostic only; searches score codes directly.
     */
    VectorFloat<?> decode(T code);

    /**
     * @return the dimension of the vectors this compressor accepts
     */
    int getDimension();

    QuantizerConfig.Type getType();

    /**
     * @return the size of a compressed vector, in bytes
     */
    int compressedVectorSize();

    /**
     * Writes the codebook, preceded by its type tag.
     */
    void write(DataOutput out) throws IOException;

    /**
     * Reads a codebook written by {@link #write}.
     */
    static VectorCompressor<ByteSequence<?>> read(DataInput in) throws IOException {
        int tag = in.readByte();
        if (tag == QuantizerConfig.Type.SCALAR.ordinal()) {
            return ScalarQuantization.load(in);
        }
        if (tag == QuantizerConfig.Type.PRODUCT.ordinal()) {
            return ProductQuantization.load(in);
        }
        throw new IOException("Unknown codebook type " + tag);
    }
}
