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

import io.github.proxgraph.exceptions.InternalInconsistencyException;
import io.github.proxgraph.graph.similarity.ScoreFunction;
import io.github.proxgraph.util.DenseIntMap;
import io.github.proxgraph.vector.VectorUtil;
import io.github.proxgraph.vector.types.ByteSequence;
import io.github.proxgraph.vector.types.VectorFloat;

/**
 * Codes of one byte per sub-code, keyed by ordinal.  Scoring goes through a per-query table of
 * {@code codeCount * tableWidth} partial results, summed with {@link VectorUtil#assembleAndSum}.
 */
abstract class ByteCodeVectors implements MutableCompressedVectors<ByteSequence<?>> {
    protected final DenseIntMap<ByteSequence<?>> codes;

    protected ByteCodeVectors(int initialCapacity) {
        this.codes = new DenseIntMap<>(Math.max(1, initialCapacity));
    }

    @Override
    public abstract VectorCompressor<ByteSequence<?>> getCompressor();

    @Override
    public void encodeAndSet(int ordinal, VectorFloat<?> vector) {
        set(ordinal, getCompressor().encode(vector));
    }

    @Override
    public void set(int ordinal, ByteSequence<?> code) {
        if (code.length() != getCompressedSize()) {
            throw new IllegalArgumentException("Code length " + code.length() + " != " + getCompressedSize());
        }
        ByteSequence<?> existing = codes.get(ordinal);
        while (!codes.compareAndPut(ordinal, existing, code)) {
            existing = codes.get(ordinal);
        }
    }

    @Override
    public ByteSequence<?> get(int ordinal) {
        return codes.get(ordinal);
    }

    @Override
    public void remove(int ordinal) {
        codes.remove(ordinal);
    }

    @Override
    public boolean contains(int ordinal) {
        return codes.containsKey(ordinal);
    }

    @Override
    public int count() {
        return codes.size();
    }

    @Override
    public int getCompressedSize() {
        return getCompressor().compressedVectorSize();
    }

    protected ByteSequence<?> codeFor(int ordinal) {
        var code = codes.get(ordinal);
        if (code == null) {
            throw new InternalInconsistencyException("No compressed code for node " + ordinal);
        }
        return code;
    }

    /**
     * Score function summing one table entry per sub-code.  The sum is mapped to a similarity by {@code negate}.
     */
    protected ScoreFunction.ApproximateScoreFunction tableScoreFunction(VectorFloat<?> table, int tableWidth, boolean negate) {
        if (negate) {
            return node2 -> -VectorUtil.assembleAndSum(table, tableWidth, codeFor(node2));
        }
        return node2 -> VectorUtil.assembleAndSum(table, tableWidth, codeFor(node2));
    }

    /**
     * Cosine from a query-dependent dot-product table and a query-independent squared-norm table.
     */
    protected ScoreFunction.ApproximateScoreFunction cosineScoreFunction(VectorFloat<?> dotTable, VectorFloat<?> normTable,
                                                                         int tableWidth, float queryNorm) {
        return node2 -> {
            if (queryNorm == 0) {
                return 0f;
            }
            var code = codeFor(node2);
            float dot = VectorUtil.assembleAndSum(dotTable, tableWidth, code);
            float normSquared = VectorUtil.assembleAndSum(normTable, tableWidth, code);
            if (normSquared <= 0) {
                return 0f;
            }
            return (float) (dot / (queryNorm * Math.sqrt(normSquared)));
        };
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(count=" + count() + ", compressor=" + getCompressor() + ")";
    }
}
