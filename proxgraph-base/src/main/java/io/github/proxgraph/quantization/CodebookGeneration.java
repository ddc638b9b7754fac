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

import io.github.proxgraph.graph.similarity.ScoreFunction;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import io.github.proxgraph.vector.types.ByteSequence;
import io.github.proxgraph.vector.types.VectorFloat;

/**
 * One trained codebook together with the codes it produced.  The codebook never changes; a retrain
 * builds a new generation and swaps it in whole, so a search that captured a generation keeps
 * scoring against a consistent codebook/code pair.
 */
public final class CodebookGeneration {
    private final long version;
    private final VectorCompressor<ByteSequence<?>> compressor;
    private final MutableCompressedVectors<ByteSequence<?>> vectors;
    // first ordinal allocated after this generation was replaced; such nodes never get a code here
    private volatile int retiredAt = Integer.MAX_VALUE;

    public CodebookGeneration(long version, VectorCompressor<ByteSequence<?>> compressor, MutableCompressedVectors<ByteSequence<?>> vectors) {
        if (vectors.getCompressor() != compressor) {
            throw new IllegalArgumentException("Compressed vectors were not produced by this compressor");
        }
        this.version = version;
        this.compressor = compressor;
        this.vectors = vectors;
    }

    public long getVersion() {
        return version;
    }

    public VectorCompressor<ByteSequence<?>> getCompressor() {
        return compressor;
    }

    public MutableCompressedVectors<ByteSequence<?>> getVectors() {
        return vectors;
    }

    /**
     * Marks this generation as replaced.  Nodes from {@code nextOrdinal} on are encoded only by its successors.
     */
    public void retire(int nextOrdinal) {
        retiredAt = nextOrdinal;
    }

    public boolean isRetired() {
        return retiredAt != Integer.MAX_VALUE;
    }

    /**
     * Approximate scores against this generation's codes.  Nodes inserted after the generation was retired have
     * no code in it and are scored by {@code fallback} instead; any other missing code is an inconsistency.
     */
    public ScoreFunction.ApproximateScoreFunction scoreFunctionFor(VectorFloat<?> q, VectorSimilarityFunction vsf,
                                                                   ScoreFunction.ExactScoreFunction fallback) {
        var approximate = vectors.precomputedScoreFunctionFor(q, vsf);
        return node2 -> {
            if (node2 >= retiredAt && !vectors.contains(node2)) {
                return fallback.similarityTo(node2);
            }
            return approximate.similarityTo(node2);
        };
    }

    @Override
    public String toString() {
        return "CodebookGeneration(version=" + version + ", " + compressor + ", count=" + vectors.count() + ")";
    }
}
