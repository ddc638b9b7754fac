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
import io.github.proxgraph.vector.VectorUtil;
import io.github.proxgraph.vector.types.ByteSequence;
import io.github.proxgraph.vector.types.VectorFloat;

/**
 * Scalar-quantized codes, one byte per dimension.
 */
public class SQVectors extends ByteCodeVectors {
    private final ScalarQuantization sq;

    SQVectors(ScalarQuantization sq, int initialCapacity) {
        super(initialCapacity);
        this.sq = sq;
    }

    @Override
    public ScalarQuantization getCompressor() {
        return sq;
    }

    @Override
    public ScoreFunction.ApproximateScoreFunction precomputedScoreFunctionFor(VectorFloat<?> q, VectorSimilarityFunction similarityFunction) {
        var table = sq.partialTable(q, similarityFunction);
        switch (similarityFunction) {
            case EUCLIDEAN:
                return tableScoreFunction(table, ScalarQuantization.LEVELS, true);
            case DOT_PRODUCT:
                return tableScoreFunction(table, ScalarQuantization.LEVELS, false);
            case COSINE:
                float queryNorm = (float) Math.sqrt(VectorUtil.dotProduct(q, q));
                return cosineScoreFunction(table, sq.squaredLevels(), ScalarQuantization.LEVELS, queryNorm);
            default:
                throw new IllegalArgumentException("Unsupported similarity function " + similarityFunction);
        }
    }

    /** Convenience for tests and diagnostics. */
    public VectorFloat<?> decode(int ordinal) {
        ByteSequence<?> code = codeFor(ordinal);
        return sq.decode(code);
    }
}
