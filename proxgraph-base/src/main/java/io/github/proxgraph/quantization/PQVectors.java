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
import io.github.proxgraph.vector.types.VectorFloat;

/**
 * Product-quantized codes, one byte per subspace.
 */
public class PQVectors extends ByteCodeVectors {
    final ProductQuantization pq;

    PQVectors(ProductQuantization pq, int initialCapacity) {
        super(initialCapacity);
        this.pq = pq;
    }

    @Override
    public ProductQuantization getCompressor() {
        return pq;
    }

    @Override
    public ScoreFunction.ApproximateScoreFunction precomputedScoreFunctionFor(VectorFloat<?> q, VectorSimilarityFunction similarityFunction) {
        var table = pq.partialTable(q, similarityFunction);
        int clusterCount = pq.getClusterCount();
        switch (similarityFunction) {
            case EUCLIDEAN:
                return tableScoreFunction(table, clusterCount, true);
            case DOT_PRODUCT:
                return tableScoreFunction(table, clusterCount, false);
            case COSINE:
                float queryNorm = (float) Math.sqrt(VectorUtil.dotProduct(q, q));
                return cosineScoreFunction(table, pq.squaredNorms(), clusterCount, queryNorm);
            default:
                throw new IllegalArgumentException("Unsupported similarity function " + similarityFunction);
        }
    }
}
