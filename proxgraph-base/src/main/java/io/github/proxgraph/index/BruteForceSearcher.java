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

package io.github.proxgraph.index;

import io.github.proxgraph.graph.GraphSearchResult.NodeScore;
import io.github.proxgraph.graph.NodeQueue;
import io.github.proxgraph.graph.RandomAccessVectorValues;
import io.github.proxgraph.util.Bits;
import io.github.proxgraph.util.BoundedLongHeap;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import io.github.proxgraph.vector.types.VectorFloat;

import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Exact top-k by scanning every vector.  Serves as ground truth for recall measurements.
 */
public final class BruteForceSearcher {
    private BruteForceSearcher() {}

    public static NodeScore[] search(VectorFloat<?> query, int topK, VectorSimilarityFunction similarityFunction,
                                     RandomAccessVectorValues vectors, Bits acceptOrds) {
        return search(query, topK, similarityFunction, vectors, acceptOrds, () -> false);
    }

    /**
     * @return the {@code topK} accepted vectors most similar to the query, best-first.  Empty ordinals are skipped.
     */
    public static NodeScore[] search(VectorFloat<?> query, int topK, VectorSimilarityFunction similarityFunction,
                                     RandomAccessVectorValues vectors, Bits acceptOrds, BooleanSupplier isCancelled) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }
        var results = new NodeQueue(new BoundedLongHeap(topK), NodeQueue.Order.MIN_HEAP);
        for (int i = 0; i < vectors.size(); i++) {
            if ((i & 1023) == 0 && isCancelled.getAsBoolean()) {
                throw new CancellationException("Exact search cancelled at ordinal " + i);
            }
            if (!acceptOrds.get(i)) {
                continue;
            }
            var v = vectors.getVector(i);
            if (v == null) {
                continue;
            }
            results.push(i, similarityFunction.compare(query, v));
        }

        var nodes = new NodeScore[results.size()];
        for (int i = nodes.length - 1; i >= 0; i--) {
            float score = results.topScore();
            nodes[i] = new NodeScore(results.pop(), score);
        }
        return nodes;
    }
}
