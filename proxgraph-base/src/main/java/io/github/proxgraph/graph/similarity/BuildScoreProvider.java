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

package io.github.proxgraph.graph.similarity;

import io.github.proxgraph.graph.RandomAccessVectorValues;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import io.github.proxgraph.vector.types.VectorFloat;

/**
 * Encapsulates comparing node distances for GraphIndexBuilder.  Construction always scores with
 * full-precision vectors.
 */
public interface BuildScoreProvider {
    /**
     * @return the similarity function the scores are computed with
     */
    VectorSimilarityFunction similarityFunction();

    /**
     * Creates a search score provider to use internally during construction.
     *
     * @param vector the vector being inserted
     */
    SearchScoreProvider searchProviderFor(VectorFloat<?> vector);

    /**
     * Creates a score function against an existing graph node, used by the diversity heuristic and when
     * repairing neighbor lists.
     */
    ScoreFunction.ExactScoreFunction diversityFunctionFor(int node1);

    /**
     * Returns a BSP that performs exact score comparisons using the given RandomAccessVectorValues and VectorSimilarityFunction.
     */
    static BuildScoreProvider randomAccessScoreProvider(RandomAccessVectorValues ravv, VectorSimilarityFunction similarityFunction) {
        return new BuildScoreProvider() {
            @Override
            public VectorSimilarityFunction similarityFunction() {
                return similarityFunction;
            }

            @Override
            public SearchScoreProvider searchProviderFor(VectorFloat<?> vector) {
                return DefaultSearchScoreProvider.exact(vector, similarityFunction, ravv);
            }

            @Override
            public ScoreFunction.ExactScoreFunction diversityFunctionFor(int node1) {
                var v = DefaultSearchScoreProvider.vectorOf(ravv, node1);
                return DefaultSearchScoreProvider.exactScoreFunction(v, similarityFunction, ravv);
            }
        };
    }
}
