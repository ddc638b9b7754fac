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

import io.github.proxgraph.exceptions.InternalInconsistencyException;
import io.github.proxgraph.graph.RandomAccessVectorValues;
import io.github.proxgraph.quantization.CodebookGeneration;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import io.github.proxgraph.vector.types.VectorFloat;

/** Encapsulates comparing node distances to a specific vector for GraphSearcher. */
public final class DefaultSearchScoreProvider implements SearchScoreProvider {
    private final ScoreFunction scoreFunction;
    private final ScoreFunction.ExactScoreFunction reranker;

    public DefaultSearchScoreProvider(ScoreFunction scoreFunction) {
        this(scoreFunction, null);
    }

    /**
     * Generally, reranker will be null iff scoreFunction is an ExactScoreFunction.
     *
     * @param scoreFunction the primary, fast scoring function
     * @param reranker optional reranking function (may be null)
     */
    public DefaultSearchScoreProvider(ScoreFunction scoreFunction, ScoreFunction.ExactScoreFunction reranker) {
        assert scoreFunction != null;
        this.scoreFunction = scoreFunction;
        this.reranker = reranker;
    }

    @Override
    public ScoreFunction scoreFunction() {
        return scoreFunction;
    }

    @Override
    public ScoreFunction.ExactScoreFunction reranker() {
        return reranker;
    }

    /**
     * Creates a SearchScoreProvider for a single-pass search based on exact similarity.
     */
    public static DefaultSearchScoreProvider exact(VectorFloat<?> v, VectorSimilarityFunction vsf, RandomAccessVectorValues ravv) {
        return new DefaultSearchScoreProvider(exactScoreFunction(v, vsf, ravv));
    }

    /**
     * Creates a SearchScoreProvider that steers by the generation's lookup tables and reranks exactly.
     */
    public static DefaultSearchScoreProvider approximate(VectorFloat<?> v, VectorSimilarityFunction vsf,
                                                         CodebookGeneration generation, RandomAccessVectorValues ravv) {
        var exact = exactScoreFunction(v, vsf, ravv);
        return new DefaultSearchScoreProvider(generation.scoreFunctionFor(v, vsf, exact), exact);
    }

    public static ScoreFunction.ExactScoreFunction exactScoreFunction(VectorFloat<?> v, VectorSimilarityFunction vsf, RandomAccessVectorValues ravv) {
        return node2 -> vsf.compare(v, vectorOf(ravv, node2));
    }

    static VectorFloat<?> vectorOf(RandomAccessVectorValues ravv, int node) {
        var vector = ravv.getVector(node);
        if (vector == null) {
            throw new InternalInconsistencyException("No vector for graph node " + node);
        }
        return vector;
    }
}
