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
import io.github.proxgraph.vector.types.VectorFloat;

/** Interface for compressed vectors. */
public interface CompressedVectors {
    /**
     * @return the compressed size of each vector, in bytes
     */
    int getCompressedSize();

    VectorCompressor<?> getCompressor();

    /**
     * Precomputes partial scores for the given query against every centroid or quantization level, so that each
     * subsequent score is a table lookup per sub-code.  Suitable for a whole search.
     */
    ScoreFunction.ApproximateScoreFunction precomputedScoreFunctionFor(VectorFloat<?> q, VectorSimilarityFunction similarityFunction);

    /**
     * @return true if a code is present for the ordinal
     */
    boolean contains(int ordinal);

    /**
     * @return the number of vectors
     */
    int count();
}
