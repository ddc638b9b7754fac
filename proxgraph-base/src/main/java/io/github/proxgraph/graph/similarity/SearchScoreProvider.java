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

/** Encapsulates comparing node distances to a specific vector for GraphSearcher. */
public interface SearchScoreProvider {
    /**
     * @return the function used to steer the traversal; may be approximate
     */
    ScoreFunction scoreFunction();

    /**
     * @return the exact function used to rerank the traversal's candidates, or null if the traversal
     * scores are final
     */
    ScoreFunction.ExactScoreFunction reranker();
}
