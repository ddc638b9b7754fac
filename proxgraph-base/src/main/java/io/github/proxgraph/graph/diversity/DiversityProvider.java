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

package io.github.proxgraph.graph.diversity;

import io.github.proxgraph.graph.NodeArray;
import io.github.proxgraph.util.FixedBitSet;

/**
 * Chooses which candidates become a node's neighbors.
 */
public interface DiversityProvider {
    /**
     * Updates {@code selected} with the positions of the diverse members of {@code neighbors}, considering
     * candidates best-first and stopping at {@code maxDegree}.  {@code neighbors} is not modified.
     *
     * @param neighbors candidates sorted best-first, scored against the base node
     * @param selected  positions (not node ids) of the candidates to keep
     */
    void retainDiverse(NodeArray neighbors, int maxDegree, FixedBitSet selected);

    /**
     * @return a new NodeArray holding the diverse subset of {@code candidates}
     */
    default NodeArray selectDiverse(NodeArray candidates, int maxDegree) {
        if (candidates.size() == 0) {
            return new NodeArray(0);
        }
        var selected = new FixedBitSet(candidates.size());
        retainDiverse(candidates, maxDegree, selected);
        var result = candidates.copy();
        result.retain(selected);
        return result;
    }
}
