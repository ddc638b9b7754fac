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
import io.github.proxgraph.graph.similarity.BuildScoreProvider;
import io.github.proxgraph.util.FixedBitSet;

/**
 * The relative-neighborhood heuristic: a candidate is kept only if it is at least as similar to the
 * base node as it is to every neighbor already kept.  Candidates are visited best-first, so the
 * nearest candidate is always kept and equal scores favor the lower node id.
 */
public class RelativeNeighborhoodDiversityProvider implements DiversityProvider {
    /** used to compute diversity */
    private final BuildScoreProvider scoreProvider;

    public RelativeNeighborhoodDiversityProvider(BuildScoreProvider scoreProvider) {
        this.scoreProvider = scoreProvider;
    }

    @Override
    public void retainDiverse(NodeArray neighbors, int maxDegree, FixedBitSet selected) {
        int nSelected = 0;
        for (int i = 0; i < neighbors.size() && nSelected < maxDegree; i++) {
            int cNode = neighbors.getNode(i);
            float cScore = neighbors.getScore(i);
            if (nSelected == 0 || isDiverse(cNode, cScore, neighbors, selected)) {
                selected.set(i);
                nSelected++;
            }
        }
    }

    // is the candidate node with the given score closer to the base node than it is to any of the
    // already-selected neighbors
    private boolean isDiverse(int node, float score, NodeArray others, FixedBitSet selected) {
        var sf = scoreProvider.diversityFunctionFor(node);
        for (int i = selected.nextSetBit(0); i != FixedBitSet.NO_MORE_BITS; i = selected.nextSetBit(i + 1)) {
            int otherNode = others.getNode(i);
            if (sf.similarityTo(otherNode) > score) {
                return false;
            }
        }
        return true;
    }
}
