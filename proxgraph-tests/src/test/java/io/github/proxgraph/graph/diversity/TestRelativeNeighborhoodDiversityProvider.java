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

import io.github.proxgraph.ProxGraphTestCase;
import io.github.proxgraph.graph.ListRandomAccessVectorValues;
import io.github.proxgraph.graph.NodeArray;
import io.github.proxgraph.graph.similarity.BuildScoreProvider;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import org.junit.Test;

import java.util.List;

import static io.github.proxgraph.TestUtil.vector;
import static org.junit.Assert.assertEquals;

public class TestRelativeNeighborhoodDiversityProvider extends ProxGraphTestCase {
    // node 0 is the base; the candidates are scored against it
    private final ListRandomAccessVectorValues ravv = new ListRandomAccessVectorValues(List.of(
            vector(0, 0),
            vector(1, 0),
            vector(2, 0),
            vector(0, 1),
            vector(1, 0)), 2);
    private final DiversityProvider provider =
            new RelativeNeighborhoodDiversityProvider(BuildScoreProvider.randomAccessScoreProvider(ravv, VectorSimilarityFunction.EUCLIDEAN));

    private NodeArray candidates(int... nodes) {
        var sf = BuildScoreProvider.randomAccessScoreProvider(ravv, VectorSimilarityFunction.EUCLIDEAN).diversityFunctionFor(0);
        var array = new NodeArray(nodes.length);
        for (int node : nodes) {
            array.insertSorted(node, sf.similarityTo(node));
        }
        return array;
    }

    @Test
    public void testShadowedCandidateIsPruned() {
        // 2 is closer to 1 than to the base, so 1 shadows it; 3 is not shadowed
        var selected = provider.selectDiverse(candidates(2, 3, 1), 4);
        assertEquals(2, selected.size());
        assertEquals(1, selected.getNode(0));
        assertEquals(3, selected.getNode(1));
    }

    @Test
    public void testMaxDegreeIsRespected() {
        var selected = provider.selectDiverse(candidates(1, 2, 3), 1);
        assertEquals(1, selected.size());
        assertEquals(1, selected.getNode(0));
    }

    @Test
    public void testTiesFavorLowerNode() {
        // 1 and 4 are the same point: whichever is considered first shadows the other
        var selected = provider.selectDiverse(candidates(4, 1), 4);
        assertEquals(1, selected.size());
        assertEquals(1, selected.getNode(0));
    }

    @Test
    public void testEmptyCandidates() {
        assertEquals(0, provider.selectDiverse(new NodeArray(0), 4).size());
    }
}
