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

package io.github.proxgraph.graph;

import io.github.proxgraph.ProxGraphTestCase;
import io.github.proxgraph.TestUtil;
import io.github.proxgraph.graph.OnHeapGraphIndex.NodeAtLevel;
import io.github.proxgraph.graph.similarity.BuildScoreProvider;
import io.github.proxgraph.graph.similarity.DefaultSearchScoreProvider;
import io.github.proxgraph.index.BruteForceSearcher;
import io.github.proxgraph.util.Bits;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import org.junit.Test;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Random;

import static io.github.proxgraph.TestUtil.createRandomVectors;
import static io.github.proxgraph.TestUtil.randomVector;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TestGraphIndexBuilder extends ProxGraphTestCase {
    @Test
    public void testLevelDistributionIsGeometric() {
        var random = new Random(randomLong());
        double multiplier = 1 / Math.log(16);
        int draws = 20_000;
        int aboveZero = 0;
        int aboveOne = 0;
        for (int i = 0; i < draws; i++) {
            int level = GraphIndexBuilder.randomLevel(random, multiplier);
            assertTrue(level >= 0 && level <= GraphIndexBuilder.MAX_LEVEL);
            if (level >= 1) {
                aboveZero++;
            }
            if (level >= 2) {
                aboveOne++;
            }
        }
        // P(level >= l) = M^-l
        assertTrue("aboveZero=" + aboveZero, aboveZero > 1000 && aboveZero < 1500);
        assertTrue("aboveOne=" + aboveOne, aboveOne < 200);
    }

    @Test
    public void testSameSeedBuildsSameGraph() {
        var vectors = createRandomVectors(getRandom(), 200, 8);
        var ravv = new ListRandomAccessVectorValues(vectors, 8);
        long seed = randomLong();
        var a = TestUtil.buildGraph(ravv, VectorSimilarityFunction.EUCLIDEAN, 6, 30, new Random(seed)).getGraph();
        var b = TestUtil.buildGraph(ravv, VectorSimilarityFunction.EUCLIDEAN, 6, 30, new Random(seed)).getGraph();

        assertEquals(a.entryNode(), b.entryNode());
        for (int level = 0; level < a.levelCount(); level++) {
            for (int node : a.nodesOnLevel(level)) {
                var na = a.getNeighbors(level, node);
                var nb = b.getNeighbors(level, node);
                assertEquals(na.size(), nb.size());
                for (int i = 0; i < na.size(); i++) {
                    assertEquals(na.getNode(i), nb.getNode(i));
                }
            }
        }
    }

    @Test
    public void testRecallAgainstBruteForce() {
        int dimension = 16;
        var vectors = createRandomVectors(getRandom(), 1000, dimension);
        var ravv = new ListRandomAccessVectorValues(vectors, dimension);
        var vsf = VectorSimilarityFunction.EUCLIDEAN;
        var graph = TestUtil.buildGraph(ravv, vsf, 16, 100, new Random(randomLong())).getGraph();

        int topK = 10;
        double total = 0;
        int queries = 100;
        for (int q = 0; q < queries; q++) {
            var query = randomVector(getRandom(), dimension);
            var truth = BruteForceSearcher.search(query, topK, vsf, ravv, Bits.ALL);
            var ssp = DefaultSearchScoreProvider.exact(query, vsf, ravv);
            var found = new GraphSearcher(graph).search(ssp, topK, 50, Bits.ALL);
            total += TestUtil.recall(truth, found.getNodes(), topK);
        }
        double recall = total / queries;
        assertTrue("recall was " + recall, recall >= 0.9);
    }

    @Test
    public void testEveryVectorFindsItself() {
        int dimension = 8;
        var vectors = createRandomVectors(getRandom(), 300, dimension);
        var ravv = new ListRandomAccessVectorValues(vectors, dimension);
        var vsf = VectorSimilarityFunction.EUCLIDEAN;
        var graph = TestUtil.buildGraph(ravv, vsf, 16, 100, new Random(randomLong())).getGraph();

        var searcher = new GraphSearcher(graph);
        for (int i = 0; i < vectors.size(); i++) {
            var ssp = DefaultSearchScoreProvider.exact(vectors.get(i), vsf, ravv);
            var result = searcher.search(ssp, 1, 50, Bits.ALL);
            assertEquals(1, result.getNodes().length);
            assertEquals(i, result.getNodes()[0].node);
            assertEquals(0f, vsf.toReportedScore(result.getNodes()[0].score), 0f);
        }
    }

    @Test
    public void testDegreeBoundsAndReachability() {
        var vectors = createRandomVectors(getRandom(), 500, 8);
        var ravv = new ListRandomAccessVectorValues(vectors, 8);
        var graph = TestUtil.buildGraph(ravv, VectorSimilarityFunction.COSINE, 8, 50, new Random(randomLong())).getGraph();

        assertEquals(500, graph.size());
        assertDegreesBounded(graph);
        assertLevel0Reachable(graph);
        assertEquals(graph.levelCount() - 1, graph.getMaxLevel());
    }

    @Test
    public void testFirstNodeBecomesEntryPoint() {
        var vectors = createRandomVectors(getRandom(), 2, 4);
        var ravv = new ListRandomAccessVectorValues(vectors, 4);
        var builder = new GraphIndexBuilder(BuildScoreProvider.randomAccessScoreProvider(ravv, VectorSimilarityFunction.EUCLIDEAN), 4, 10);
        assertNull(builder.getGraph().entryNode());

        builder.addGraphNode(0, vectors.get(0), 1);
        assertEquals(new NodeAtLevel(1, 0), builder.getGraph().entryNode());
        builder.addGraphNode(1, vectors.get(1), 3);
        assertEquals(new NodeAtLevel(3, 1), builder.getGraph().entryNode());
        assertTrue(builder.getGraph().getNeighbors(1, 0).contains(1));
        assertTrue(builder.getGraph().getNeighbors(0, 1).contains(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAddingANodeTwiceFails() {
        var vectors = createRandomVectors(getRandom(), 1, 4);
        var ravv = new ListRandomAccessVectorValues(vectors, 4);
        var builder = TestUtil.buildGraph(ravv, VectorSimilarityFunction.EUCLIDEAN, 4, 10, new Random(1));
        builder.addGraphNode(0, vectors.get(0), 0);
    }

    @Test
    public void testRemoveDeletedNodes() {
        int dimension = 8;
        var vectors = createRandomVectors(getRandom(), 500, dimension);
        var ravv = new ListRandomAccessVectorValues(vectors, dimension);
        var vsf = VectorSimilarityFunction.EUCLIDEAN;
        var builder = TestUtil.buildGraph(ravv, vsf, 8, 50, new Random(randomLong()));
        var graph = builder.getGraph();
        assertEquals(0, builder.removeDeletedNodes());

        var deleted = new HashSet<Integer>();
        // always include the entry point, so it has to move
        deleted.add(graph.entryNode().node);
        while (deleted.size() < 150) {
            deleted.add(randomIntBetween(0, 499));
        }
        deleted.forEach(builder::markNodeDeleted);

        assertEquals(150, builder.removeDeletedNodes());
        assertEquals(350, graph.size());
        assertEquals(0, graph.deletedCount());
        var entry = graph.entryNode();
        assertNotNull(entry);
        assertFalse(deleted.contains(entry.node));
        assertEquals(graph.levelCount() - 1, entry.level);
        for (int level = 0; level < graph.levelCount(); level++) {
            for (int node : graph.nodesOnLevel(level)) {
                assertFalse(deleted.contains(node));
                var neighbors = graph.getNeighbors(level, node);
                for (int i = 0; i < neighbors.size(); i++) {
                    assertFalse("dangling edge " + node + " -> " + neighbors.getNode(i), deleted.contains(neighbors.getNode(i)));
                }
            }
        }
        assertDegreesBounded(graph);

        int topK = 10;
        double total = 0;
        for (int q = 0; q < 50; q++) {
            var query = randomVector(getRandom(), dimension);
            var truth = BruteForceSearcher.search(query, topK, vsf, ravv, graph.liveNodes());
            var found = new GraphSearcher(graph).search(DefaultSearchScoreProvider.exact(query, vsf, ravv), topK, 50, Bits.ALL);
            total += TestUtil.recall(truth, found.getNodes(), topK);
        }
        assertTrue("recall after compaction was " + total / 50, total / 50 >= 0.8);
    }

    @Test
    public void testRemovingEveryNodeEmptiesTheGraph() {
        var vectors = createRandomVectors(getRandom(), 20, 4);
        var ravv = new ListRandomAccessVectorValues(vectors, 4);
        var builder = TestUtil.buildGraph(ravv, VectorSimilarityFunction.EUCLIDEAN, 4, 10, new Random(randomLong()));
        for (int i = 0; i < 20; i++) {
            builder.markNodeDeleted(i);
        }
        assertEquals(20, builder.removeDeletedNodes());
        assertEquals(0, builder.getGraph().size());
        assertNull(builder.getGraph().entryNode());
        assertEquals(0, GraphSearcher.search(vectors.get(0), 3, ravv, VectorSimilarityFunction.EUCLIDEAN,
                                             builder.getGraph(), Bits.ALL).getNodes().length);
    }

    static void assertDegreesBounded(OnHeapGraphIndex graph) {
        for (int level = 0; level < graph.levelCount(); level++) {
            for (int node : graph.nodesOnLevel(level)) {
                var neighbors = graph.getNeighbors(level, node);
                assertTrue(neighbors.size() <= graph.getDegree(level));
                assertFalse("self loop at " + node, neighbors.contains(node));
            }
        }
    }

    static void assertLevel0Reachable(OnHeapGraphIndex graph) {
        var seen = new HashSet<Integer>();
        var queue = new ArrayDeque<Integer>();
        queue.add(graph.entryNode().node);
        seen.add(graph.entryNode().node);
        while (!queue.isEmpty()) {
            var neighbors = graph.getNeighbors(0, queue.poll());
            for (int i = 0; i < neighbors.size(); i++) {
                if (seen.add(neighbors.getNode(i))) {
                    queue.add(neighbors.getNode(i));
                }
            }
        }
        assertEquals(graph.size(), seen.size());
    }
}
