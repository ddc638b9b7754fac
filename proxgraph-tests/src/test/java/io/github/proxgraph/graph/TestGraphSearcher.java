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
import io.github.proxgraph.exceptions.InternalInconsistencyException;
import io.github.proxgraph.graph.similarity.DefaultSearchScoreProvider;
import io.github.proxgraph.graph.similarity.ScoreFunction;
import io.github.proxgraph.graph.similarity.SearchScoreProvider;
import io.github.proxgraph.index.BruteForceSearcher;
import io.github.proxgraph.util.Bits;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import io.github.proxgraph.vector.types.VectorFloat;
import org.junit.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.proxgraph.TestUtil.createRandomVectors;
import static io.github.proxgraph.TestUtil.randomVector;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestGraphSearcher extends ProxGraphTestCase {
    private static final VectorSimilarityFunction vsf = VectorSimilarityFunction.EUCLIDEAN;

    private List<VectorFloat<?>> vectors;
    private ListRandomAccessVectorValues ravv;

    private OnHeapGraphIndex build(int count, int dimension, int maxDegree) {
        vectors = createRandomVectors(getRandom(), count, dimension);
        ravv = new ListRandomAccessVectorValues(vectors, dimension);
        return TestUtil.buildGraph(ravv, vsf, maxDegree, 50, new Random(randomLong())).getGraph();
    }

    @Test
    public void testEmptyGraph() {
        var graph = new OnHeapGraphIndex(4);
        var ravv = new ListRandomAccessVectorValues(List.of(), 4);
        var result = GraphSearcher.search(randomVector(getRandom(), 4), 5, ravv, vsf, graph, Bits.ALL);
        assertEquals(0, result.getNodes().length);
        assertEquals(0, result.getVisitedCount());
    }

    @Test
    public void testInvalidArguments() {
        var graph = build(10, 4, 4);
        var ssp = DefaultSearchScoreProvider.exact(vectors.get(0), vsf, ravv);
        var searcher = new GraphSearcher(graph);
        try {
            searcher.search(ssp, 0, 10, Bits.ALL);
            fail();
        } catch (IllegalArgumentException expected) {
        }
        try {
            searcher.search(ssp, 1, 10, null);
            fail();
        } catch (IllegalArgumentException expected) {
        }
    }

    @Test
    public void testResultsAreBestFirst() {
        var graph = build(300, 8, 8);
        var query = randomVector(getRandom(), 8);
        var result = new GraphSearcher(graph).search(DefaultSearchScoreProvider.exact(query, vsf, ravv), 20, 40, Bits.ALL);
        var nodes = result.getNodes();
        assertEquals(20, nodes.length);
        for (int i = 1; i < nodes.length; i++) {
            assertTrue(nodes[i - 1].compareTo(nodes[i]) <= 0);
            assertEquals(vsf.compare(query, vectors.get(nodes[i].node)), nodes[i].score, 1e-6f);
        }
        assertTrue(result.getVisitedCount() >= 20);
        assertTrue(result.getExpandedCountBaseLayer() <= result.getExpandedCount());
    }

    @Test
    public void testAcceptOrdsFilterResults() {
        var graph = build(300, 8, 8);
        Bits even = node -> node % 2 == 0;
        var result = GraphSearcher.search(randomVector(getRandom(), 8), 10, ravv, vsf, graph, even);
        assertEquals(10, result.getNodes().length);
        for (var ns : result.getNodes()) {
            assertEquals(0, ns.node % 2);
        }
    }

    @Test
    public void testTombstonesAreNotReturned() {
        var graph = build(100, 4, 8);
        for (int i = 0; i < 100; i += 3) {
            graph.markDeleted(i);
        }
        var result = GraphSearcher.search(vectors.get(0), 100, ravv, vsf, graph, Bits.ALL);
        assertEquals(66, result.getNodes().length);
        for (var ns : result.getNodes()) {
            assertTrue(ns.node % 3 != 0);
        }
    }

    @Test
    public void testUnpublishedNodesAreInvisible() {
        var graph = build(50, 4, 8);
        var extra = randomVector(getRandom(), 4);
        vectors.add(extra);
        // a half-inserted node: present and linked from node 0, but not yet published
        graph.addNode(50, 0);
        graph.getLayer(0).insertEdge(0, 50, 1f, (neighbors, maxDegree, selected) -> {
            for (int i = 0; i < Math.min(maxDegree, neighbors.size()); i++) {
                selected.set(i);
            }
        });

        var result = GraphSearcher.search(extra, 51, ravv, vsf, graph, Bits.ALL);
        assertEquals(50, result.getNodes().length);
        assertFalse(TestUtil.nodes(result).contains(50));
    }

    @Test(expected = InternalInconsistencyException.class)
    public void testDanglingNeighborIsFatal() {
        var graph = build(20, 4, 8);
        var broken = new NodeArray(1);
        broken.addInOrder(999, 1f);
        for (int node : graph.nodesOnLevel(0)) {
            graph.setNeighbors(0, node, broken);
        }
        GraphSearcher.search(vectors.get(0), 5, ravv, vsf, graph, Bits.ALL);
    }

    @Test
    public void testCancellation() {
        var graph = build(500, 8, 8);
        var searcher = new GraphSearcher(graph);
        var query = randomVector(getRandom(), 8);
        var ssp = DefaultSearchScoreProvider.exact(query, vsf, ravv);

        var polls = new AtomicInteger();
        try {
            searcher.search(ssp, 10, 100, Bits.ALL, () -> polls.incrementAndGet() > 5);
            fail("search should have been cancelled");
        } catch (CancellationException expected) {
        }
        assertEquals(6, polls.get());

        // the searcher is reusable after a cancelled search
        var result = searcher.search(ssp, 10, 100, Bits.ALL);
        assertEquals(10, result.getNodes().length);
    }

    @Test
    public void testLargerEfDoesNotLowerRecall() {
        int dimension = 32;
        var graph = build(2000, dimension, 6);
        var searcher = new GraphSearcher(graph);
        int topK = 10;
        double narrow = 0;
        double wide = 0;
        int queries = 100;
        for (int q = 0; q < queries; q++) {
            var query = randomVector(getRandom(), dimension);
            var truth = BruteForceSearcher.search(query, topK, vsf, ravv, Bits.ALL);
            var ssp = DefaultSearchScoreProvider.exact(query, vsf, ravv);
            narrow += TestUtil.recall(truth, searcher.search(ssp, topK, topK, Bits.ALL).getNodes(), topK);
            wide += TestUtil.recall(truth, searcher.search(ssp, topK, 10 * topK, Bits.ALL).getNodes(), topK);
        }
        assertTrue(String.format("ef=%d recall %.3f, ef=%d recall %.3f", topK, narrow / queries, 10 * topK, wide / queries),
                   wide >= narrow);
    }

    @Test
    public void testRerankerDecidesFinalOrder() {
        var graph = build(200, 8, 8);
        var query = randomVector(getRandom(), 8);
        var exact = DefaultSearchScoreProvider.exactScoreFunction(query, vsf, ravv);
        // steer with a deliberately coarse score; the reranker must restore the exact order
        ScoreFunction.ApproximateScoreFunction coarse = node -> Math.round(exact.similarityTo(node) * 2) / 2f;
        SearchScoreProvider ssp = new DefaultSearchScoreProvider(coarse, exact);

        var result = new GraphSearcher(graph).search(ssp, 5, 50, Bits.ALL);
        assertEquals(5, result.getNodes().length);
        assertTrue(result.getRerankedCount() >= 5);
        for (var ns : result.getNodes()) {
            assertEquals(exact.similarityTo(ns.node), ns.score, 0f);
        }
        for (int i = 1; i < 5; i++) {
            assertTrue(result.getNodes()[i - 1].score >= result.getNodes()[i].score);
        }
    }
}
