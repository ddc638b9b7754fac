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

import io.github.proxgraph.exceptions.InternalInconsistencyException;
import io.github.proxgraph.graph.OnHeapGraphIndex.NodeAtLevel;
import io.github.proxgraph.graph.similarity.DefaultSearchScoreProvider;
import io.github.proxgraph.graph.similarity.ScoreFunction;
import io.github.proxgraph.graph.similarity.SearchScoreProvider;
import io.github.proxgraph.util.Bits;
import io.github.proxgraph.util.BoundedLongHeap;
import io.github.proxgraph.util.GrowableLongHeap;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import io.github.proxgraph.vector.types.VectorFloat;
import org.agrona.collections.IntHashSet;

import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Searches a graph to find nearest neighbors to a query vector.
 * <p>
 * The search descends from the entry point, keeping only the single best node on each upper layer, then runs
 * a beam search of width {@code ef} on layer 0.  Nodes that are tombstoned or rejected by the caller's filter
 * are still traversed but never returned.  Nodes that are not yet published are skipped entirely.
 * <p>
 * A GraphSearcher is not threadsafe: only one search at a time should be run per GraphSearcher.
 */
public class GraphSearcher {
    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final OnHeapGraphIndex graph;

    // Scratch data structures that are used in each search. These can be expensive
    // to allocate, so they're cleared and reused across calls.
    private final NodeQueue candidates;
    private final NodeQueue approximateResults;
    private final NodeQueue rerankedResults;
    private final IntHashSet visited;

    private BooleanSupplier cancelled = NEVER_CANCELLED;

    private int visitedCount;
    private int expandedCount;
    private int expandedCountBaseLayer;

    public GraphSearcher(OnHeapGraphIndex graph) {
        this.graph = graph;
        this.candidates = new NodeQueue(new GrowableLongHeap(100), NodeQueue.Order.MAX_HEAP);
        this.approximateResults = new NodeQueue(new BoundedLongHeap(100), NodeQueue.Order.MIN_HEAP);
        this.rerankedResults = new NodeQueue(new BoundedLongHeap(100), NodeQueue.Order.MIN_HEAP);
        this.visited = new IntHashSet();
    }

    /**
     * Convenience function for simple one-off exact searches.  It is the caller's responsibility to make sure
     * that the graph was built with the same vectors and similarity function.
     */
    public static GraphSearchResult search(VectorFloat<?> queryVector,
                                           int topK,
                                           RandomAccessVectorValues vectors,
                                           VectorSimilarityFunction similarityFunction,
                                           OnHeapGraphIndex graph,
                                           Bits acceptOrds)
    {
        var ssp = DefaultSearchScoreProvider.exact(queryVector, similarityFunction, vectors);
        return new GraphSearcher(graph).search(ssp, topK, topK, acceptOrds);
    }

    public GraphSearchResult search(SearchScoreProvider scoreProvider, int topK, int ef, Bits acceptOrds) {
        return search(scoreProvider, topK, ef, acceptOrds, NEVER_CANCELLED);
    }

    /**
     * @param scoreProvider steers the traversal and, if it has a reranker, rescores the final candidates
     * @param topK          the number of results to return
     * @param ef            the beam width on layer 0; values below topK are raised to topK
     * @param acceptOrds    which nodes may be returned; use {@link Bits#ALL} to accept everything
     * @param isCancelled   polled before each frontier expansion
     * @return the best nodes found, best-first; empty if the graph has no entry point
     * @throws CancellationException if {@code isCancelled} returned true during the search
     * @throws InternalInconsistencyException if the traversal reaches a node that is not in the graph
     */
    public GraphSearchResult search(SearchScoreProvider scoreProvider,
                                    int topK,
                                    int ef,
                                    Bits acceptOrds,
                                    BooleanSupplier isCancelled)
    {
        if (acceptOrds == null) {
            throw new IllegalArgumentException("Use Bits.ALL to indicate that all ordinals are accepted, instead of null");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }
        NodeAtLevel entry = graph.entryNode();
        if (entry == null) {
            return GraphSearchResult.empty();
        }
        int rerankK = Math.max(ef, topK);

        this.cancelled = isCancelled;
        try {
            var sf = scoreProvider.scoreFunction();
            initialize(sf, entry);
            for (int level = entry.level; level > 0; level--) {
                searchOneLayer(sf, 1, level, Bits.ALL);
                setEntryPointsFromPreviousLayer();
            }
            searchOneLayer(sf, rerankK, 0, Bits.intersectionOf(acceptOrds, graph.liveNodes()));
            return collectResults(scoreProvider.reranker(), topK);
        } finally {
            this.cancelled = NEVER_CANCELLED;
        }
    }

    /**
     * Resets the scratch state and seeds the frontier with the entry point.
     */
    void initialize(ScoreFunction sf, NodeAtLevel entry) {
        approximateResults.clear();
        rerankedResults.clear();
        candidates.clear();
        visited.clear();
        visitedCount = 0;
        expandedCount = 0;
        expandedCountBaseLayer = 0;

        requireNode(entry.level, entry.node);
        visited.add(entry.node);
        visitedCount++;
        candidates.push(entry.node, sf.similarityTo(entry.node));
    }

    /**
     * Pushes the results found on the layer above back onto the frontier for the next layer down.
     */
    void setEntryPointsFromPreviousLayer() {
        approximateResults.foreach(candidates::push);
        approximateResults.clear();
    }

    /**
     * @return a copy of the current layer's results, best-first
     */
    NodeArray currentResults() {
        var results = new NodeArray(Math.max(approximateResults.size(), 1));
        approximateResults.foreach(results::insertSorted);
        return results;
    }

    /**
     * Expands the frontier on one layer until the best remaining candidate is worse than the worst of the
     * {@code rerankK} results collected so far.  When done, the internal results queue holds the best
     * accepted nodes found on this layer.
     */
    void searchOneLayer(ScoreFunction scoreFunction, int rerankK, int level, Bits acceptOrdsThisLayer) {
        try {
            assert approximateResults.size() == 0;
            approximateResults.setMaxSize(rerankK);

            while (candidates.size() > 0) {
                float topCandidateScore = candidates.topScore();
                // we're done when we have K results and the best candidate is worse than the worst result so far
                if (approximateResults.size() >= rerankK && topCandidateScore < approximateResults.topScore()) {
                    break;
                }
                if (cancelled.getAsBoolean()) {
                    throw new CancellationException("Search cancelled after expanding " + expandedCount + " nodes");
                }

                int topCandidateNode = candidates.pop();
                if (acceptOrdsThisLayer.get(topCandidateNode)) {
                    approximateResults.push(topCandidateNode, topCandidateScore);
                }

                if (level == 0) {
                    expandedCountBaseLayer++;
                }
                expandedCount++;

                var neighbors = requireNode(level, topCandidateNode);
                for (int i = 0; i < neighbors.size(); i++) {
                    int friend = neighbors.getNode(i);
                    if (!graph.isPublished(friend)) {
                        if (!graph.containsNode(friend)) {
                            throw new InternalInconsistencyException(String.format(
                                    "Node %d on level %d links to %d, which is not in the graph", topCandidateNode, level, friend));
                        }
                        // still being inserted
                        continue;
                    }
                    if (!visited.add(friend)) {
                        continue;
                    }
                    visitedCount++;
                    candidates.push(friend, scoreFunction.similarityTo(friend));
                }
            }
        } catch (Throwable t) {
            // clear scratch structures if terminated via throwable, as they may not have been drained
            approximateResults.clear();
            candidates.clear();
            throw t;
        }
    }

    private ConcurrentNeighborMap.Neighbors requireNode(int level, int node) {
        var neighbors = graph.getNeighbors(level, node);
        if (neighbors == null) {
            throw new InternalInconsistencyException(String.format("Node %d is missing from level %d", node, level));
        }
        return neighbors;
    }

    private GraphSearchResult collectResults(ScoreFunction.ExactScoreFunction reranker, int topK) {
        NodeQueue popFromQueue;
        int reranked = 0;
        if (reranker == null) {
            while (approximateResults.size() > topK) {
                approximateResults.pop();
            }
            popFromQueue = approximateResults;
        } else {
            rerankedResults.clear();
            rerankedResults.setMaxSize(topK);
            reranked = approximateResults.size();
            approximateResults.foreach((node, score) -> rerankedResults.push(node, reranker.similarityTo(node)));
            approximateResults.clear();
            popFromQueue = rerankedResults;
        }

        // the queue has the worst candidates at the top
        var nodes = new GraphSearchResult.NodeScore[popFromQueue.size()];
        for (int i = nodes.length - 1; i >= 0; i--) {
            var nScore = popFromQueue.topScore();
            var n = popFromQueue.pop();
            nodes[i] = new GraphSearchResult.NodeScore(n, nScore);
        }
        return new GraphSearchResult(nodes, visitedCount, expandedCount, expandedCountBaseLayer, reranked);
    }
}
