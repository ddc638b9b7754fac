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

import io.github.proxgraph.graph.OnHeapGraphIndex.NodeAtLevel;
import io.github.proxgraph.graph.diversity.DiversityProvider;
import io.github.proxgraph.graph.diversity.RelativeNeighborhoodDiversityProvider;
import io.github.proxgraph.graph.similarity.BuildScoreProvider;
import io.github.proxgraph.util.Bits;
import io.github.proxgraph.vector.types.VectorFloat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds and maintains a hierarchical navigable small world graph over vectors supplied by a
 * {@link BuildScoreProvider}.
 * <p>
 * Insertion draws a level for the new node, descends greedily from the entry point to that level, then runs a
 * beam search of width {@code efConstruction} on each remaining level and links the node to a diverse subset
 * of what it finds.  Edges are added in both directions; a neighbor list that overflows is pruned with the same
 * diversity heuristic.  The node is published only after every edge is in place.
 * <p>
 * Calls that mutate the graph must be serialized by the caller.  Searches may run concurrently with
 * {@link #addGraphNode} and {@link #markNodeDeleted}, but not with {@link #removeDeletedNodes}.
 */
public class GraphIndexBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(GraphIndexBuilder.class);

    /** Levels above this are never drawn. */
    public static final int MAX_LEVEL = 30;

    private final BuildScoreProvider scoreProvider;
    private final DiversityProvider diversityProvider;
    private final OnHeapGraphIndex graph;
    private final int efConstruction;
    private final double levelMultiplier;
    private final GraphSearcher searcher;

    /**
     * @param scoreProvider  scores the vectors being indexed; every node's vector must be readable through it
     *                       before the node is added
     * @param maxDegree      the degree bound M of the upper levels; level 0 allows 2M
     * @param efConstruction the beam width used to find neighbor candidates
     */
    public GraphIndexBuilder(BuildScoreProvider scoreProvider, int maxDegree, int efConstruction) {
        this(scoreProvider, new OnHeapGraphIndex(maxDegree), efConstruction);
    }

    /**
     * Continues building an existing graph, e.g. one that was just loaded.
     */
    public GraphIndexBuilder(BuildScoreProvider scoreProvider, OnHeapGraphIndex graph, int efConstruction) {
        if (efConstruction < 1) {
            throw new IllegalArgumentException("efConstruction must be positive, got " + efConstruction);
        }
        this.scoreProvider = scoreProvider;
        this.graph = graph;
        this.efConstruction = efConstruction;
        this.diversityProvider = new RelativeNeighborhoodDiversityProvider(scoreProvider);
        this.levelMultiplier = graph.maxDegree() > 1 ? 1 / Math.log(graph.maxDegree()) : 0;
        this.searcher = new GraphSearcher(graph);
    }

    public OnHeapGraphIndex getGraph() {
        return graph;
    }

    public DiversityProvider getDiversityProvider() {
        return diversityProvider;
    }

    /**
     * Draws a level from the geometric distribution {@code floor(-ln(U) * 1/ln(M))}.
     */
    public int randomLevel(Random random) {
        return randomLevel(random, levelMultiplier);
    }

    static int randomLevel(Random random, double levelMultiplier) {
        // 1 - nextDouble() is in (0, 1], so the log is finite
        double u = 1.0 - random.nextDouble();
        int level = (int) Math.floor(-Math.log(u) * levelMultiplier);
        return Math.min(level, MAX_LEVEL);
    }

    /**
     * Inserts a node at a randomly drawn level.
     *
     * @return the level the node was assigned
     */
    public int addGraphNode(int node, VectorFloat<?> vector, Random random) {
        int level = randomLevel(random);
        LOG.debug("Drew level {} for node {}", level, node);
        addGraphNode(node, vector, level);
        return level;
    }

    /**
     * Inserts a node on levels 0 through {@code level}.  If linking fails part way, the node is tombstoned so that
     * compaction can purge it, and the exception is rethrown.
     */
    public void addGraphNode(int node, VectorFloat<?> vector, int level) {
        if (graph.containsNode(node)) {
            throw new IllegalArgumentException("Node " + node + " is already in the graph");
        }
        NodeAtLevel entry = graph.entryNode();
        graph.addNode(node, level);
        try {
            if (entry != null) {
                linkNode(node, vector, level, entry);
            }
        } catch (RuntimeException e) {
            graph.markDeleted(node);
            throw e;
        }
        graph.markPublished(node);

        if (entry == null || level > entry.level) {
            graph.updateEntryNode(new NodeAtLevel(level, node));
        }
    }

    private void linkNode(int node, VectorFloat<?> vector, int level, NodeAtLevel entry) {
        var sf = scoreProvider.searchProviderFor(vector).scoreFunction();
        searcher.initialize(sf, entry);

        // greedy descent through the levels the new node will not be on
        for (int lvl = entry.level; lvl > level; lvl--) {
            searcher.searchOneLayer(sf, 1, lvl, Bits.ALL);
            searcher.setEntryPointsFromPreviousLayer();
        }

        int topLevel = Math.min(level, entry.level);
        var chosen = new NodeArray[topLevel + 1];
        for (int lvl = topLevel; lvl >= 0; lvl--) {
            searcher.searchOneLayer(sf, efConstruction, lvl, Bits.ALL);
            var candidates = searcher.currentResults();
            chosen[lvl] = diversityProvider.selectDiverse(candidates, graph.getDegree(lvl));
            searcher.setEntryPointsFromPreviousLayer();
        }

        for (int lvl = topLevel; lvl >= 0; lvl--) {
            graph.setNeighbors(lvl, node, chosen[lvl]);
        }
        for (int lvl = topLevel; lvl >= 0; lvl--) {
            var layer = graph.getLayer(lvl);
            var neighbors = chosen[lvl];
            for (int i = 0; i < neighbors.size(); i++) {
                layer.insertEdge(neighbors.getNode(i), node, neighbors.getScore(i), diversityProvider);
            }
        }
    }

    /**
     * Tombstones a node.  It stays in the graph as a waypoint until {@link #removeDeletedNodes} runs.
     */
    public void markNodeDeleted(int node) {
        graph.markDeleted(node);
    }

    /**
     * Purges tombstoned nodes.  Every surviving node that linked to a purged node gets a new neighbor list,
     * chosen by the diversity heuristic from its surviving neighbors plus the surviving neighbors of the nodes it
     * lost.  If the entry point is purged, the surviving node on the highest level (lowest ordinal on ties)
     * takes its place.
     * <p>
     * Must not run concurrently with searches or other mutations.
     *
     * @return the number of nodes purged
     */
    public int removeDeletedNodes() {
        var deleted = graph.getDeletedNodes();
        var toRemove = new ArrayList<Integer>();
        for (int node : graph.nodesOnLevel(0)) {
            if (deleted.get(node)) {
                toRemove.add(node);
            }
        }
        if (toRemove.isEmpty()) {
            return 0;
        }

        int repaired = 0;
        for (int level = 0; level < graph.levelCount(); level++) {
            repaired += repairLevel(level, deleted);
        }

        NodeAtLevel entry = graph.entryNode();
        for (int node : toRemove) {
            graph.removeNode(node);
        }
        if (entry != null && !graph.containsNode(entry.node)) {
            graph.updateEntryNode(findReplacementEntry());
        }

        LOG.info("Purged {} deleted nodes, repaired {} neighbor lists; entry point is now {}",
                 toRemove.size(), repaired, graph.entryNode());
        return toRemove.size();
    }

    private int repairLevel(int level, Bits deleted) {
        var layer = graph.getLayer(level);
        var affected = new ArrayList<ConcurrentNeighborMap.Neighbors>();
        layer.forEach((node, neighbors) -> {
            if (deleted.get(node)) {
                return;
            }
            for (int i = 0; i < neighbors.size(); i++) {
                if (deleted.get(neighbors.getNode(i))) {
                    affected.add(neighbors);
                    return;
                }
            }
        });

        for (var neighbors : affected) {
            int node = neighbors.nodeId;
            var candidates = new NodeArray(neighbors.size());
            List<Integer> lost = new ArrayList<>();
            for (int i = 0; i < neighbors.size(); i++) {
                int friend = neighbors.getNode(i);
                if (deleted.get(friend)) {
                    lost.add(friend);
                } else {
                    candidates.insertSorted(friend, neighbors.getScore(i));
                }
            }

            var sf = scoreProvider.diversityFunctionFor(node);
            for (int gone : lost) {
                var theirs = layer.get(gone);
                for (int i = 0; i < theirs.size(); i++) {
                    int candidate = theirs.getNode(i);
                    if (candidate == node || deleted.get(candidate) || !graph.isPublished(candidate)
                        || candidates.contains(candidate)) {
                        continue;
                    }
                    candidates.insertSorted(candidate, sf.similarityTo(candidate));
                }
            }
            layer.update(node, diversityProvider.selectDiverse(candidates, layer.maxDegree()));
        }
        return affected.size();
    }

    private NodeAtLevel findReplacementEntry() {
        for (int level = graph.levelCount() - 1; level >= 0; level--) {
            for (int node : graph.nodesOnLevel(level)) {
                if (graph.isPublished(node)) {
                    return new NodeAtLevel(level, node);
                }
            }
        }
        return null;
    }
}
