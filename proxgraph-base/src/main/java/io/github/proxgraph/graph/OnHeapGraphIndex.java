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

import io.github.proxgraph.util.Bits;
import io.github.proxgraph.util.GrowableAtomicBitSet;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An in-memory multi-layer proximity graph.  Nodes are dense int ordinals; layer 0 holds every node and
 * each higher layer a subset of the one below.
 * <p>
 * A node moves through {@code absent -> active -> tombstoned -> purged}.  It is added to its layers
 * unpublished, becomes visible to searches only once {@link #markPublished} is called after all of its
 * edges are installed, is hidden from results by {@link #markDeleted}, and is physically removed by
 * {@link #removeNode}.
 * <p>
 * Reads are lock-free.  Mutations must be serialized by the caller.
 */
public class OnHeapGraphIndex {
    private final int maxDegree;

    // layers.get(i) is the neighbor map for level i
    private final List<ConcurrentNeighborMap> layers = new CopyOnWriteArrayList<>();
    private final AtomicReference<NodeAtLevel> entryPoint = new AtomicReference<>();

    private final GrowableAtomicBitSet published = new GrowableAtomicBitSet(1024);
    private final GrowableAtomicBitSet deleted = new GrowableAtomicBitSet(1024);
    private final AtomicInteger maxNodeId = new AtomicInteger(-1);

    private final Bits liveNodes = node -> published.get(node) && !deleted.get(node);

    /**
     * @param maxDegree the degree bound M of the upper layers; layer 0 allows {@code 2 * M}
     */
    public OnHeapGraphIndex(int maxDegree) {
        if (maxDegree < 1) {
            throw new IllegalArgumentException("maxDegree must be positive, got " + maxDegree);
        }
        this.maxDegree = maxDegree;
    }

    /**
     * @return the degree bound for the given level
     */
    public int getDegree(int level) {
        return level == 0 ? 2 * maxDegree : maxDegree;
    }

    public int maxDegree() {
        return maxDegree;
    }

    /**
     * Adds an unpublished node with empty neighbor lists on levels 0 through {@code level}.
     */
    public void addNode(int node, int level) {
        if (level < 0) {
            throw new IllegalArgumentException("level must be non-negative, got " + level);
        }
        while (layers.size() <= level) {
            layers.add(new ConcurrentNeighborMap(getDegree(layers.size())));
        }
        for (int l = 0; l <= level; l++) {
            layers.get(l).addNode(node);
        }
        maxNodeId.accumulateAndGet(node, Math::max);
    }

    /**
     * @return the neighbors of the node at the given level, or null if the node is not on that level
     */
    public ConcurrentNeighborMap.Neighbors getNeighbors(int level, int node) {
        if (level >= layers.size()) {
            return null;
        }
        return layers.get(level).get(node);
    }

    public void setNeighbors(int level, int node, NodeArray neighbors) {
        layers.get(level).update(node, neighbors);
    }

    ConcurrentNeighborMap getLayer(int level) {
        return layers.get(level);
    }

    /**
     * @return the number of levels that currently hold any node
     */
    public int levelCount() {
        return layers.size();
    }

    /**
     * @return the highest level the node is on, or -1 if the node is not in the graph
     */
    public int getNodeLevel(int node) {
        for (int l = layers.size() - 1; l >= 0; l--) {
            if (layers.get(l).contains(node)) {
                return l;
            }
        }
        return -1;
    }

    public boolean containsNode(int node) {
        return !layers.isEmpty() && layers.get(0).contains(node);
    }

    /**
     * @return the number of nodes in the graph, including unpublished and tombstoned ones
     */
    public int size() {
        return layers.isEmpty() ? 0 : layers.get(0).size();
    }

    /**
     * @return one past the highest ordinal ever added
     */
    public int getIdUpperBound() {
        return maxNodeId.get() + 1;
    }

    /**
     * @return the entry point, or null if the graph is empty
     */
    public NodeAtLevel entryNode() {
        return entryPoint.get();
    }

    public void updateEntryNode(NodeAtLevel newEntry) {
        entryPoint.set(newEntry);
    }

    /**
     * @return the level of the entry point, or -1 if the graph is empty
     */
    public int getMaxLevel() {
        var entry = entryPoint.get();
        return entry == null ? -1 : entry.level;
    }

    public void markPublished(int node) {
        published.set(node);
    }

    public boolean isPublished(int node) {
        return published.get(node);
    }

    public void markDeleted(int node) {
        deleted.set(node);
    }

    public boolean isDeleted(int node) {
        return deleted.get(node);
    }

    public Bits getDeletedNodes() {
        return deleted;
    }

    public int deletedCount() {
        return deleted.cardinality();
    }

    /**
     * @return nodes that are published and not tombstoned
     */
    public Bits liveNodes() {
        return liveNodes;
    }

    /**
     * Physically removes a node from every level.  Neighbor lists that point at it must be repaired separately.
     */
    public void removeNode(int node) {
        published.clear(node);
        for (var layer : layers) {
            layer.remove(node);
        }
        deleted.clear(node);
        // drop empty top levels so the level count tracks the surviving nodes
        while (layers.size() > 1 && layers.get(layers.size() - 1).size() == 0) {
            layers.remove(layers.size() - 1);
        }
    }

    /**
     * @return nodes on the given level, in ascending order
     */
    public List<Integer> nodesOnLevel(int level) {
        var result = new ArrayList<Integer>();
        if (level < layers.size()) {
            layers.get(level).forEach((node, neighbors) -> result.add(node));
        }
        return result;
    }

    /**
     * @return the number of nodes on each level, index 0 first
     */
    public int[] layerHistogram() {
        int[] histogram = new int[layers.size()];
        for (int l = 0; l < histogram.length; l++) {
            histogram[l] = layers.get(l).size();
        }
        return histogram;
    }

    /**
     * @return the mean out-degree of live nodes on level 0
     */
    public double getAverageDegree() {
        if (layers.isEmpty()) {
            return 0;
        }
        long[] totals = new long[2];
        layers.get(0).forEach((node, neighbors) -> {
            if (liveNodes.get(node)) {
                totals[0] += neighbors.size();
                totals[1]++;
            }
        });
        return totals[1] == 0 ? 0 : (double) totals[0] / totals[1];
    }

    @Override
    public String toString() {
        return String.format("OnHeapGraphIndex(size=%d, levels=%d, entry=%s)", size(), layers.size(), entryPoint.get());
    }

    /**
     * A node together with the highest level it appears on.
     */
    public static final class NodeAtLevel implements Comparable<NodeAtLevel> {
        public final int level;
        public final int node;

        public NodeAtLevel(int level, int node) {
            assert level >= 0 : level;
            assert node >= 0 : node;
            this.level = level;
            this.node = node;
        }

        @Override
        public int compareTo(NodeAtLevel other) {
            if (this.level == other.level) {
                return Integer.compare(this.node, other.node);
            }
            return Integer.compare(this.level, other.level);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof NodeAtLevel)) return false;
            NodeAtLevel that = (NodeAtLevel) o;
            return level == that.level && node == that.node;
        }

        @Override
        public int hashCode() {
            return 31 * level + node;
        }

        @Override
        public String toString() {
            return "NodeAtLevel(level=" + level + ", node=" + node + ")";
        }
    }
}
