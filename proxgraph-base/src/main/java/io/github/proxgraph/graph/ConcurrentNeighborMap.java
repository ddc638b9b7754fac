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

import io.github.proxgraph.graph.diversity.DiversityProvider;
import io.github.proxgraph.util.DenseIntMap;
import io.github.proxgraph.util.IntMap;

/**
 * Encapsulates operations on one layer of a graph's neighbors.
 * <p>
 * Each node's neighbor list is an immutable {@link Neighbors} snapshot that is replaced with a
 * compare-and-set, so a reader always sees either the old list or the new one, never a mix.
 */
public class ConcurrentNeighborMap {
    final IntMap<Neighbors> neighbors;

    /** the maximum number of neighbors a node may have */
    final int maxDegree;

    public ConcurrentNeighborMap(int maxDegree) {
        this(new DenseIntMap<>(1024), maxDegree);
    }

    ConcurrentNeighborMap(IntMap<Neighbors> neighbors, int maxDegree) {
        this.neighbors = neighbors;
        this.maxDegree = maxDegree;
    }

    /**
     * Replaces the neighbors of {@code nodeId}.  {@code newNeighbors} must already respect the degree bound.
     */
    public void update(int nodeId, NodeArray newNeighbors) {
        if (newNeighbors.size() > maxDegree) {
            throw new IllegalArgumentException(String.format("%d neighbors exceeds max degree %d", newNeighbors.size(), maxDegree));
        }
        while (true) {
            var old = neighbors.get(nodeId);
            if (old == null) {
                throw new IllegalStateException("Node " + nodeId + " is not in this layer");
            }
            var next = new Neighbors(nodeId, newNeighbors.copy());
            if (neighbors.compareAndPut(nodeId, old, next)) {
                return;
            }
        }
    }

    /**
     * Adds an edge from {@code nodeId} to {@code neighborId}.  If that takes the list over the degree
     * bound, the list is pruned back with the diversity heuristic.
     */
    public void insertEdge(int nodeId, int neighborId, float score, DiversityProvider diversityProvider) {
        while (true) {
            var old = neighbors.get(nodeId);
            if (old == null) {
                throw new IllegalStateException("Node " + nodeId + " is not in this layer");
            }
            if (old.contains(neighborId)) {
                return;
            }
            NodeArray merged = old.copy(old.size() + 1);
            merged.insertSorted(neighborId, score);
            if (merged.size() > maxDegree) {
                merged = diversityProvider.selectDiverse(merged, maxDegree);
            }
            var next = new Neighbors(nodeId, merged);
            if (neighbors.compareAndPut(nodeId, old, next)) {
                return;
            }
        }
    }

    public Neighbors get(int node) {
        return neighbors.get(node);
    }

    public int size() {
        return neighbors.size();
    }

    public void addNode(int nodeId) {
        addNode(nodeId, new NodeArray(0));
    }

    void addNode(int nodeId, NodeArray nodes) {
        var next = new Neighbors(nodeId, nodes);
        if (!neighbors.compareAndPut(nodeId, null, next)) {
            throw new IllegalStateException("Node " + nodeId + " already exists");
        }
    }

    public Neighbors remove(int node) {
        return neighbors.remove(node);
    }

    public boolean contains(int nodeId) {
        return neighbors.containsKey(nodeId);
    }

    public int maxDegree() {
        return maxDegree;
    }

    public void forEach(IntMap.IntBiConsumer<Neighbors> consumer) {
        neighbors.forEach(consumer);
    }

    /**
     * An immutable list of neighbors, best first.
     * <p>
     * Nothing is modified in place; the parent ConcurrentNeighborMap swaps in new instances.
     * Neighbors extends NodeArray instead of composing with it to avoid the overhead of an extra
     * object header.
     */
    public static class Neighbors extends NodeArray {
        /** the node id whose neighbors we are storing */
        public final int nodeId;

        /**
         * uses the node and score references directly from `nodeArray`, without copying
         */
        private Neighbors(int nodeId, NodeArray nodeArray) {
            super(nodeArray);
            this.nodeId = nodeId;
        }
    }
}
