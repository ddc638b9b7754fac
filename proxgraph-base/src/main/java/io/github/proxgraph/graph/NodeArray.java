/*
 * All changes to the original code are Copyright DataStax, Inc.
 *
 * Please see the included license file for details.
 */

/*
 * Original license:
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.proxgraph.graph;

import io.github.proxgraph.annotations.VisibleForTesting;
import io.github.proxgraph.util.ArrayUtil;
import io.github.proxgraph.util.Bits;

import java.util.Arrays;

/**
 * NodeArray encodes node IDs and their scores relative to some other element
 * (a query vector, or another graph node) as a pair of growable arrays.
 * Nodes are arranged in descending order of score; equal scores are ordered by ascending node id,
 * so the lower (earlier inserted) node always comes first.
 */
public class NodeArray {
    public static final NodeArray EMPTY = new NodeArray(0);

    private int size;
    private float[] scores;
    private int[] nodes;

    public NodeArray(int initialSize) {
        nodes = new int[initialSize];
        scores = new float[initialSize];
        size = 0;
    }

    // shares the arrays of `nodeArray`; exists for the benefit of ConcurrentNeighborMap.Neighbors
    protected NodeArray(NodeArray nodeArray) {
        this.size = nodeArray.size;
        this.nodes = nodeArray.nodes;
        this.scores = nodeArray.scores;
    }

    /**
     * Add a new node to the NodeArray. The new node must sort after all previously stored nodes.
     */
    public void addInOrder(int newNode, float newScore) {
        if (size == nodes.length) {
            growArrays();
        }
        assert size == 0 || before(nodes[size - 1], scores[size - 1], newNode, newScore)
                : "Nodes are added in the incorrect order! Comparing " + newNode + "/" + newScore
                  + " to " + Arrays.toString(Arrays.copyOf(nodes, size));
        nodes[size] = newNode;
        scores[size] = newScore;
        ++size;
    }

    /**
     * Add a new node to the NodeArray into a correct sort position according to its score.
     * A node that is already present is ignored.
     *
     * @return the insertion point of the new node, or -1 if it already existed
     */
    public int insertSorted(int newNode, float newScore) {
        if (contains(newNode)) {
            return -1;
        }
        if (size == nodes.length) {
            growArrays();
        }
        int insertionPoint = insertionPoint(newNode, newScore);
        System.arraycopy(nodes, insertionPoint, nodes, insertionPoint + 1, size - insertionPoint);
        System.arraycopy(scores, insertionPoint, scores, insertionPoint + 1, size - insertionPoint);
        nodes[insertionPoint] = newNode;
        scores[insertionPoint] = newScore;
        ++size;
        return insertionPoint;
    }

    // true if (node1, score1) sorts strictly before (node2, score2)
    private static boolean before(int node1, float score1, int node2, float score2) {
        int c = Float.compare(score2, score1);
        return c < 0 || (c == 0 && node1 < node2);
    }

    private int insertionPoint(int newNode, float newScore) {
        int start = 0;
        int end = size - 1;
        while (start <= end) {
            int mid = (start + end) >>> 1;
            if (before(nodes[mid], scores[mid], newNode, newScore)) {
                start = mid + 1;
            } else {
                end = mid - 1;
            }
        }
        return start;
    }

    /**
     * Retains only the elements in the current NodeArray whose corresponding index
     * is set in the given Bits.  Relative order is preserved.
     *
     * @param selected the bit at index i is set if the i-th element should be retained
     *                 (positions in the NodeArray, NOT node ids)
     */
    public void retain(Bits selected) {
        int writeIdx = 0;
        for (int readIdx = 0; readIdx < size; readIdx++) {
            if (selected.get(readIdx)) {
                if (writeIdx != readIdx) {
                    nodes[writeIdx] = nodes[readIdx];
                    scores[writeIdx] = scores[readIdx];
                }
                writeIdx++;
            }
        }
        size = writeIdx;
    }

    public NodeArray copy() {
        return copy(size);
    }

    public NodeArray copy(int newSize) {
        if (size > newSize) {
            throw new IllegalArgumentException(String.format("Cannot copy %d nodes to a smaller size %d", size, newSize));
        }

        NodeArray copy = new NodeArray(newSize);
        copy.size = size;
        System.arraycopy(nodes, 0, copy.nodes, 0, size);
        System.arraycopy(scores, 0, copy.scores, 0, size);
        return copy;
    }

    protected final void growArrays() {
        nodes = ArrayUtil.grow(nodes);
        scores = ArrayUtil.growExact(scores, nodes.length);
    }

    public int size() {
        return size;
    }

    public void clear() {
        size = 0;
    }

    public void removeIndex(int idx) {
        System.arraycopy(nodes, idx + 1, nodes, idx, size - idx - 1);
        System.arraycopy(scores, idx + 1, scores, idx, size - idx - 1);
        size--;
    }

    public float getScore(int i) {
        return scores[i];
    }

    public int getNode(int i) {
        return nodes[i];
    }

    /** Linear scan; neighbor lists are short. */
    public boolean contains(int node) {
        for (int i = 0; i < size; i++) {
            if (nodes[i] == node) {
                return true;
            }
        }
        return false;
    }

    public NodesIterator iterator() {
        return new NodesIterator.ArrayNodesIterator(nodes, size);
    }

    @VisibleForTesting
    int[] copyDenseNodes() {
        return Arrays.copyOf(nodes, size);
    }

    @VisibleForTesting
    float[] copyDenseScores() {
        return Arrays.copyOf(scores, size);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("NodeArray(");
        sb.append(size).append("/").append(nodes.length).append(") [");
        for (int i = 0; i < size; i++) {
            sb.append("(").append(nodes[i]).append(",").append(scores[i]).append(")").append(", ");
        }
        sb.append("]");
        return sb.toString();
    }
}
