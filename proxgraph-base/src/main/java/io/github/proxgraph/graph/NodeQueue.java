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

import io.github.proxgraph.util.AbstractLongHeap;
import io.github.proxgraph.util.BoundedLongHeap;
import io.github.proxgraph.util.NumericUtils;

/**
 * NodeQueue uses a {@link io.github.proxgraph.util.AbstractLongHeap} to store lists of nodes in a graph,
 * represented as a node id with an associated score packed together as a sortable long, which is sorted
 * primarily by score. The queue {@link #push(int, float)} operation provides either fixed-size
 * or unbounded operations, depending on the implementation subclasses, and either maxheap or minheap behavior.
 */
public class NodeQueue {
    public enum Order {
        /** Smallest values at the top of the heap */
        MIN_HEAP {
            @Override
            long apply(long v) {
                return v;
            }
        },
        /** Largest values at the top of the heap */
        MAX_HEAP {
            @Override
            long apply(long v) {
                // This cannot be just `-v` since Long.MIN_VALUE doesn't have a positive counterpart. It
                // needs a function that returns MAX_VALUE for MIN_VALUE and vice-versa.
                return -1 - v;
            }
        };

        abstract long apply(long v);
    }

    private final AbstractLongHeap heap;
    private final Order order;

    public NodeQueue(AbstractLongHeap heap, Order order) {
        this.heap = heap;
        this.order = order;
    }

    /**
     * @return the number of elements in the heap
     */
    public int size() {
        return heap.size();
    }

    /**
     * Adds a new graph node to the heap.  Will extend storage or replace the worst element
     * depending on the type of heap it is.
     *
     * @param newNode  the node id
     * @param newScore the relative similarity score to the node of the owner
     *
     * @return true if the new value was added.
     */
    public boolean push(int newNode, float newScore) {
        return heap.push(encode(newNode, newScore));
    }

    /**
     * Encodes the node ID and its similarity score as long.  If two scores are equals,
     * the smaller node ID wins.
     *
     * <p>The most significant 32 bits represent the float score, encoded as a sortable int.
     *
     * <p>The less significant 32 bits represent the node ID, complemented to guarantee the win for
     * the smaller node ID.
     */
    private long encode(int node, float score) {
        assert node >= 0 : node;
        return order.apply(
                (((long) NumericUtils.floatToSortableInt(score)) << 32) | (0xFFFFFFFFL & ~node));
    }

    private float decodeScore(long heapValue) {
        return NumericUtils.sortableIntToFloat((int) (order.apply(heapValue) >> 32));
    }

    private int decodeNodeId(long heapValue) {
        return (int) ~(order.apply(heapValue));
    }

    /** Removes the top element and returns its node id. */
    public int pop() {
        return decodeNodeId(heap.pop());
    }

    /** Returns the top element's node id. */
    public int topNode() {
        return decodeNodeId(heap.top());
    }

    /**
     * Returns the top element's node score. For the min heap this is the minimum score. For the max
     * heap this is the maximum score.
     */
    public float topScore() {
        return decodeScore(heap.top());
    }

    public void clear() {
        heap.clear();
    }

    /**
     * Sets the maximum size of the underlying heap.  Only valid when NodeQueue was created with BoundedLongHeap.
     *
     * @throws ClassCastException if the underlying heap is not a BoundedLongHeap
     */
    public void setMaxSize(int maxSize) {
        ((BoundedLongHeap) heap).setMaxSize(maxSize);
    }

    /**
     * Drains the queue into a NodeArray ordered best-first.  Assumes a MIN_HEAP, whose top is the worst element.
     */
    public NodeArray drainBestFirst() {
        assert order == Order.MIN_HEAP;
        int n = size();
        int[] nodes = new int[n];
        float[] scores = new float[n];
        for (int i = n - 1; i >= 0; i--) {
            scores[i] = topScore();
            nodes[i] = pop();
        }
        var result = new NodeArray(n);
        for (int i = 0; i < n; i++) {
            result.addInOrder(nodes[i], scores[i]);
        }
        return result;
    }

    @Override
    public String toString() {
        return "Nodes[" + heap.size() + "]";
    }

    /**
     * Applies the given consumer to each node/score pair in this queue.
     * The order of iteration is not guaranteed to be sorted by score.
     */
    public void foreach(NodeConsumer consumer) {
        for (int i = 0; i < heap.size(); i++) {
            long heapValue = heap.get(i + 1);
            consumer.accept(decodeNodeId(heapValue), decodeScore(heapValue));
        }
    }

    @FunctionalInterface
    public interface NodeConsumer {
        void accept(int node, float score);
    }
}
