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

import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Iterator over graph nodes that includes the size - the total number of nodes to be iterated over.
 * The nodes are not guaranteed to be traversed in any particular order.
 */
public interface NodesIterator extends PrimitiveIterator.OfInt {
    /**
     * @return the total number of elements that this iterator will produce
     */
    int size();

    /**
     * Iterates over a prefix of an integer array.
     */
    class ArrayNodesIterator implements NodesIterator {
        private final int[] nodes;
        private int cur = 0;
        private final int size;

        public ArrayNodesIterator(int[] nodes, int size) {
            assert nodes != null;
            assert size <= nodes.length;
            this.size = size;
            this.nodes = nodes;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public int nextInt() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return nodes[cur++];
        }

        @Override
        public boolean hasNext() {
            return cur < size;
        }
    }
}
