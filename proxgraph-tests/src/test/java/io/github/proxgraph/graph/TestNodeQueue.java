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
import io.github.proxgraph.util.BoundedLongHeap;
import io.github.proxgraph.util.GrowableLongHeap;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestNodeQueue extends ProxGraphTestCase {
    @Test
    public void testMinHeap() {
        var queue = new NodeQueue(new GrowableLongHeap(2), NodeQueue.Order.MIN_HEAP);
        queue.push(1, 0.3f);
        queue.push(2, 0.9f);
        queue.push(3, -0.5f);

        assertEquals(3, queue.size());
        assertEquals(3, queue.topNode());
        assertEquals(-0.5f, queue.topScore(), 0f);
        assertEquals(3, queue.pop());
        assertEquals(1, queue.pop());
        assertEquals(2, queue.pop());
        assertEquals(0, queue.size());
    }

    @Test
    public void testMaxHeap() {
        var queue = new NodeQueue(new GrowableLongHeap(2), NodeQueue.Order.MAX_HEAP);
        queue.push(1, 0.3f);
        queue.push(2, 0.9f);
        queue.push(3, -0.5f);

        assertEquals(0.9f, queue.topScore(), 0f);
        assertEquals(2, queue.pop());
        assertEquals(1, queue.pop());
        assertEquals(3, queue.pop());
    }

    @Test
    public void testEqualScoresFavorLowerNode() {
        var max = new NodeQueue(new GrowableLongHeap(4), NodeQueue.Order.MAX_HEAP);
        var min = new NodeQueue(new GrowableLongHeap(4), NodeQueue.Order.MIN_HEAP);
        for (int node : new int[] {7, 3, 5}) {
            max.push(node, 1f);
            min.push(node, 1f);
        }
        // the best is popped first from a max heap, the worst first from a min heap
        assertEquals(3, max.pop());
        assertEquals(5, max.pop());
        assertEquals(7, min.pop());
        assertEquals(5, min.pop());
    }

    @Test
    public void testBoundedHeapKeepsBest() {
        var queue = new NodeQueue(new BoundedLongHeap(3), NodeQueue.Order.MIN_HEAP);
        for (int i = 1; i <= 5; i++) {
            assertTrue(queue.push(i, i / 10f));
        }
        assertFalse(queue.push(0, 0.05f));
        assertEquals(3, queue.size());

        var best = queue.drainBestFirst();
        assertArrayEquals(new int[] {5, 4, 3}, best.copyDenseNodes());
        assertArrayEquals(new float[] {0.5f, 0.4f, 0.3f}, best.copyDenseScores(), 1e-6f);
        assertEquals(0, queue.size());
    }

    @Test
    public void testForeachVisitsEveryEntry() {
        var queue = new NodeQueue(new GrowableLongHeap(1), NodeQueue.Order.MAX_HEAP);
        int n = randomIntBetween(1, 100);
        for (int i = 0; i < n; i++) {
            queue.push(i, randomFloat());
        }
        var seen = new NodeArray(n);
        queue.foreach(seen::insertSorted);
        assertEquals(n, seen.size());
        for (int i = 0; i < n; i++) {
            assertTrue(seen.contains(i));
        }
    }
}
