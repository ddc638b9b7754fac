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
import io.github.proxgraph.graph.diversity.DiversityProvider;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TestConcurrentNeighborMap extends ProxGraphTestCase {
    // keeps the best candidates regardless of diversity
    private static final DiversityProvider KEEP_BEST = (neighbors, maxDegree, selected) -> {
        for (int i = 0; i < Math.min(maxDegree, neighbors.size()); i++) {
            selected.set(i);
        }
    };

    @Test
    public void testInsertEdgePrunesToMaxDegree() {
        var map = new ConcurrentNeighborMap(2);
        map.addNode(0);
        map.insertEdge(0, 1, 0.5f, KEEP_BEST);
        map.insertEdge(0, 2, 0.9f, KEEP_BEST);
        map.insertEdge(0, 3, 0.7f, KEEP_BEST);
        map.insertEdge(0, 2, 0.9f, KEEP_BEST);

        var neighbors = map.get(0);
        assertEquals(0, neighbors.nodeId);
        assertArrayEquals(new int[] {2, 3}, neighbors.copyDenseNodes());
    }

    @Test
    public void testReadersKeepTheirSnapshot() {
        var map = new ConcurrentNeighborMap(4);
        map.addNode(0);
        map.insertEdge(0, 1, 0.5f, KEEP_BEST);
        var before = map.get(0);

        var replacement = new NodeArray(2);
        replacement.addInOrder(7, 0.9f);
        replacement.addInOrder(8, 0.1f);
        map.update(0, replacement);

        assertArrayEquals(new int[] {1}, before.copyDenseNodes());
        assertArrayEquals(new int[] {7, 8}, map.get(0).copyDenseNodes());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUpdateRejectsOversizedList() {
        var map = new ConcurrentNeighborMap(1);
        map.addNode(0);
        var tooMany = new NodeArray(2);
        tooMany.addInOrder(1, 1f);
        tooMany.addInOrder(2, 0f);
        map.update(0, tooMany);
    }

    @Test(expected = IllegalStateException.class)
    public void testInsertEdgeOnMissingNode() {
        new ConcurrentNeighborMap(4).insertEdge(3, 1, 0.5f, KEEP_BEST);
    }

    @Test(expected = IllegalStateException.class)
    public void testAddNodeTwice() {
        var map = new ConcurrentNeighborMap(4);
        map.addNode(3);
        map.addNode(3);
    }

    @Test
    public void testRemove() {
        var map = new ConcurrentNeighborMap(4);
        map.addNode(0);
        map.addNode(1);
        map.remove(0);
        assertNull(map.get(0));
        assertEquals(1, map.size());
        assertTrue(map.contains(1));
    }

    @Test
    public void testConcurrentInsertEdgesAreAllKept() throws InterruptedException {
        int threads = 4;
        int perThread = 100;
        var map = new ConcurrentNeighborMap(threads * perThread);
        map.addNode(0);
        long seed = randomLong();

        var workers = new ArrayList<Thread>();
        for (int t = 0; t < threads; t++) {
            int base = 1 + t * perThread;
            workers.add(new Thread(() -> {
                var random = new Random(seed + base);
                for (int i = 0; i < perThread; i++) {
                    map.insertEdge(0, base + i, random.nextFloat(), KEEP_BEST);
                }
            }));
        }
        workers.forEach(Thread::start);
        for (var worker : workers) {
            worker.join();
        }

        var neighbors = map.get(0);
        assertEquals(threads * perThread, neighbors.size());
        for (int node = 1; node <= threads * perThread; node++) {
            assertTrue(neighbors.contains(node));
        }
    }
}
