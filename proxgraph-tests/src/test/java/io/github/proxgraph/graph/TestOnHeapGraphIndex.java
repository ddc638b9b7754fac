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
import io.github.proxgraph.graph.OnHeapGraphIndex.NodeAtLevel;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TestOnHeapGraphIndex extends ProxGraphTestCase {
    @Test
    public void testLevelsAndDegrees() {
        var graph = new OnHeapGraphIndex(4);
        assertEquals(8, graph.getDegree(0));
        assertEquals(4, graph.getDegree(3));
        assertEquals(0, graph.size());
        assertNull(graph.entryNode());
        assertEquals(-1, graph.getMaxLevel());

        graph.addNode(0, 2);
        graph.addNode(1, 0);
        graph.addNode(5, 1);

        assertEquals(3, graph.levelCount());
        assertEquals(3, graph.size());
        assertEquals(6, graph.getIdUpperBound());
        assertEquals(2, graph.getNodeLevel(0));
        assertEquals(1, graph.getNodeLevel(5));
        assertEquals(-1, graph.getNodeLevel(4));
        assertNull(graph.getNeighbors(1, 1));
        assertEquals(0, graph.getNeighbors(0, 1).size());
        assertArrayEquals(new int[] {3, 2, 1}, graph.layerHistogram());
        assertEquals(List.of(0, 1, 5), graph.nodesOnLevel(0));
        assertEquals(List.of(0, 5), graph.nodesOnLevel(1));
        assertEquals(List.of(), graph.nodesOnLevel(7));
    }

    @Test
    public void testLiveness() {
        var graph = new OnHeapGraphIndex(4);
        graph.addNode(0, 0);
        assertFalse(graph.isPublished(0));
        assertFalse(graph.liveNodes().get(0));

        graph.markPublished(0);
        assertTrue(graph.liveNodes().get(0));

        graph.markDeleted(0);
        assertTrue(graph.isDeleted(0));
        assertFalse(graph.liveNodes().get(0));
        assertEquals(1, graph.deletedCount());
        assertTrue(graph.containsNode(0));
    }

    @Test
    public void testRemoveNodeDropsEmptyTopLevels() {
        var graph = new OnHeapGraphIndex(4);
        graph.addNode(0, 0);
        graph.addNode(1, 2);
        graph.markPublished(0);
        graph.markPublished(1);
        graph.markDeleted(1);
        graph.updateEntryNode(new NodeAtLevel(2, 1));
        assertEquals(2, graph.getMaxLevel());

        graph.removeNode(1);
        assertFalse(graph.containsNode(1));
        assertFalse(graph.isPublished(1));
        assertFalse(graph.isDeleted(1));
        assertEquals(1, graph.levelCount());
        assertEquals(1, graph.size());
        assertEquals(0, graph.deletedCount());
    }

    @Test
    public void testAverageDegreeCountsLiveNodesOnly() {
        var graph = new OnHeapGraphIndex(4);
        for (int i = 0; i < 3; i++) {
            graph.addNode(i, 0);
            graph.markPublished(i);
        }
        var two = new NodeArray(2);
        two.addInOrder(1, 0.5f);
        two.addInOrder(2, 0.4f);
        graph.setNeighbors(0, 0, two);
        var one = new NodeArray(1);
        one.addInOrder(0, 0.5f);
        graph.setNeighbors(0, 1, one);
        graph.setNeighbors(0, 2, one);

        assertEquals(4 / 3.0, graph.getAverageDegree(), 1e-9);
        graph.markDeleted(0);
        assertEquals(1.0, graph.getAverageDegree(), 1e-9);
    }

    @Test
    public void testNodeAtLevelOrdering() {
        var low = new NodeAtLevel(0, 9);
        var high = new NodeAtLevel(3, 1);
        assertTrue(low.compareTo(high) < 0);
        assertEquals(new NodeAtLevel(3, 1), high);
        assertEquals(new NodeAtLevel(3, 1).hashCode(), high.hashCode());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDegreeMustBePositive() {
        new OnHeapGraphIndex(0);
    }
}
