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

package io.github.proxgraph.store;

import io.github.proxgraph.exceptions.InternalInconsistencyException;
import io.github.proxgraph.graph.NodeArray;
import io.github.proxgraph.graph.OnHeapGraphIndex;
import io.github.proxgraph.graph.OnHeapGraphIndex.NodeAtLevel;
import org.agrona.collections.Long2LongHashMap;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.function.IntToLongFunction;

/**
 * Serializes graph topology: for every node its ordinal, vector id, top level, flags, and per-level neighbor
 * lists with their scores, followed by the entry point.
 */
public final class NodeTable {
    private static final int FORMAT_VERSION = 1;

    private final OnHeapGraphIndex graph;
    private final Long2LongHashMap ordinalToId;

    private NodeTable(OnHeapGraphIndex graph, Long2LongHashMap ordinalToId) {
        this.graph = graph;
        this.ordinalToId = ordinalToId;
    }

    public OnHeapGraphIndex getGraph() {
        return graph;
    }

    /**
     * @return the vector id recorded for the ordinal
     * @throws IllegalArgumentException if the ordinal is not in the table
     */
    public long idOf(int ordinal) {
        long id = ordinalToId.get(ordinal);
        if (id == ordinalToId.missingValue() && !ordinalToId.containsKey(ordinal)) {
            throw new IllegalArgumentException("No node " + ordinal + " in table");
        }
        return id;
    }

    public int size() {
        return ordinalToId.size();
    }

    public static void write(OnHeapGraphIndex graph, IntToLongFunction idOf, DataOutput out) throws IOException {
        var nodes = graph.nodesOnLevel(0);
        out.writeInt(FORMAT_VERSION);
        out.writeInt(graph.maxDegree());
        out.writeInt(nodes.size());
        for (int node : nodes) {
            int level = graph.getNodeLevel(node);
            out.writeInt(node);
            out.writeLong(idOf.applyAsLong(node));
            out.writeInt(level);
            out.writeBoolean(graph.isPublished(node));
            out.writeBoolean(graph.isDeleted(node));
            for (int l = 0; l <= level; l++) {
                var neighbors = graph.getNeighbors(l, node);
                out.writeInt(neighbors.size());
                for (int i = 0; i < neighbors.size(); i++) {
                    out.writeInt(neighbors.getNode(i));
                    out.writeFloat(neighbors.getScore(i));
                }
            }
        }
        var entry = graph.entryNode();
        out.writeInt(entry == null ? -1 : entry.level);
        out.writeInt(entry == null ? -1 : entry.node);
    }

    /**
     * @throws InternalInconsistencyException if a neighbor list or the entry point refers to a node that is not
     *         in the table
     */
    public static NodeTable read(DataInput in) throws IOException {
        int format = in.readInt();
        if (format != FORMAT_VERSION) {
            throw new IOException("Unsupported node table format " + format);
        }
        int maxDegree = in.readInt();
        int count = in.readInt();
        var graph = new OnHeapGraphIndex(maxDegree);
        var ordinalToId = new Long2LongHashMap(-1L);
        var nodes = new int[count];
        var pending = new NodeArray[count][];

        for (int n = 0; n < count; n++) {
            int node = in.readInt();
            long id = in.readLong();
            int level = in.readInt();
            boolean published = in.readBoolean();
            boolean deleted = in.readBoolean();
            graph.addNode(node, level);
            ordinalToId.put(node, id);
            if (published) {
                graph.markPublished(node);
            }
            if (deleted) {
                graph.markDeleted(node);
            }
            var lists = new NodeArray[level + 1];
            for (int l = 0; l <= level; l++) {
                int size = in.readInt();
                var neighbors = new NodeArray(size);
                for (int i = 0; i < size; i++) {
                    neighbors.addInOrder(in.readInt(), in.readFloat());
                }
                lists[l] = neighbors;
            }
            nodes[n] = node;
            pending[n] = lists;
        }

        // neighbor lists can only be installed once every node exists
        for (int n = 0; n < count; n++) {
            int node = nodes[n];
            var lists = pending[n];
            for (int l = 0; l < lists.length; l++) {
                for (int i = 0; i < lists[l].size(); i++) {
                    int friend = lists[l].getNode(i);
                    if (graph.getNeighbors(l, friend) == null) {
                        throw new InternalInconsistencyException(String.format(
                                "Node table links %d to %d on level %d, which is not stored", node, friend, l));
                    }
                }
                graph.setNeighbors(l, node, lists[l]);
            }
        }

        int entryLevel = in.readInt();
        int entryNode = in.readInt();
        if (entryNode >= 0) {
            if (graph.getNodeLevel(entryNode) != entryLevel) {
                throw new InternalInconsistencyException(String.format(
                        "Entry point %d at level %d does not match the stored nodes", entryNode, entryLevel));
            }
            graph.updateEntryNode(new NodeAtLevel(entryLevel, entryNode));
        } else if (count > 0) {
            throw new InternalInconsistencyException("Node table holds " + count + " nodes but no entry point");
        }
        return new NodeTable(graph, ordinalToId);
    }
}
