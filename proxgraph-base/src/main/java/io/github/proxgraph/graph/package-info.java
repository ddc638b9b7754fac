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

/**
 * The hierarchical proximity graph and the algorithms that build and search it.
 * <p>
 * Nodes are dense int ordinals assigned in insertion order.  Level 0 holds every node; each higher level holds
 * a random subset of the one below, drawn from a geometric distribution, so a search touches a logarithmic
 * number of levels on its way down.
 *
 * <h2>Key classes</h2>
 * <ul>
 *   <li>{@link io.github.proxgraph.graph.OnHeapGraphIndex} - the topology: one
 *       {@link io.github.proxgraph.graph.ConcurrentNeighborMap} per level, plus the entry point and the
 *       published and tombstoned node sets.  Reads are lock-free.</li>
 *   <li>{@link io.github.proxgraph.graph.GraphIndexBuilder} - inserts nodes, tombstones them, and compacts the
 *       graph by purging tombstones and repairing the neighbor lists that pointed at them.</li>
 *   <li>{@link io.github.proxgraph.graph.GraphSearcher} - greedy descent followed by a layer 0 beam search,
 *       with optional exact reranking and cooperative cancellation.</li>
 *   <li>{@link io.github.proxgraph.graph.NodeArray} and {@link io.github.proxgraph.graph.NodeQueue} - the
 *       sorted list and heap that hold (node, score) pairs.</li>
 * </ul>
 *
 * <h2>Visibility</h2>
 * A node inserted concurrently with a search is invisible to it until every edge of the node has been
 * installed.  Tombstoned nodes remain traversable but are never returned.
 *
 * @see io.github.proxgraph.graph.similarity
 * @see io.github.proxgraph.graph.diversity
 */
package io.github.proxgraph.graph;
