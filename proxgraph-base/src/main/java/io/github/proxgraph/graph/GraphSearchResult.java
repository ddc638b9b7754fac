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

import java.util.Arrays;
import java.util.Objects;

/**
 * Nodes found by a graph traversal, best-first, together with counters describing how much of the graph was touched.
 */
public final class GraphSearchResult {
    private final NodeScore[] nodes;
    private final int visitedCount;
    private final int expandedCount;
    private final int expandedCountBaseLayer;
    private final int rerankedCount;

    /**
     * @param nodes the top scoring nodes, sorted best-first
     * @param visitedCount the number of nodes scored during the search
     * @param expandedCount the number of nodes whose neighbors were examined
     * @param expandedCountBaseLayer the number of nodes expanded on layer 0
     * @param rerankedCount the number of nodes rescored with exact similarity
     */
    public GraphSearchResult(NodeScore[] nodes, int visitedCount, int expandedCount, int expandedCountBaseLayer, int rerankedCount) {
        this.nodes = nodes;
        this.visitedCount = visitedCount;
        this.expandedCount = expandedCount;
        this.expandedCountBaseLayer = expandedCountBaseLayer;
        this.rerankedCount = rerankedCount;
    }

    static GraphSearchResult empty() {
        return new GraphSearchResult(new NodeScore[0], 0, 0, 0, 0);
    }

    public NodeScore[] getNodes() {
        return nodes;
    }

    public int getVisitedCount() {
        return visitedCount;
    }

    public int getExpandedCount() {
        return expandedCount;
    }

    public int getExpandedCountBaseLayer() {
        return expandedCountBaseLayer;
    }

    public int getRerankedCount() {
        return rerankedCount;
    }

    /**
     * A graph node and its similarity score.
     */
    public static final class NodeScore implements Comparable<NodeScore> {
        public final int node;
        public final float score;

        public NodeScore(int node, float score) {
            this.node = node;
            this.score = score;
        }

        @Override
        public String toString() {
            return String.format("NodeScore(%d, %s)", node, score);
        }

        @Override
        public int compareTo(NodeScore o) {
            // higher score first, then lower ordinal
            int scoreCompare = Float.compare(o.score, this.score);
            return scoreCompare != 0 ? scoreCompare : Integer.compare(node, o.node);
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            NodeScore nodeScore = (NodeScore) o;
            return node == nodeScore.node && Float.compare(score, nodeScore.score) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(node, score);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        GraphSearchResult that = (GraphSearchResult) o;
        return visitedCount == that.visitedCount && expandedCount == that.expandedCount
                && rerankedCount == that.rerankedCount && Arrays.equals(nodes, that.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(nodes), visitedCount, expandedCount, rerankedCount);
    }

    @Override
    public String toString() {
        return String.format("GraphSearchResult(nodes=%s, visited=%d, expanded=%d, reranked=%d)",
                             Arrays.toString(nodes), visitedCount, expandedCount, rerankedCount);
    }
}
