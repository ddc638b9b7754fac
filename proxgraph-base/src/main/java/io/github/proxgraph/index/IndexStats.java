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

package io.github.proxgraph.index;

import java.util.Arrays;

/**
 * A point-in-time summary of an index.
 */
public final class IndexStats {
    private final int nodeCount;
    private final int liveCount;
    private final int tombstoneCount;
    private final double averageDegree;
    private final int[] layerHistogram;
    private final int maxLevel;
    private final int entryNode;
    private final long codebookVersion;
    private final boolean needsRebuild;

    IndexStats(int nodeCount, int liveCount, int tombstoneCount, double averageDegree, int[] layerHistogram,
               int maxLevel, int entryNode, long codebookVersion, boolean needsRebuild) {
        this.nodeCount = nodeCount;
        this.liveCount = liveCount;
        this.tombstoneCount = tombstoneCount;
        this.averageDegree = averageDegree;
        this.layerHistogram = layerHistogram;
        this.maxLevel = maxLevel;
        this.entryNode = entryNode;
        this.codebookVersion = codebookVersion;
        this.needsRebuild = needsRebuild;
    }

    /**
     * @return nodes physically present in the graph, tombstones included
     */
    public int getNodeCount() {
        return nodeCount;
    }

    public int getLiveCount() {
        return liveCount;
    }

    public int getTombstoneCount() {
        return tombstoneCount;
    }

    /**
     * @return mean out-degree of live nodes on level 0
     */
    public double getAverageDegree() {
        return averageDegree;
    }

    /**
     * @return nodes per level, level 0 first
     */
    public int[] getLayerHistogram() {
        return layerHistogram.clone();
    }

    /**
     * @return the level of the entry point, or -1 if the index is empty
     */
    public int getMaxLevel() {
        return maxLevel;
    }

    /**
     * @return the graph ordinal searches start from, or -1 if the index is empty
     */
    public int getEntryNode() {
        return entryNode;
    }

    public long getCodebookVersion() {
        return codebookVersion;
    }

    public boolean needsRebuild() {
        return needsRebuild;
    }

    @Override
    public String toString() {
        return String.format("IndexStats(nodes=%d, live=%d, tombstones=%d, avgDegree=%.2f, layers=%s, maxLevel=%d, entry=%d, codebookVersion=%d%s)",
                             nodeCount, liveCount, tombstoneCount, averageDegree, Arrays.toString(layerHistogram),
                             maxLevel, entryNode, codebookVersion, needsRebuild ? ", NEEDS REBUILD" : "");
    }
}
