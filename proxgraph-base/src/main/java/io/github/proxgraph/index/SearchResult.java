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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The hits of one query, closest first, together with counters describing the work done.
 * <p>
 * Scores are reported in the metric's natural unit: Euclidean distance and cosine distance ascend, dot
 * products descend.
 */
public final class SearchResult {
    private static final SearchResult EMPTY = new SearchResult(Collections.emptyList(), 0, 0, 0, 0);

    private final List<Hit> hits;
    private final int visitedCount;
    private final int expandedCount;
    private final int rerankedCount;
    private final long codebookVersion;

    public SearchResult(List<Hit> hits, int visitedCount, int expandedCount, int rerankedCount, long codebookVersion) {
        this.hits = Collections.unmodifiableList(hits);
        this.visitedCount = visitedCount;
        this.expandedCount = expandedCount;
        this.rerankedCount = rerankedCount;
        this.codebookVersion = codebookVersion;
    }

    public static SearchResult empty() {
        return EMPTY;
    }

    public List<Hit> getHits() {
        return hits;
    }

    public int size() {
        return hits.size();
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }

    /**
     * @return the number of nodes scored during traversal
     */
    public int getVisitedCount() {
        return visitedCount;
    }

    public int getExpandedCount() {
        return expandedCount;
    }

    /**
     * @return the number of candidates rescored with full-precision vectors
     */
    public int getRerankedCount() {
        return rerankedCount;
    }

    /**
     * @return the codebook generation the traversal scored with, or 0 for exact traversal
     */
    public long getCodebookVersion() {
        return codebookVersion;
    }

    @Override
    public String toString() {
        return "SearchResult{hits=" + hits + ", visited=" + visitedCount + ", expanded=" + expandedCount
               + ", reranked=" + rerankedCount + '}';
    }

    public static final class Hit {
        private final long id;
        private final float score;
        private final Map<String, String> metadata;

        public Hit(long id, float score, Map<String, String> metadata) {
            this.id = id;
            this.score = score;
            this.metadata = metadata;
        }

        public long getId() {
            return id;
        }

        public float getScore() {
            return score;
        }

        public Map<String, String> getMetadata() {
            return metadata;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Hit hit = (Hit) o;
            return id == hit.id && Float.compare(score, hit.score) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, score);
        }

        @Override
        public String toString() {
            return "Hit(" + id + ", " + score + ")";
        }
    }
}
