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

import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Recall@k: the fraction of the true k nearest neighbors that appear in the first k retrieved results.
 */
public final class RecallCalculator {
    private RecallCalculator() {}

    public static double recall(List<Long> groundTruth, List<Long> retrieved, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        int expected = Math.min(k, groundTruth.size());
        if (expected == 0) {
            return 1.0;
        }
        var truth = new HashSet<>(groundTruth.subList(0, expected));
        int found = 0;
        for (Long id : retrieved.subList(0, Math.min(k, retrieved.size()))) {
            if (truth.contains(id)) {
                found++;
            }
        }
        return (double) found / expected;
    }

    public static double recall(SearchResult groundTruth, SearchResult retrieved, int k) {
        return recall(ids(groundTruth), ids(retrieved), k);
    }

    /**
     * @return recall averaged over paired queries
     */
    public static double meanRecall(List<SearchResult> groundTruth, List<SearchResult> retrieved, int k) {
        if (groundTruth.size() != retrieved.size()) {
            throw new IllegalArgumentException(String.format("%d ground truth results but %d retrieved", groundTruth.size(), retrieved.size()));
        }
        if (groundTruth.isEmpty()) {
            return 1.0;
        }
        double total = 0;
        for (int i = 0; i < groundTruth.size(); i++) {
            total += recall(groundTruth.get(i), retrieved.get(i), k);
        }
        return total / groundTruth.size();
    }

    private static List<Long> ids(SearchResult result) {
        return result.getHits().stream().map(SearchResult.Hit::getId).collect(Collectors.toList());
    }
}
