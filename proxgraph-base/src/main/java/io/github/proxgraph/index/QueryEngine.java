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

import io.github.proxgraph.exceptions.DimensionMismatchException;
import io.github.proxgraph.exceptions.InternalInconsistencyException;
import io.github.proxgraph.graph.GraphSearchResult.NodeScore;
import io.github.proxgraph.graph.GraphSearcher;
import io.github.proxgraph.graph.OnHeapGraphIndex;
import io.github.proxgraph.graph.RandomAccessVectorValues;
import io.github.proxgraph.graph.similarity.DefaultSearchScoreProvider;
import io.github.proxgraph.graph.similarity.SearchScoreProvider;
import io.github.proxgraph.quantization.CodebookGeneration;
import io.github.proxgraph.store.VectorRecord;
import io.github.proxgraph.store.VectorStore;
import io.github.proxgraph.util.Bits;
import io.github.proxgraph.util.ExplicitThreadLocal;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import io.github.proxgraph.vector.types.VectorFloat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs queries: validates the query vector, traverses the graph with compressed-vector scores when a codebook is
 * installed, reranks the candidates with full-precision vectors from the vector store, applies the metadata
 * filter and keeps the best k.
 * <p>
 * Each calling thread gets its own {@link GraphSearcher}, so searches may run concurrently.
 */
public class QueryEngine implements AutoCloseable {
    private final int dimension;
    private final VectorSimilarityFunction similarityFunction;
    private final int defaultEf;
    private final OnHeapGraphIndex graph;
    private final VectorStore store;
    private final OrdinalMap ordinals;
    private final RandomAccessVectorValues vectors;
    private final Supplier<CodebookGeneration> generation;
    private final ExplicitThreadLocal<GraphSearcher> searchers;

    QueryEngine(IndexConfig config, OnHeapGraphIndex graph, VectorStore store, OrdinalMap ordinals,
                RandomAccessVectorValues vectors, Supplier<CodebookGeneration> generation) {
        this.dimension = config.getDimension();
        this.similarityFunction = config.getSimilarityFunction();
        this.defaultEf = config.getDefaultEfSearch();
        this.graph = graph;
        this.store = store;
        this.ordinals = ordinals;
        this.vectors = vectors;
        this.generation = generation;
        this.searchers = ExplicitThreadLocal.withInitial(() -> new GraphSearcher(graph));
    }

    private void validate(VectorFloat<?> query, int k) {
        if (query == null) {
            throw new IllegalArgumentException("query vector must not be null");
        }
        DimensionMismatchException.check(dimension, query.length());
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
    }

    /**
     * @return up to k live vectors nearest the query, closest first
     */
    public SearchResult search(VectorFloat<?> query, int k, SearchParams params) {
        validate(query, k);
        int ef = Math.max(k, params.getEf() > 0 ? params.getEf() : defaultEf);

        // the generation is captured once so a concurrent retrain cannot mix codebooks within a query
        var gen = generation.get();
        SearchScoreProvider ssp = gen == null
                                  ? DefaultSearchScoreProvider.exact(query, similarityFunction, vectors)
                                  : DefaultSearchScoreProvider.approximate(query, similarityFunction, gen, vectors);
        // ef candidates, so hits dropped by the filter or by concurrent deletes can be replaced
        var filter = params.getFilter();
        var result = searchers.get().search(ssp, ef, ef, Bits.ALL, params.getCancellation());

        var hits = toHits(result.getNodes(), k, filter);
        return new SearchResult(hits, result.getVisitedCount(), result.getExpandedCount(), result.getRerankedCount(),
                                gen == null ? 0 : gen.getVersion());
    }

    /**
     * Scores every live vector exactly.  Slow; meant for ground truth and for small indexes.
     */
    public SearchResult exactSearch(VectorFloat<?> query, int k, SearchParams params) {
        validate(query, k);
        var filter = params.getFilter();
        Bits accept = graph.liveNodes();
        if (filter != null) {
            accept = Bits.intersectionOf(accept, ordinal -> filter.test(recordOf(ordinal).getMetadata()));
        }
        var nodes = BruteForceSearcher.search(query, k, similarityFunction, vectors, accept, params.getCancellation());
        return new SearchResult(toHits(nodes, k, null), nodes.length, 0, nodes.length, 0);
    }

    private List<SearchResult.Hit> toHits(NodeScore[] nodes, int k, Predicate<Map<String, String>> filter) {
        var hits = new ArrayList<SearchResult.Hit>(Math.min(k, nodes.length));
        for (var ns : nodes) {
            if (hits.size() == k) {
                break;
            }
            // deleted or overwritten since the traversal accepted it
            if (graph.isDeleted(ns.node)) {
                continue;
            }
            var record = recordOf(ns.node);
            if (record.isDeleted() || record.getOrdinal() != ns.node) {
                continue;
            }
            if (filter != null && !filter.test(record.getMetadata())) {
                continue;
            }
            hits.add(new SearchResult.Hit(record.getId(), similarityFunction.toReportedScore(ns.score), record.getMetadata()));
        }
        return hits;
    }

    private VectorRecord recordOf(int ordinal) {
        long id = ordinals.idOf(ordinal);
        var record = store.getIfPresent(id);
        if (record == null) {
            throw new InternalInconsistencyException("Graph node " + ordinal + " refers to missing vector " + id);
        }
        return record;
    }

    @Override
    public void close() throws Exception {
        searchers.close();
    }
}
