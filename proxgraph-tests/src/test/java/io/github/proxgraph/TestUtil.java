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

package io.github.proxgraph;

import io.github.proxgraph.graph.GraphIndexBuilder;
import io.github.proxgraph.graph.GraphSearchResult;
import io.github.proxgraph.graph.RandomAccessVectorValues;
import io.github.proxgraph.graph.similarity.BuildScoreProvider;
import io.github.proxgraph.index.RecallCalculator;
import io.github.proxgraph.index.SearchResult;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import io.github.proxgraph.vector.VectorizationProvider;
import io.github.proxgraph.vector.types.VectorFloat;
import io.github.proxgraph.vector.types.VectorTypeSupport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

public final class TestUtil {
    public static final VectorTypeSupport vts = VectorizationProvider.getInstance().getVectorTypeSupport();

    private TestUtil() {}

    public static VectorFloat<?> vector(float... values) {
        return vts.createFloatVector(values);
    }

    /** Components uniform in [-1, 1). */
    public static VectorFloat<?> randomVector(Random random, int dimension) {
        float[] values = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            values[i] = random.nextFloat() * 2 - 1;
        }
        return vector(values);
    }

    public static List<VectorFloat<?>> createRandomVectors(Random random, int count, int dimension) {
        var vectors = new ArrayList<VectorFloat<?>>(count);
        for (int i = 0; i < count; i++) {
            vectors.add(randomVector(random, dimension));
        }
        return vectors;
    }

    /**
     * Builds a graph over every vector in {@code ravv}, inserting them in ordinal order.
     */
    public static GraphIndexBuilder buildGraph(RandomAccessVectorValues ravv, VectorSimilarityFunction vsf,
                                               int maxDegree, int efConstruction, Random random) {
        var bsp = BuildScoreProvider.randomAccessScoreProvider(ravv, vsf);
        var builder = new GraphIndexBuilder(bsp, maxDegree, efConstruction);
        for (int i = 0; i < ravv.size(); i++) {
            builder.addGraphNode(i, ravv.getVector(i), random);
        }
        return builder;
    }

    public static List<Integer> nodes(GraphSearchResult result) {
        var nodes = new ArrayList<Integer>();
        for (var ns : result.getNodes()) {
            nodes.add(ns.node);
        }
        return nodes;
    }

    public static List<Integer> nodes(GraphSearchResult.NodeScore[] scores) {
        var nodes = new ArrayList<Integer>();
        for (var ns : scores) {
            nodes.add(ns.node);
        }
        return nodes;
    }

    /**
     * Recall@k of graph search results against brute-force ground truth.
     */
    public static double recall(GraphSearchResult.NodeScore[] truth, GraphSearchResult.NodeScore[] found, int k) {
        return RecallCalculator.recall(asIds(truth), asIds(found), k);
    }

    private static List<Long> asIds(GraphSearchResult.NodeScore[] scores) {
        var ids = new ArrayList<Long>();
        for (var ns : scores) {
            ids.add((long) ns.node);
        }
        return ids;
    }

    public static List<Long> ids(SearchResult result) {
        var ids = new ArrayList<Long>();
        for (var hit : result.getHits()) {
            ids.add(hit.getId());
        }
        return ids;
    }

    /**
     * Removes a directory tree, ignoring files that are already gone.
     */
    public static void deleteQuietly(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
