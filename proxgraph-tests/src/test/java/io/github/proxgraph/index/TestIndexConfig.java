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

import io.github.proxgraph.quantization.QuantizerConfig;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

public class TestIndexConfig {
    private static void assertInvalid(Consumer<IndexConfig.Builder> setting) {
        var builder = IndexConfig.builder(8, VectorSimilarityFunction.EUCLIDEAN);
        setting.accept(builder);
        try {
            builder.build();
            fail("expected " + builder + " to be rejected");
        } catch (IllegalArgumentException expected) {
        }
    }

    @Test
    public void testDefaults() {
        var config = IndexConfig.builder(8, VectorSimilarityFunction.COSINE).build();
        assertEquals(8, config.getDimension());
        assertEquals(VectorSimilarityFunction.COSINE, config.getSimilarityFunction());
        assertEquals(IndexConfig.DEFAULT_MAX_DEGREE, config.getMaxDegree());
        assertEquals(IndexConfig.DEFAULT_EF_CONSTRUCTION, config.getEfConstruction());
        assertEquals(IndexConfig.DEFAULT_EF_SEARCH, config.getDefaultEfSearch());
        assertEquals(QuantizerConfig.none(), config.getQuantizerConfig());
        assertEquals(IndexConfig.DEFAULT_SEED, config.getSeed());
        assertEquals(IndexConfig.DEFAULT_RETRY_ATTEMPTS, config.getRetryAttempts());
    }

    @Test
    public void testValidation() {
        assertInvalid(b -> b.maxDegree(1));
        assertInvalid(b -> b.efConstruction(0));
        assertInvalid(b -> b.defaultEfSearch(0));
        assertInvalid(b -> b.vectorCacheSize(-1));
        assertInvalid(b -> b.quantizer(null));
        assertInvalid(b -> b.quantizer(QuantizerConfig.product(9)));
        assertInvalid(b -> b.retry(0, 10));
        assertInvalid(b -> b.retry(1, -1));

        try {
            IndexConfig.builder(0, VectorSimilarityFunction.EUCLIDEAN).build();
            fail();
        } catch (IllegalArgumentException expected) {
        }
        try {
            IndexConfig.builder(4, null).build();
            fail();
        } catch (IllegalArgumentException expected) {
        }
        // a subspace per dimension is the finest split
        IndexConfig.builder(8, VectorSimilarityFunction.EUCLIDEAN).quantizer(QuantizerConfig.product(8)).build();
    }

    @Test
    public void testToBuilder() {
        var config = IndexConfig.builder(32, VectorSimilarityFunction.DOT_PRODUCT)
                .maxDegree(24)
                .efConstruction(200)
                .defaultEfSearch(80)
                .vectorCacheSize(10)
                .quantizer(QuantizerConfig.product(8, 6, true))
                .seed(7)
                .retry(5, 1)
                .build();
        assertEquals(config, config.toBuilder().build());
        assertEquals(config.hashCode(), config.toBuilder().build().hashCode());

        var changed = config.toBuilder().defaultEfSearch(81).build();
        assertNotEquals(config, changed);
        assertEquals(24, changed.getMaxDegree());
        assertEquals(QuantizerConfig.product(8, 6, true), changed.getQuantizerConfig());
    }

    @Test
    public void testQuantizerConfig() {
        assertEquals(0, QuantizerConfig.none().requiredSamples());
        assertEquals(QuantizerConfig.DEFAULT_MIN_SCALAR_SAMPLES, QuantizerConfig.scalar().requiredSamples());
        assertEquals(4 * 256, QuantizerConfig.product(16).requiredSamples());
        assertEquals(4 * 16, QuantizerConfig.product(2, 4, false).requiredSamples());

        for (Runnable r : List.<Runnable>of(() -> QuantizerConfig.scalar(0),
                                            () -> QuantizerConfig.product(0),
                                            () -> QuantizerConfig.product(4, 9, false),
                                            () -> QuantizerConfig.product(4, 0, false),
                                            () -> QuantizerConfig.product(4, 8, false, 0, 4),
                                            () -> QuantizerConfig.product(4, 8, false, 10, 0))) {
            try {
                r.run();
                fail();
            } catch (IllegalArgumentException expected) {
            }
        }
    }

    @Test
    public void testSearchParams() {
        var defaults = SearchParams.defaults();
        assertEquals(0, defaults.getEf());
        assertNull(defaults.getFilter());
        assertFalse(defaults.getCancellation().getAsBoolean());

        var params = SearchParams.builder().ef(64).cancelWhen(null).build();
        assertEquals(64, params.getEf());
        assertFalse(params.getCancellation().getAsBoolean());
        try {
            SearchParams.builder().ef(-1);
            fail();
        } catch (IllegalArgumentException expected) {
        }
    }

    @Test
    public void testRecall() {
        assertEquals(1.0, RecallCalculator.recall(List.of(1L, 2L, 3L), List.of(3L, 2L, 1L), 3), 0.0);
        assertEquals(2.0 / 3, RecallCalculator.recall(List.of(1L, 2L, 3L), List.of(1L, 4L, 2L), 3), 1e-9);
        // only the first k retrieved count
        assertEquals(0.5, RecallCalculator.recall(List.of(1L, 2L), List.of(1L, 5L, 2L), 2), 0.0);
        // fewer true neighbors than k
        assertEquals(1.0, RecallCalculator.recall(List.of(1L), List.of(1L, 7L), 5), 0.0);
        assertEquals(1.0, RecallCalculator.recall(List.of(), List.of(1L), 5), 0.0);
        assertEquals(0.0, RecallCalculator.recall(List.of(1L, 2L), List.of(), 2), 0.0);
        try {
            RecallCalculator.recall(List.of(1L), List.of(1L), 0);
            fail();
        } catch (IllegalArgumentException expected) {
        }

        var truth = new SearchResult(List.of(new SearchResult.Hit(1, 0f, Map.of())), 1, 0, 1, 0);
        var miss = new SearchResult(List.of(new SearchResult.Hit(2, 0f, Map.of())), 1, 0, 1, 0);
        assertEquals(0.5, RecallCalculator.meanRecall(List.of(truth, truth), List.of(truth, miss), 1), 0.0);
        assertEquals(1.0, RecallCalculator.meanRecall(List.of(), List.of(), 1), 0.0);
        try {
            RecallCalculator.meanRecall(List.of(truth), List.of(), 1);
            fail();
        } catch (IllegalArgumentException expected) {
        }
    }
}
