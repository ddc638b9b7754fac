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

import java.util.Objects;

/**
 * Immutable settings of a {@link VectorIndex}.  The graph and quantizer settings become part of the persisted
 * header; the cache and retry settings only affect the running instance.
 * <p>
 * Defaults for the tunables can be overridden with the system properties {@code proxgraph.maxDegree},
 * {@code proxgraph.efConstruction}, {@code proxgraph.efSearch} and {@code proxgraph.vectorCacheSize}.
 */
public final class IndexConfig {
    public static final int DEFAULT_MAX_DEGREE = Integer.getInteger("proxgraph.maxDegree", 16);
    public static final int DEFAULT_EF_CONSTRUCTION = Integer.getInteger("proxgraph.efConstruction", 100);
    public static final int DEFAULT_EF_SEARCH = Integer.getInteger("proxgraph.efSearch", 50);
    public static final int DEFAULT_VECTOR_CACHE_SIZE = Integer.getInteger("proxgraph.vectorCacheSize", 100_000);
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_BASE_DELAY_MILLIS = 10;
    public static final long DEFAULT_SEED = 42;

    private final int dimension;
    private final VectorSimilarityFunction similarityFunction;
    private final int maxDegree;
    private final int efConstruction;
    private final int defaultEfSearch;
    private final int vectorCacheSize;
    private final QuantizerConfig quantizerConfig;
    private final long seed;
    private final int retryAttempts;
    private final long retryBaseDelayMillis;

    private IndexConfig(Builder b) {
        this.dimension = b.dimension;
        this.similarityFunction = b.similarityFunction;
        this.maxDegree = b.maxDegree;
        this.efConstruction = b.efConstruction;
        this.defaultEfSearch = b.defaultEfSearch;
        this.vectorCacheSize = b.vectorCacheSize;
        this.quantizerConfig = b.quantizerConfig;
        this.seed = b.seed;
        this.retryAttempts = b.retryAttempts;
        this.retryBaseDelayMillis = b.retryBaseDelayMillis;
    }

    public static Builder builder(int dimension, VectorSimilarityFunction similarityFunction) {
        return new Builder(dimension, similarityFunction);
    }

    public Builder toBuilder() {
        return new Builder(dimension, similarityFunction)
                .maxDegree(maxDegree)
                .efConstruction(efConstruction)
                .defaultEfSearch(defaultEfSearch)
                .vectorCacheSize(vectorCacheSize)
                .quantizer(quantizerConfig)
                .seed(seed)
                .retry(retryAttempts, retryBaseDelayMillis);
    }

    public int getDimension() {
        return dimension;
    }

    public VectorSimilarityFunction getSimilarityFunction() {
        return similarityFunction;
    }

    public int getMaxDegree() {
        return maxDegree;
    }

    public int getEfConstruction() {
        return efConstruction;
    }

    public int getDefaultEfSearch() {
        return defaultEfSearch;
    }

    public int getVectorCacheSize() {
        return vectorCacheSize;
    }

    public QuantizerConfig getQuantizerConfig() {
        return quantizerConfig;
    }

    /**
     * @return the seed of the level draws and of codebook training
     */
    public long getSeed() {
        return seed;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public long getRetryBaseDelayMillis() {
        return retryBaseDelayMillis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IndexConfig that = (IndexConfig) o;
        return dimension == that.dimension && maxDegree == that.maxDegree && efConstruction == that.efConstruction
               && defaultEfSearch == that.defaultEfSearch && vectorCacheSize == that.vectorCacheSize && seed == that.seed
               && retryAttempts == that.retryAttempts && retryBaseDelayMillis == that.retryBaseDelayMillis
               && similarityFunction == that.similarityFunction && quantizerConfig.equals(that.quantizerConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, similarityFunction, maxDegree, efConstruction, defaultEfSearch, vectorCacheSize,
                            quantizerConfig, seed, retryAttempts, retryBaseDelayMillis);
    }

    @Override
    public String toString() {
        return "IndexConfig{" +
               "dimension=" + dimension +
               ", similarityFunction=" + similarityFunction +
               ", maxDegree=" + maxDegree +
               ", efConstruction=" + efConstruction +
               ", defaultEfSearch=" + defaultEfSearch +
               ", vectorCacheSize=" + vectorCacheSize +
               ", quantizer=" + quantizerConfig +
               ", seed=" + seed +
               '}';
    }

    public static final class Builder {
        private final int dimension;
        private final VectorSimilarityFunction similarityFunction;
        private int maxDegree = DEFAULT_MAX_DEGREE;
        private int efConstruction = DEFAULT_EF_CONSTRUCTION;
        private int defaultEfSearch = DEFAULT_EF_SEARCH;
        private int vectorCacheSize = DEFAULT_VECTOR_CACHE_SIZE;
        private QuantizerConfig quantizerConfig = QuantizerConfig.none();
        private long seed = DEFAULT_SEED;
        private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        private long retryBaseDelayMillis = DEFAULT_RETRY_BASE_DELAY_MILLIS;

        private Builder(int dimension, VectorSimilarityFunction similarityFunction) {
            this.dimension = dimension;
            this.similarityFunction = similarityFunction;
        }

        /** the degree bound M of the upper levels; level 0 allows 2M */
        public Builder maxDegree(int maxDegree) {
            this.maxDegree = maxDegree;
            return this;
        }

        public Builder efConstruction(int efConstruction) {
            this.efConstruction = efConstruction;
            return this;
        }

        public Builder defaultEfSearch(int defaultEfSearch) {
            this.defaultEfSearch = defaultEfSearch;
            return this;
        }

        public Builder vectorCacheSize(int vectorCacheSize) {
            this.vectorCacheSize = vectorCacheSize;
            return this;
        }

        public Builder quantizer(QuantizerConfig quantizerConfig) {
            this.quantizerConfig = quantizerConfig;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder retry(int attempts, long baseDelayMillis) {
            this.retryAttempts = attempts;
            this.retryBaseDelayMillis = baseDelayMillis;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a setting is out of range
         */
        public IndexConfig build() {
            if (dimension <= 0) {
                throw new IllegalArgumentException("dimension must be positive, got " + dimension);
            }
            if (similarityFunction == null) {
                throw new IllegalArgumentException("similarity function is required");
            }
            if (maxDegree < 2) {
                throw new IllegalArgumentException("maxDegree must be at least 2, got " + maxDegree);
            }
            if (efConstruction < 1 || defaultEfSearch < 1) {
                throw new IllegalArgumentException(String.format("efConstruction (%d) and defaultEfSearch (%d) must be positive",
                                                                 efConstruction, defaultEfSearch));
            }
            if (vectorCacheSize < 0) {
                throw new IllegalArgumentException("vectorCacheSize must not be negative, got " + vectorCacheSize);
            }
            if (quantizerConfig == null) {
                throw new IllegalArgumentException("quantizer config is required; use QuantizerConfig.none()");
            }
            if (quantizerConfig.getType() == QuantizerConfig.Type.PRODUCT && quantizerConfig.getSubspaceCount() > dimension) {
                throw new IllegalArgumentException(String.format("Cannot split %d dimensions into %d subspaces",
                                                                 dimension, quantizerConfig.getSubspaceCount()));
            }
            if (retryAttempts < 1 || retryBaseDelayMillis < 0) {
                throw new IllegalArgumentException(String.format("Invalid retry settings: %d attempts, %d ms",
                                                                 retryAttempts, retryBaseDelayMillis));
            }
            return new IndexConfig(this);
        }
    }
}
