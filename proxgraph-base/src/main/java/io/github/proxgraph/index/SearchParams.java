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

import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

/**
 * Per-query tuning: beam width, an optional metadata post-filter, and an optional cancellation signal.
 */
public final class SearchParams {
    private static final SearchParams DEFAULTS = builder().build();

    private final int ef;
    private final Predicate<Map<String, String>> filter;
    private final BooleanSupplier cancellation;

    private SearchParams(int ef, Predicate<Map<String, String>> filter, BooleanSupplier cancellation) {
        this.ef = ef;
        this.filter = filter;
        this.cancellation = cancellation;
    }

    public static SearchParams defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the requested beam width, or 0 to use the index default
     */
    public int getEf() {
        return ef;
    }

    /**
     * @return the metadata predicate results must satisfy, or null
     */
    public Predicate<Map<String, String>> getFilter() {
        return filter;
    }

    /**
     * @return polled between beam search steps; never null
     */
    public BooleanSupplier getCancellation() {
        return cancellation;
    }

    @Override
    public String toString() {
        return "SearchParams{ef=" + ef + ", filtered=" + (filter != null) + '}';
    }

    public static final class Builder {
        private int ef = 0;
        private Predicate<Map<String, String>> filter;
        private BooleanSupplier cancellation = () -> false;

        private Builder() {}

        /**
         * Wider beams find more of the true neighbors at the cost of more distance computations.
         * The engine raises values below k to k.
         */
        public Builder ef(int ef) {
            if (ef < 0) {
                throw new IllegalArgumentException("ef must not be negative, got " + ef);
            }
            this.ef = ef;
            return this;
        }

        /**
         * Keeps only results whose metadata matches.  The filter runs on the candidates the graph traversal
         * returns, so a very selective filter can yield fewer than k results; raise ef to compensate.
         */
        public Builder filter(Predicate<Map<String, String>> filter) {
            this.filter = filter;
            return this;
        }

        public Builder cancelWhen(BooleanSupplier cancellation) {
            this.cancellation = cancellation == null ? () -> false : cancellation;
            return this;
        }

        public SearchParams build() {
            return new SearchParams(ef, filter, cancellation);
        }
    }
}
