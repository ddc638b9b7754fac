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

import io.github.proxgraph.graph.RandomAccessVectorValues;
import io.github.proxgraph.store.VectorStore;
import io.github.proxgraph.vector.types.VectorFloat;

/**
 * Exposes the full-precision vectors of the graph nodes, by ordinal, through the vector store's cache.
 */
final class StoreVectorValues implements RandomAccessVectorValues {
    private final VectorStore store;
    private final OrdinalMap ordinals;
    private final int dimension;

    StoreVectorValues(VectorStore store, OrdinalMap ordinals, int dimension) {
        this.store = store;
        this.ordinals = ordinals;
        this.dimension = dimension;
    }

    @Override
    public int size() {
        return ordinals.nextOrdinal();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public VectorFloat<?> getVector(int ordinal) {
        if (!ordinals.hasOrdinal(ordinal)) {
            return null;
        }
        var retired = ordinals.retiredVector(ordinal);
        if (retired != null) {
            return retired;
        }
        var record = store.getIfPresent(ordinals.idOf(ordinal));
        if (record == null || record.getOrdinal() != ordinal) {
            return null;
        }
        return record.getVector();
    }
}
