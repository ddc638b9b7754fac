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

import io.github.proxgraph.vector.types.VectorFloat;

/**
 * Provides random access to vectors by dense ordinal. This interface is used by graph-based
 * implementations of KNN search.
 */
public interface RandomAccessVectorValues {
    /**
     * Returns the number of vector slots in this collection.  Some slots may be empty, in which case
     * {@link #getVector} returns null.
     */
    int size();

    /** Returns the dimensionality of the vectors in this collection. */
    int dimension();

    /**
     * Return the vector value indexed at the given ordinal, or null if the ordinal is currently empty.
     * Callers must not modify the returned vector.
     *
     * @param nodeId a valid ordinal, &ge; 0 and &lt; {@link #size()}.
     */
    VectorFloat<?> getVector(int nodeId);
}
