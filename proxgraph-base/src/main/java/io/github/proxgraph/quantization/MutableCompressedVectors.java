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

package io.github.proxgraph.quantization;

import io.github.proxgraph.vector.types.VectorFloat;

/**
 * Compressed vectors that can be added to after construction.  Safe for one writer per ordinal
 * alongside any number of readers.
 */
public interface MutableCompressedVectors<T> extends CompressedVectors {
    /**
     * Encode the given vector and set it at the given ordinal, replacing any previous code.
     */
    void encodeAndSet(int ordinal, VectorFloat<?> vector);

    /**
     * Store an already-encoded code at the given ordinal.
     */
    void set(int ordinal, T code);

    /**
     * @return the code at the ordinal, or null if none is set
     */
    T get(int ordinal);

    /**
     * Drop the code for the given ordinal.
     */
    void remove(int ordinal);
}
