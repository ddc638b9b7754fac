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

package io.github.proxgraph.vector.types;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Creates, reads and writes the vector and byte-sequence types of one backing representation.
 */
public interface VectorTypeSupport {
    /**
     * Create a vector from the given data.
     *
     * @param data the data to create the vector from. Supported data types are implementation-dependent.
     * @return the created vector.
     */
    VectorFloat<?> createFloatVector(Object data);

    /**
     * Create a zero-filled vector of the given length.
     */
    VectorFloat<?> createFloatVector(int length);

    VectorFloat<?> readFloatVector(DataInput in, int size) throws IOException;

    void writeFloatVector(DataOutput out, VectorFloat<?> vector) throws IOException;

    ByteSequence<?> createByteSequence(Object data);

    ByteSequence<?> createByteSequence(int length);

    ByteSequence<?> readByteSequence(DataInput in, int size) throws IOException;

    void writeByteSequence(DataOutput out, ByteSequence<?> sequence) throws IOException;
}
