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

/**
 * A fixed-length sequence of bytes, used to hold quantized codes.  T is the type of the backing storage.
 */
public interface ByteSequence<T>
{
    /**
     * @return entire sequence backing storage
     */
    T get();

    int offset();

    byte get(int i);

    void set(int i, byte value);

    void zero();

    int length();

    ByteSequence<T> copy();

    /**
     * @return a view of {@code length} bytes of this sequence starting at {@code offset}; writes go through to this sequence
     */
    ByteSequence<T> slice(int offset, int length);

    void copyFrom(ByteSequence<?> src, int srcOffset, int destOffset, int length);

    default int getHashCode() {
        int result = 1;
        for (int i = 0; i < length(); i++) {
            result = 31 * result + get(i);
        }
        return result;
    }
}
