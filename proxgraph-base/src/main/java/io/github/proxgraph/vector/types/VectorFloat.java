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
 * A fixed-length vector of floats.  T is the type of the backing storage.
 */
public interface VectorFloat<T>
{
    /**
     * @return entire vector backing storage
     */
    T get();

    /**
     * @return the length of the vector
     */
    int length();

    default int offset(int i) {
        return i;
    }

    VectorFloat<T> copy();

    void copyFrom(VectorFloat<?> src, int srcOffset, int destOffset, int length);

    float get(int i);

    void set(int i, float value);

    void zero();

    /**
     * @return a new float[] holding the vector's values
     */
    default float[] toArray() {
        float[] result = new float[length()];
        for (int i = 0; i < result.length; i++) {
            result[i] = get(i);
        }
        return result;
    }

    default int getHashCode() {
        int result = 1;
        for (int i = 0; i < length(); i++) {
            if (get(i) != 0) {
                result = 31 * result + Float.hashCode(get(i));
            }
        }
        return result;
    }
}
