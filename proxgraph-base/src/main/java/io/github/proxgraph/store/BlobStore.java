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

package io.github.proxgraph.store;

import java.io.IOException;
import java.util.List;

/**
 * A durable key/value store for opaque byte blobs.  The index persists everything it owns through this
 * interface; replication and durability guarantees are up to the implementation.
 * <p>
 * Keys are non-empty strings of {@code [A-Za-z0-9._-]} segments separated by {@code /}.
 * Implementations must be threadsafe.
 */
public interface BlobStore {
    /**
     * Stores {@code bytes} under {@code key}, replacing any existing blob atomically.
     */
    void write(String key, byte[] bytes) throws IOException;

    /**
     * @return the blob stored under {@code key}, or null if there is none
     */
    byte[] read(String key) throws IOException;

    /**
     * @return true if a blob was removed
     */
    boolean delete(String key) throws IOException;

    /**
     * @return the keys starting with {@code prefix}, in ascending order
     */
    List<String> listKeys(String prefix) throws IOException;

    static void checkKey(String key) {
        if (key == null || key.isEmpty() || key.startsWith("/") || key.endsWith("/")) {
            throw new IllegalArgumentException("Invalid blob key: " + key);
        }
        for (String segment : key.split("/")) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..") || !segment.matches("[A-Za-z0-9._-]+")) {
                throw new IllegalArgumentException("Invalid blob key: " + key);
            }
        }
    }
}
