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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * A BlobStore held entirely in memory.  Blobs are copied on the way in and out.
 */
public class InMemoryBlobStore implements BlobStore {
    private final ConcurrentSkipListMap<String, byte[]> blobs = new ConcurrentSkipListMap<>();

    @Override
    public void write(String key, byte[] bytes) {
        BlobStore.checkKey(key);
        blobs.put(key, Arrays.copyOf(bytes, bytes.length));
    }

    @Override
    public byte[] read(String key) {
        BlobStore.checkKey(key);
        byte[] bytes = blobs.get(key);
        return bytes == null ? null : Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public boolean delete(String key) {
        BlobStore.checkKey(key);
        return blobs.remove(key) != null;
    }

    @Override
    public List<String> listKeys(String prefix) {
        var keys = new ArrayList<String>();
        for (String key : blobs.tailMap(prefix, true).keySet()) {
            if (!key.startsWith(prefix)) {
                break;
            }
            keys.add(key);
        }
        return keys;
    }

    public int size() {
        return blobs.size();
    }

    /**
     * @return total bytes held
     */
    public long totalBytes() {
        return blobs.values().stream().mapToLong(b -> b.length).sum();
    }
}
