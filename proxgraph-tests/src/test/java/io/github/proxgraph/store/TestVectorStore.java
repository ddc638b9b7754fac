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

import io.github.proxgraph.ProxGraphTestCase;
import io.github.proxgraph.exceptions.VectorNotFoundException;
import io.github.proxgraph.quantization.QuantizerConfig;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import org.junit.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.proxgraph.TestUtil.vector;
import static io.github.proxgraph.TestUtil.vts;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestVectorStore extends ProxGraphTestCase {
    /**
     * Fails the next {@code failures} calls, then delegates.
     */
    private static class FlakyBlobStore implements BlobStore {
        private final BlobStore delegate = new InMemoryBlobStore();
        private final AtomicInteger failures = new AtomicInteger();
        private final AtomicInteger calls = new AtomicInteger();

        void failNext(int n) {
            failures.set(n);
        }

        private void maybeFail() throws IOException {
            calls.incrementAndGet();
            if (failures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IOException("injected failure");
            }
        }

        @Override
        public void write(String key, byte[] bytes) throws IOException {
            maybeFail();
            delegate.write(key, bytes);
        }

        @Override
        public byte[] read(String key) throws IOException {
            maybeFail();
            return delegate.read(key);
        }

        @Override
        public boolean delete(String key) throws IOException {
            maybeFail();
            return delegate.delete(key);
        }

        @Override
        public List<String> listKeys(String prefix) throws IOException {
            maybeFail();
            return delegate.listKeys(prefix);
        }
    }

    private static VectorRecord record(long id, int ordinal) {
        return new VectorRecord(id, ordinal, vector(id, ordinal), Map.of("id", String.valueOf(id)));
    }

    @Test
    public void testPutGetDelete() {
        var store = new VectorStore(new InMemoryBlobStore(), vts, 100, 1, 0);
        assertNull(store.getIfPresent(5));
        assertFalse(store.contains(5));

        store.put(record(5, 0));
        assertTrue(store.contains(5));
        var read = store.get(5);
        assertEquals(0, read.getOrdinal());
        assertEquals(vector(5, 0), read.getVector());
        assertEquals("5", read.getMetadata().get("id"));

        // bypass the cache
        store.invalidateCache();
        assertEquals(vector(5, 0), store.get(5).getVector());

        assertTrue(store.delete(5));
        assertFalse(store.delete(5));
        try {
            store.get(5);
            fail();
        } catch (VectorNotFoundException expected) {
        }
    }

    @Test
    public void testCacheServesRepeatedReads() {
        var blobs = new FlakyBlobStore();
        var store = new VectorStore(blobs, vts, 100, 1, 0);
        store.put(record(1, 0));
        int before = blobs.calls.get();
        for (int i = 0; i < 10; i++) {
            store.get(1);
        }
        assertEquals(before, blobs.calls.get());
        assertTrue(store.cacheStats().hitCount() >= 10);
    }

    @Test
    public void testTransientFailuresAreRetried() {
        var blobs = new FlakyBlobStore();
        var store = new VectorStore(blobs, vts, 0, 3, 1);
        blobs.failNext(2);
        store.put(record(7, 3));
        blobs.failNext(2);
        assertEquals(3, store.get(7).getOrdinal());
    }

    @Test
    public void testPersistentFailureSurfaces() {
        var blobs = new FlakyBlobStore();
        var store = new VectorStore(blobs, vts, 0, 3, 1);
        blobs.failNext(3);
        try {
            store.put(record(7, 3));
            fail();
        } catch (UncheckedIOException e) {
            assertEquals("injected failure", e.getCause().getMessage());
        }
        // nothing was written
        assertNull(store.getIfPresent(7));
    }

    @Test
    public void testIterateInIdOrder() {
        var store = new VectorStore(new InMemoryBlobStore(), vts, 10, 1, 0);
        store.put(record(300, 2));
        store.put(record(1, 0));
        store.put(record(20, 1).asDeleted());
        store.put(record(-1, 3));

        var ids = new ArrayList<Long>();
        var deleted = new ArrayList<Long>();
        for (var r : store.iterate()) {
            ids.add(r.getId());
            if (r.isDeleted()) {
                deleted.add(r.getId());
            }
        }
        // unsigned order puts -1 last
        assertEquals(List.of(1L, 20L, 300L, -1L), ids);
        assertEquals(List.of(20L), deleted);
    }

    @Test
    public void testHeaderAndCodebookBlobs() {
        var store = new VectorStore(new InMemoryBlobStore(), vts, 10, 1, 0);
        assertNull(store.readHeader());
        assertNull(store.readCodebook());
        assertNull(store.readNodeTable());

        var header = new IndexHeader(4, VectorSimilarityFunction.COSINE, 16, 100,
                                     QuantizerConfig.scalar(), 0, 12);
        store.writeHeader(header);
        assertEquals(header, store.readHeader());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsZeroAttempts() {
        new VectorStore(new InMemoryBlobStore(), vts, 10, 0, 0);
    }
}
