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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import io.github.proxgraph.exceptions.VectorNotFoundException;
import io.github.proxgraph.graph.OnHeapGraphIndex;
import io.github.proxgraph.vector.types.VectorTypeSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.IntToLongFunction;

/**
 * Maps vector ids to records in a {@link BlobStore} and keeps the hot ones in memory.
 * <p>
 * Layout: {@value #HEADER_KEY} holds the {@link IndexHeader}, {@value #CODEBOOK_KEY} the current codebook,
 * {@value #NODE_TABLE_KEY} the graph topology, and {@code vectors/<id as 16 hex digits>} one
 * {@link VectorRecord} per vector.  Vector records are written as they change, the other blobs on flush.
 * <p>
 * Every blob store call is retried with exponential backoff; once the attempts are exhausted the last failure
 * is rethrown as an {@link UncheckedIOException}.
 */
public class VectorStore {
    private static final Logger LOG = LoggerFactory.getLogger(VectorStore.class);

    public static final String HEADER_KEY = "header";
    public static final String CODEBOOK_KEY = "codebook";
    public static final String NODE_TABLE_KEY = "graph/nodes";
    public static final String VECTOR_PREFIX = "vectors/";

    private static final long MAX_BACKOFF_MILLIS = 10_000;

    private final BlobStore blobStore;
    private final VectorTypeSupport vts;
    private final Cache<Long, VectorRecord> cache;
    private final int maxAttempts;
    private final long baseDelayMillis;

    /**
     * @param cacheSize       the maximum number of records kept in memory
     * @param maxAttempts     how many times a blob store call is tried before giving up
     * @param baseDelayMillis the pause after the first failure; it doubles after each further failure
     */
    public VectorStore(BlobStore blobStore, VectorTypeSupport vts, long cacheSize, int maxAttempts, long baseDelayMillis) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (baseDelayMillis < 0) {
            throw new IllegalArgumentException("baseDelayMillis must not be negative, got " + baseDelayMillis);
        }
        this.blobStore = blobStore;
        this.vts = vts;
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = baseDelayMillis;
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .recordStats()
                .build();
    }

    public BlobStore getBlobStore() {
        return blobStore;
    }

    static String keyFor(long id) {
        return VECTOR_PREFIX + String.format("%016x", id);
    }

    /**
     * Writes the record, replacing any record with the same id.
     */
    public void put(VectorRecord record) {
        byte[] bytes = serialize(out -> record.write(out, vts));
        String key = keyFor(record.getId());
        retrying("write", key, () -> {
            blobStore.write(key, bytes);
            return null;
        });
        cache.put(record.getId(), record);
    }

    /**
     * @return the record stored under {@code id}, including tombstoned records
     * @throws VectorNotFoundException if there is none
     */
    public VectorRecord get(long id) {
        var record = getIfPresent(id);
        if (record == null) {
            throw new VectorNotFoundException(id);
        }
        return record;
    }

    /**
     * @return the record stored under {@code id}, or null if there is none
     */
    public VectorRecord getIfPresent(long id) {
        var cached = cache.getIfPresent(id);
        if (cached != null) {
            return cached;
        }
        String key = keyFor(id);
        byte[] bytes = retrying("read", key, () -> blobStore.read(key));
        if (bytes == null) {
            return null;
        }
        var record = deserialize(key, bytes, in -> VectorRecord.read(in, vts));
        cache.put(id, record);
        return record;
    }

    public boolean contains(long id) {
        return getIfPresent(id) != null;
    }

    /**
     * Physically removes the record.
     *
     * @return true if a record was removed
     */
    public boolean delete(long id) {
        String key = keyFor(id);
        cache.invalidate(id);
        return retrying("delete", key, () -> blobStore.delete(key));
    }

    /**
     * Returns every stored record, tombstoned ones included, in ascending (unsigned) id order.  Each call to
     * {@code iterator()} starts a fresh pass over the keys present at that moment; records are read lazily and
     * bypass the cache, and records deleted during the pass are skipped.
     */
    public Iterable<VectorRecord> iterate() {
        return () -> new RecordIterator(retrying("list", VECTOR_PREFIX, () -> blobStore.listKeys(VECTOR_PREFIX)));
    }

    public IndexHeader readHeader() {
        return readBlob(HEADER_KEY, IndexHeader::read);
    }

    public void writeHeader(IndexHeader header) {
        writeBlob(HEADER_KEY, header::write);
    }

    public CodebookRecord readCodebook() {
        return readBlob(CODEBOOK_KEY, CodebookRecord::read);
    }

    public void writeCodebook(CodebookRecord codebook) {
        writeBlob(CODEBOOK_KEY, codebook::write);
    }

    public NodeTable readNodeTable() {
        return readBlob(NODE_TABLE_KEY, NodeTable::read);
    }

    public void writeNodeTable(OnHeapGraphIndex graph, IntToLongFunction idOf) {
        writeBlob(NODE_TABLE_KEY, out -> NodeTable.write(graph, idOf, out));
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public long cachedCount() {
        return cache.estimatedSize();
    }

    public void invalidateCache() {
        cache.invalidateAll();
    }

    private <T> T readBlob(String key, Reader<T> reader) {
        byte[] bytes = retrying("read", key, () -> blobStore.read(key));
        return bytes == null ? null : deserialize(key, bytes, reader);
    }

    private void writeBlob(String key, Writer writer) {
        byte[] bytes = serialize(writer);
        retrying("write", key, () -> {
            blobStore.write(key, bytes);
            return null;
        });
    }

    private static byte[] serialize(Writer writer) {
        var bytes = new ByteArrayOutputStream();
        try (var out = new DataOutputStream(bytes)) {
            writer.write(out);
        } catch (IOException e) {
            // in-memory stream
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    private static <T> T deserialize(String key, byte[] bytes, Reader<T> reader) {
        try (var in = new DataInputStream(new ByteArrayInputStream(bytes))) {
            return reader.read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Corrupt blob " + key, e);
        }
    }

    private <T> T retrying(String operation, String key, BlobCall<T> call) {
        IOException failure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.run();
            } catch (IOException e) {
                failure = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long delay = Math.min(MAX_BACKOFF_MILLIS, baseDelayMillis << Math.min(attempt - 1, 20));
                LOG.warn("Blob store {} of {} failed (attempt {} of {}), retrying in {} ms: {}",
                         operation, key, attempt, maxAttempts, delay, e.toString());
                sleep(delay);
            }
        }
        throw new UncheckedIOException(String.format("Blob store %s of %s failed after %d attempts", operation, key, maxAttempts),
                                       failure);
    }

    private static void sleep(long millis) {
        if (millis == 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var interrupted = new InterruptedIOException("Interrupted while backing off");
            interrupted.initCause(e);
            throw new UncheckedIOException(interrupted);
        }
    }

    private class RecordIterator implements Iterator<VectorRecord> {
        private final List<String> keys;
        private int position;
        private VectorRecord next;

        RecordIterator(List<String> keys) {
            this.keys = keys;
            advance();
        }

        private void advance() {
            next = null;
            while (next == null && position < keys.size()) {
                String key = keys.get(position++);
                byte[] bytes = retrying("read", key, () -> blobStore.read(key));
                if (bytes != null) {
                    next = deserialize(key, bytes, in -> VectorRecord.read(in, vts));
                } else {
                    LOG.debug("{} vanished during iteration", key);
                }
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public VectorRecord next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            var result = next;
            advance();
            return result;
        }
    }

    @FunctionalInterface
    private interface BlobCall<T> {
        T run() throws IOException;
    }

    @FunctionalInterface
    private interface Writer {
        void write(DataOutput out) throws IOException;
    }

    @FunctionalInterface
    private interface Reader<T> {
        T read(DataInput in) throws IOException;
    }
}
