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

import io.github.proxgraph.annotations.VisibleForTesting;
import io.github.proxgraph.exceptions.DimensionMismatchException;
import io.github.proxgraph.exceptions.DuplicateIdException;
import io.github.proxgraph.exceptions.IndexReadOnlyException;
import io.github.proxgraph.exceptions.InternalInconsistencyException;
import io.github.proxgraph.exceptions.VectorNotFoundException;
import io.github.proxgraph.graph.GraphIndexBuilder;
import io.github.proxgraph.graph.OnHeapGraphIndex;
import io.github.proxgraph.graph.similarity.BuildScoreProvider;
import io.github.proxgraph.quantization.CodebookGeneration;
import io.github.proxgraph.quantization.ProductQuantization;
import io.github.proxgraph.quantization.QuantizerConfig;
import io.github.proxgraph.quantization.ScalarQuantization;
import io.github.proxgraph.quantization.VectorCompressor;
import io.github.proxgraph.store.BlobStore;
import io.github.proxgraph.store.CodebookRecord;
import io.github.proxgraph.store.IndexHeader;
import io.github.proxgraph.store.NodeTable;
import io.github.proxgraph.store.VectorRecord;
import io.github.proxgraph.store.VectorStore;
import io.github.proxgraph.util.PhysicalCoreExecutor;
import io.github.proxgraph.vector.VectorUtil;
import io.github.proxgraph.vector.VectorizationProvider;
import io.github.proxgraph.vector.types.ByteSequence;
import io.github.proxgraph.vector.types.VectorFloat;
import io.github.proxgraph.vector.types.VectorTypeSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A persistent approximate nearest neighbor index: an HNSW graph over vectors kept in a {@link VectorStore},
 * optionally steered by a trained quantizer.
 * <p>
 * Writers ({@link #insert}, {@link #delete}, {@link #trainQuantizer}, {@link #compact}, {@link #flush}) are
 * serialized.  Searches run concurrently with each other and with inserts and deletes; a node becomes visible to
 * searches only once it is fully linked.  Compaction excludes searches while it rewires the graph.
 * <p>
 * If an internal inconsistency is ever detected, the index turns read-only: searches keep working where they can,
 * writes fail with {@link IndexReadOnlyException}, and {@link #needsRebuild()} reports true.
 */
public class VectorIndex implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(VectorIndex.class);
    private static final VectorTypeSupport vts = VectorizationProvider.getInstance().getVectorTypeSupport();

    private final IndexConfig config;
    private final VectorStore store;
    private final OnHeapGraphIndex graph;
    private final GraphIndexBuilder builder;
    private final OrdinalMap ordinals;
    private final StoreVectorValues vectors;
    private final AtomicReference<CodebookGeneration> generation;
    private final QueryEngine queryEngine;
    private final Random random;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final ReentrantReadWriteLock structureLock = new ReentrantReadWriteLock();
    private final AtomicBoolean closed = new AtomicBoolean();

    // guarded by writeLock
    private long codebookVersion;
    private volatile InternalInconsistencyException readOnlyCause;

    private VectorIndex(IndexConfig config, VectorStore store, OnHeapGraphIndex graph, OrdinalMap ordinals,
                        CodebookGeneration generation, long codebookVersion, Random random) {
        this.config = config;
        this.store = store;
        this.graph = graph;
        this.ordinals = ordinals;
        this.vectors = new StoreVectorValues(store, ordinals, config.getDimension());
        this.generation = new AtomicReference<>(generation);
        this.codebookVersion = codebookVersion;
        this.random = random;
        var bsp = BuildScoreProvider.randomAccessScoreProvider(vectors, config.getSimilarityFunction());
        this.builder = new GraphIndexBuilder(bsp, graph, config.getEfConstruction());
        this.queryEngine = new QueryEngine(config, graph, store, ordinals, vectors, this.generation::get);
    }

    /**
     * Creates an empty index in a blob store that does not hold one yet.
     */
    public static VectorIndex create(BlobStore blobStore, IndexConfig config) {
        var store = newStore(blobStore, config);
        if (store.readHeader() != null) {
            throw new IllegalArgumentException("Blob store already holds an index");
        }
        var index = new VectorIndex(config, store, new OnHeapGraphIndex(config.getMaxDegree()), new OrdinalMap(0),
                                    null, 0, new Random(config.getSeed()));
        store.writeHeader(index.header());
        LOG.info("Created index {}", config);
        return index;
    }

    /**
     * Opens an existing index with default runtime settings.
     */
    public static VectorIndex open(BlobStore blobStore) {
        var store = new VectorStore(blobStore, vts, IndexConfig.DEFAULT_VECTOR_CACHE_SIZE,
                                    IndexConfig.DEFAULT_RETRY_ATTEMPTS, IndexConfig.DEFAULT_RETRY_BASE_DELAY_MILLIS);
        var header = requireHeader(store);
        var config = IndexConfig.builder(header.getDimension(), header.getSimilarityFunction())
                .maxDegree(header.getMaxDegree())
                .efConstruction(header.getEfConstruction())
                .quantizer(header.getQuantizerConfig())
                .build();
        return load(store, header, config);
    }

    /**
     * Opens an existing index with the runtime settings (search ef, cache size, seed, retries) of {@code config}.
     * The graph and quantizer settings always come from the stored header.
     *
     * @throws IllegalArgumentException if the stored dimension or similarity function differ from {@code config}
     */
    public static VectorIndex open(BlobStore blobStore, IndexConfig config) {
        var store = newStore(blobStore, config);
        var header = requireHeader(store);
        if (header.getDimension() != config.getDimension() || header.getSimilarityFunction() != config.getSimilarityFunction()) {
            throw new IllegalArgumentException(String.format("Stored index is %d-dimensional %s, not %d-dimensional %s",
                                                             header.getDimension(), header.getSimilarityFunction(),
                                                             config.getDimension(), config.getSimilarityFunction()));
        }
        var effective = config.toBuilder()
                .maxDegree(header.getMaxDegree())
                .efConstruction(header.getEfConstruction())
                .quantizer(header.getQuantizerConfig())
                .build();
        return load(store, header, effective);
    }

    private static VectorStore newStore(BlobStore blobStore, IndexConfig config) {
        return new VectorStore(blobStore, vts, config.getVectorCacheSize(), config.getRetryAttempts(), config.getRetryBaseDelayMillis());
    }

    private static IndexHeader requireHeader(VectorStore store) {
        var header = store.readHeader();
        if (header == null) {
            throw new IllegalArgumentException("Blob store holds no index");
        }
        return header;
    }

    private static VectorIndex load(VectorStore store, IndexHeader header, IndexConfig config) {
        String problem = null;
        var codebook = store.readCodebook();
        CodebookGeneration gen = null;
        if (codebook != null) {
            var compressor = codebook.getCompressor();
            gen = new CodebookGeneration(codebook.getVersion(), compressor, compressor.createCompressedVectors(header.getNextOrdinal()));
        }
        if (codebook == null ? header.getCodebookVersion() > 0 : codebook.getVersion() < header.getCodebookVersion()) {
            problem = "Codebook version " + header.getCodebookVersion() + " is missing";
        }
        long version = Math.max(header.getCodebookVersion(), codebook == null ? 0 : codebook.getVersion());

        var table = store.readNodeTable();
        var graph = table == null ? new OnHeapGraphIndex(header.getMaxDegree()) : table.getGraph();
        if (graph.maxDegree() != header.getMaxDegree()) {
            throw new InternalInconsistencyException(String.format("Node table degree %d does not match header degree %d",
                                                                   graph.maxDegree(), header.getMaxDegree()));
        }

        var index = new VectorIndex(config, store, graph, new OrdinalMap(header.getNextOrdinal()), gen, version,
                                    new Random(config.getSeed() + header.getNextOrdinal()));
        String recovered = index.recover(table);
        if (problem == null) {
            problem = recovered;
        }
        if (problem != null) {
            index.flagReadOnly(new InternalInconsistencyException(problem));
        }
        return index;
    }

    /**
     * Reconciles the stored graph with the stored vector records: restores tombstones and codes, purges nodes whose
     * vector is gone, and links inserts that were written after the last flush.
     *
     * @return a description of lost data, or null
     */
    private String recover(NodeTable table) {
        var gen = generation.get();
        var pending = new ArrayList<VectorRecord>();
        int orphans = 0;
        int recoded = 0;

        for (var record : store.iterate()) {
            int ordinal = record.getOrdinal();
            ordinals.ensureNextOrdinalAbove(ordinal);
            if (!graph.containsNode(ordinal)) {
                if (record.isDeleted()) {
                    store.delete(record.getId());
                    orphans++;
                } else {
                    pending.add(record);
                }
                continue;
            }
            if (table.idOf(ordinal) != record.getId()) {
                throw new InternalInconsistencyException(String.format("Graph node %d belongs to vector %d, but vector %d claims it",
                                                                       ordinal, table.idOf(ordinal), record.getId()));
            }
            if (record.isDeleted()) {
                graph.markDeleted(ordinal);
            }
            ordinals.register(ordinal, record.getId(), !graph.isDeleted(ordinal));
            if (gen != null && restoreCode(gen, record)) {
                recoded++;
            }
        }

        String problem = null;
        int unavailable = 0;
        for (int node : graph.nodesOnLevel(0)) {
            ordinals.ensureNextOrdinalAbove(node);
            if (ordinals.hasOrdinal(node)) {
                continue;
            }
            long id = table.idOf(node);
            var current = store.getIfPresent(id);
            boolean superseded = current != null && current.getOrdinal() != node;
            if (!graph.isDeleted(node) && !superseded) {
                problem = "Vector " + id + " of graph node " + node + " is missing";
                LOG.error("{}; the node is dropped", problem);
            }
            ordinals.register(node, id, false);
            graph.markDeleted(node);
            unavailable++;
        }
        // the graph cannot be traversed through nodes without vectors
        if (unavailable > 0) {
            compactInternal();
        }

        pending.sort(Comparator.comparingInt(VectorRecord::getOrdinal));
        for (var record : pending) {
            int ordinal = record.getOrdinal();
            ordinals.register(ordinal, record.getId(), false);
            if (gen != null && restoreCode(gen, record)) {
                recoded++;
            }
            builder.addGraphNode(ordinal, record.getVector(), random);
            ordinals.link(record.getId(), ordinal);
        }
        if (!pending.isEmpty() || orphans > 0) {
            flushInternal();
        }

        LOG.info("Opened index with {} nodes ({} live): replayed {} inserts, dropped {} unavailable nodes "
                 + "and {} orphaned tombstones, re-encoded {} vectors",
                 graph.size(), ordinals.liveCount(), pending.size(), unavailable, orphans, recoded);
        return problem;
    }

    /**
     * @return true if the stored code was stale and had to be recomputed
     */
    private boolean restoreCode(CodebookGeneration gen, VectorRecord record) {
        if (record.getCodeVersion() == gen.getVersion()) {
            gen.getVectors().set(record.getOrdinal(), record.getCode());
            return false;
        }
        var code = gen.getCompressor().encode(record.getVector());
        gen.getVectors().set(record.getOrdinal(), code);
        if (!record.isDeleted()) {
            store.put(record.withCode(gen.getVersion(), code));
        }
        return true;
    }

    public IndexConfig getConfig() {
        return config;
    }

    public void insert(long id, VectorFloat<?> vector) {
        insert(id, vector, Map.of(), false);
    }

    public void insert(long id, VectorFloat<?> vector, Map<String, String> metadata) {
        insert(id, vector, metadata, false);
    }

    /**
     * Stores the vector and links it into the graph.  Once this returns, the vector is visible to searches.
     *
     * @param overwrite if true, a live vector with the same id is deleted first; otherwise it is an error
     * @throws DimensionMismatchException if the vector has the wrong dimension; the index is left unchanged
     * @throws DuplicateIdException if the id is live and {@code overwrite} is false
     */
    public void insert(long id, VectorFloat<?> vector, Map<String, String> metadata, boolean overwrite) {
        checkWritable();
        if (vector == null) {
            throw new IllegalArgumentException("vector must not be null");
        }
        DimensionMismatchException.check(config.getDimension(), vector.length());

        writeLock.lock();
        try {
            checkWritable();
            if (ordinals.liveOrdinal(id) >= 0) {
                if (!overwrite) {
                    throw new DuplicateIdException(id);
                }
                deleteLocked(id);
            }
            retirePrevious(id);

            int ordinal = ordinals.allocate();
            var record = new VectorRecord(id, ordinal, vector, metadata);
            var gen = generation.get();
            if (gen != null) {
                record = record.withCode(gen.getVersion(), gen.getCompressor().encode(vector));
            }
            store.put(record);
            ordinals.register(ordinal, id, false);
            if (gen != null) {
                gen.getVectors().set(ordinal, record.getCode());
            }
            try {
                builder.addGraphNode(ordinal, vector, random);
            } catch (RuntimeException e) {
                abandon(record, e);
                throw e;
            }
            ordinals.link(id, ordinal);
        } catch (InternalInconsistencyException e) {
            flagReadOnly(e);
            throw e;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * The record about to be overwritten may still back a tombstoned graph node; keep its vector until compaction.
     */
    private void retirePrevious(long id) {
        var previous = store.getIfPresent(id);
        if (previous == null) {
            return;
        }
        int ordinal = previous.getOrdinal();
        if (graph.containsNode(ordinal) && ordinals.retiredVector(ordinal) == null) {
            ordinals.retire(ordinal, previous.getVector());
        }
    }

    /**
     * Tombstones the record of an insert that could not be linked.
     */
    private void abandon(VectorRecord record, RuntimeException cause) {
        if (!graph.containsNode(record.getOrdinal())) {
            ordinals.forget(record.getOrdinal());
            var gen = generation.get();
            if (gen != null) {
                gen.getVectors().remove(record.getOrdinal());
            }
        }
        try {
            store.put(record.asDeleted());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Tombstones the vector.  It disappears from search results at once; its graph node is purged by
     * {@link #compact()}.
     *
     * @throws VectorNotFoundException if no live vector has this id
     */
    public void delete(long id) {
        checkWritable();
        writeLock.lock();
        try {
            checkWritable();
            deleteLocked(id);
        } catch (InternalInconsistencyException e) {
            flagReadOnly(e);
            throw e;
        } finally {
            writeLock.unlock();
        }
    }

    private void deleteLocked(long id) {
        int ordinal = ordinals.liveOrdinal(id);
        if (ordinal < 0) {
            throw new VectorNotFoundException(id);
        }
        store.put(store.get(id).asDeleted());
        builder.markNodeDeleted(ordinal);
        ordinals.unlink(id);
    }

    public boolean contains(long id) {
        return ordinals.liveOrdinal(id) >= 0;
    }

    /**
     * @throws VectorNotFoundException if no live vector has this id
     */
    public VectorRecord get(long id) {
        if (!contains(id)) {
            throw new VectorNotFoundException(id);
        }
        var record = store.get(id);
        if (record.isDeleted()) {
            throw new VectorNotFoundException(id);
        }
        return record;
    }

    /**
     * @return the number of live vectors
     */
    public int size() {
        return ordinals.liveCount();
    }

    public SearchResult search(VectorFloat<?> query, int k) {
        return search(query, k, SearchParams.defaults());
    }

    /**
     * Approximate k nearest neighbor search.
     *
     * @throws DimensionMismatchException if the query has the wrong dimension
     * @throws java.util.concurrent.CancellationException if the search was cancelled through {@code params}
     */
    public SearchResult search(VectorFloat<?> query, int k, SearchParams params) {
        var lock = structureLock.readLock();
        lock.lock();
        try {
            return queryEngine.search(query, k, params);
        } catch (InternalInconsistencyException e) {
            flagReadOnly(e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Exact k nearest neighbor search over every live vector.
     */
    public SearchResult exactSearch(VectorFloat<?> query, int k, SearchParams params) {
        var lock = structureLock.readLock();
        lock.lock();
        try {
            return queryEngine.exactSearch(query, k, params);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Trains a quantizer on up to {@code sampleSize} live vectors chosen at random.
     *
     * @return the version of the installed codebook
     */
    public long trainQuantizer(int sampleSize) {
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("sampleSize must be positive, got " + sampleSize);
        }
        List<Integer> live = ordinals.liveOrdinals();
        Collections.shuffle(live, new Random(config.getSeed()));
        var sample = new ArrayList<VectorFloat<?>>(Math.min(sampleSize, live.size()));
        for (int ordinal : live.subList(0, Math.min(sampleSize, live.size()))) {
            var v = vectors.getVector(ordinal);
            if (v != null) {
                sample.add(v);
            }
        }
        return trainQuantizer(sample);
    }

    /**
     * Trains a new codebook of the configured type on {@code sample}, re-encodes every vector with it and swaps it
     * in.  Searches already running finish with the codebook they started with.
     *
     * @return the version of the installed codebook
     * @throws IllegalStateException if the index was created without a quantizer
     * @throws io.github.proxgraph.exceptions.InsufficientSamplesException if the sample is too small
     */
    public long trainQuantizer(List<? extends VectorFloat<?>> sample) {
        checkWritable();
        var qc = config.getQuantizerConfig();
        if (qc.getType() == QuantizerConfig.Type.NONE) {
            throw new IllegalStateException("Index has no quantizer configured");
        }
        for (var v : sample) {
            DimensionMismatchException.check(config.getDimension(), v.length());
        }

        // training touches no index state, so it runs outside the writer lock
        LOG.info("Training {} quantizer on {} samples", qc.getType(), sample.size());
        long start = System.nanoTime();
        VectorCompressor<ByteSequence<?>> compressor;
        if (qc.getType() == QuantizerConfig.Type.SCALAR) {
            compressor = ScalarQuantization.train(sample, qc);
        } else {
            compressor = ProductQuantization.train(sample, qc, config.getSeed(), PhysicalCoreExecutor.pool());
        }
        LOG.info("Trained {} in {} ms; mean squared reconstruction error {}",
                 compressor, (System.nanoTime() - start) / 1_000_000, reconstructionError(compressor, sample));

        writeLock.lock();
        try {
            checkWritable();
            long version = codebookVersion + 1;
            var codes = compressor.encodeAll(vectors, PhysicalCoreExecutor.pool());
            var next = new CodebookGeneration(version, compressor, codes);
            store.writeCodebook(new CodebookRecord(version, compressor));
            var previous = generation.getAndSet(next);
            if (previous != null) {
                // searches still holding the old generation score later inserts exactly
                previous.retire(ordinals.nextOrdinal());
            }
            codebookVersion = version;
            store.writeHeader(header());
            persistCodes(next);
            LOG.info("Installed codebook generation {} with {} codes", version, codes.count());
            return version;
        } catch (InternalInconsistencyException e) {
            flagReadOnly(e);
            throw e;
        } finally {
            writeLock.unlock();
        }
    }

    private static double reconstructionError(VectorCompressor<ByteSequence<?>> compressor, List<? extends VectorFloat<?>> sample) {
        if (sample.isEmpty()) {
            return 0;
        }
        double total = 0;
        for (var v : sample) {
            total += VectorUtil.squareL2Distance(v, compressor.decode(compressor.encode(v)));
        }
        return total / sample.size();
    }

    private void persistCodes(CodebookGeneration gen) {
        var live = ordinals.liveOrdinals();
        PhysicalCoreExecutor.pool().submit(() -> live.parallelStream().forEach(ordinal -> {
            var record = store.getIfPresent(ordinals.idOf(ordinal));
            if (record != null && record.getOrdinal() == ordinal) {
                store.put(record.withCode(gen.getVersion(), gen.getVectors().get(ordinal)));
            }
        })).join();
    }

    public IndexStats stats() {
        var gen = generation.get();
        var entry = graph.entryNode();
        return new IndexStats(graph.size(),
                              ordinals.liveCount(),
                              graph.deletedCount(),
                              graph.getAverageDegree(),
                              graph.layerHistogram(),
                              entry == null ? -1 : entry.level,
                              entry == null ? -1 : entry.node,
                              gen == null ? 0 : gen.getVersion(),
                              needsRebuild());
    }

    /**
     * @return true once an internal inconsistency was detected; the index is then read-only
     */
    public boolean needsRebuild() {
        return readOnlyCause != null;
    }

    /**
     * Purges tombstoned nodes from the graph, repairing the neighbor lists that pointed at them, and deletes their
     * records.  Searches wait while this runs.
     *
     * @return the number of nodes purged
     */
    public int compact() {
        checkWritable();
        writeLock.lock();
        try {
            checkWritable();
            var lock = structureLock.writeLock();
            lock.lock();
            try {
                return compactInternal();
            } finally {
                lock.unlock();
            }
        } catch (InternalInconsistencyException e) {
            flagReadOnly(e);
            throw e;
        } finally {
            writeLock.unlock();
        }
    }

    private int compactInternal() {
        var purged = new ArrayList<Integer>();
        for (int node : graph.nodesOnLevel(0)) {
            if (graph.isDeleted(node)) {
                purged.add(node);
            }
        }
        if (purged.isEmpty()) {
            return 0;
        }
        builder.removeDeletedNodes();
        var gen = generation.get();
        if (gen != null) {
            purged.forEach(gen.getVectors()::remove);
        }

        // the node table must stop referring to a record before the record goes away
        store.writeNodeTable(graph, ordinals::idOf);
        int deletedRecords = 0;
        for (int ordinal : purged) {
            long id = ordinals.forget(ordinal);
            var record = store.getIfPresent(id);
            if (record != null && record.getOrdinal() == ordinal && store.delete(id)) {
                deletedRecords++;
            }
        }
        store.writeHeader(header());
        LOG.info("Compaction purged {} nodes and {} vector records", purged.size(), deletedRecords);
        return purged.size();
    }

    /**
     * Writes the node table and the header.  Vector records and codebooks are written as they change.
     */
    public void flush() {
        checkWritable();
        writeLock.lock();
        try {
            flushInternal();
        } finally {
            writeLock.unlock();
        }
    }

    private void flushInternal() {
        store.writeNodeTable(graph, ordinals::idOf);
        store.writeHeader(header());
    }

    private IndexHeader header() {
        return new IndexHeader(config.getDimension(), config.getSimilarityFunction(), config.getMaxDegree(),
                               config.getEfConstruction(), config.getQuantizerConfig(), codebookVersion,
                               ordinals.nextOrdinal());
    }

    private void checkWritable() {
        var cause = readOnlyCause;
        if (cause != null) {
            throw new IndexReadOnlyException("Index is read-only and needs a rebuild", cause);
        }
    }

    private synchronized void flagReadOnly(InternalInconsistencyException e) {
        if (readOnlyCause == null) {
            readOnlyCause = e;
            LOG.error("Index is now read-only and needs a rebuild", e);
        }
    }

    @VisibleForTesting
    VectorStore getStore() {
        return store;
    }

    @VisibleForTesting
    OnHeapGraphIndex getGraph() {
        return graph;
    }

    /**
     * Flushes unless the index is read-only, then releases the per-thread searchers.
     */
    @Override
    public void close() throws Exception {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!needsRebuild()) {
                flush();
            }
        } finally {
            queryEngine.close();
        }
    }
}
