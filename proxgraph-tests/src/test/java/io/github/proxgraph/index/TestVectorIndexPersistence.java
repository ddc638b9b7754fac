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

import io.github.proxgraph.ProxGraphTestCase;
import io.github.proxgraph.TestUtil;
import io.github.proxgraph.exceptions.IndexReadOnlyException;
import io.github.proxgraph.exceptions.InternalInconsistencyException;
import io.github.proxgraph.quantization.QuantizerConfig;
import io.github.proxgraph.store.BlobStore;
import io.github.proxgraph.store.FileBlobStore;
import io.github.proxgraph.store.InMemoryBlobStore;
import io.github.proxgraph.store.VectorRecord;
import io.github.proxgraph.store.VectorStore;
import io.github.proxgraph.vector.VectorSimilarityFunction;
import io.github.proxgraph.vector.types.VectorFloat;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static io.github.proxgraph.TestUtil.createRandomVectors;
import static io.github.proxgraph.TestUtil.ids;
import static io.github.proxgraph.TestUtil.randomVector;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestVectorIndexPersistence extends ProxGraphTestCase {
    private static final int DIMENSION = 8;

    private Path testDirectory;

    @Before
    public void setup() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
    }

    @After
    public void tearDown() {
        TestUtil.deleteQuietly(testDirectory);
    }

    private IndexConfig config() {
        return IndexConfig.builder(DIMENSION, VectorSimilarityFunction.EUCLIDEAN)
                .maxDegree(12)
                .efConstruction(60)
                .quantizer(QuantizerConfig.none())
                .retry(2, 0)
                .seed(randomLong())
                .build();
    }

    private static void insertAll(VectorIndex index, List<VectorFloat<?>> vectors, int from, int to) {
        for (int i = from; i < to; i++) {
            index.insert(i, vectors.get(i), Map.of("n", String.valueOf(i)));
        }
    }

    private static void assertFindsItself(VectorIndex index, List<VectorFloat<?>> vectors, long id) {
        var hits = index.search(vectors.get((int) id), 1).getHits();
        assertEquals(1, hits.size());
        assertEquals(id, hits.get(0).getId());
        assertEquals(0f, hits.get(0).getScore(), 0f);
    }

    @Test
    public void testCloseAndReopen() throws Exception {
        BlobStore blobs = new FileBlobStore(testDirectory);
        var vectors = createRandomVectors(getRandom(), 300, DIMENSION);
        var queries = createRandomVectors(getRandom(), 10, DIMENSION);
        var config = config();

        SearchResult[] before = new SearchResult[queries.size()];
        try (var index = VectorIndex.create(blobs, config)) {
            insertAll(index, vectors, 0, 300);
            index.delete(17);
            for (int q = 0; q < queries.size(); q++) {
                before[q] = index.search(queries.get(q), 10);
            }
        }

        try (var reopened = VectorIndex.open(blobs)) {
            assertFalse(reopened.needsRebuild());
            assertEquals(299, reopened.size());
            assertFalse(reopened.contains(17));
            assertEquals("42", reopened.get(42).getMetadata().get("n"));
            assertEquals(config.getMaxDegree(), reopened.getConfig().getMaxDegree());
            assertEquals(config.getEfConstruction(), reopened.getConfig().getEfConstruction());
            assertEquals(1, reopened.stats().getTombstoneCount());
            // same topology, same answers
            for (int q = 0; q < queries.size(); q++) {
                assertEquals(ids(before[q]), ids(reopened.search(queries.get(q), 10)));
            }
            for (long id = 0; id < 300; id += 7) {
                if (id != 17) {
                    assertFindsItself(reopened, vectors, id);
                }
            }
            // the reopened index keeps accepting writes, with fresh ordinals
            var extra = randomVector(getRandom(), DIMENSION);
            reopened.insert(1000, extra);
            assertEquals(1000, reopened.search(extra, 1).getHits().get(0).getId());
        }
    }

    @Test
    public void testUnflushedInsertsAreReplayed() throws Exception {
        var blobs = new InMemoryBlobStore();
        var vectors = createRandomVectors(getRandom(), 120, DIMENSION);
        var crashed = VectorIndex.create(blobs, config());
        insertAll(crashed, vectors, 0, 100);
        crashed.flush();
        insertAll(crashed, vectors, 100, 120);
        crashed.delete(3);
        crashed.delete(110);
        // no flush or close: the node table on disk predates the last 20 inserts

        try (var recovered = VectorIndex.open(blobs)) {
            assertFalse(recovered.needsRebuild());
            assertEquals(118, recovered.size());
            assertFalse(recovered.contains(3));
            assertFalse(recovered.contains(110));
            for (long id = 100; id < 120; id++) {
                if (id != 110) {
                    assertFindsItself(recovered, vectors, id);
                }
            }
            // the orphaned tombstone of an insert that never reached the node table is gone
            assertFalse(recovered.getStore().contains(110));
        }
    }

    @Test
    public void testReinsertedIdSurvivesReopen() throws Exception {
        var blobs = new InMemoryBlobStore();
        var vectors = createRandomVectors(getRandom(), 100, DIMENSION);
        var moved = randomVector(getRandom(), DIMENSION);
        try (var index = VectorIndex.create(blobs, config())) {
            insertAll(index, vectors, 0, 100);
            index.flush();
            index.insert(5, moved, Map.of(), true);
        }
        try (var reopened = VectorIndex.open(blobs)) {
            assertFalse(reopened.needsRebuild());
            assertEquals(100, reopened.size());
            assertEquals(moved, reopened.get(5).getVector());
            assertEquals(5, reopened.search(moved, 1).getHits().get(0).getId());
            // the superseded node was purged on open
            assertEquals(0, reopened.stats().getTombstoneCount());
            assertEquals(100, reopened.stats().getNodeCount());
        }
    }

    @Test
    public void testCreateAndOpenPreconditions() throws Exception {
        var blobs = new InMemoryBlobStore();
        try {
            VectorIndex.open(blobs);
            fail();
        } catch (IllegalArgumentException expected) {
        }
        var config = config();
        VectorIndex.create(blobs, config).close();
        try {
            VectorIndex.create(blobs, config);
            fail();
        } catch (IllegalArgumentException expected) {
        }
        try {
            VectorIndex.open(blobs, IndexConfig.builder(DIMENSION + 1, VectorSimilarityFunction.EUCLIDEAN).build());
            fail();
        } catch (IllegalArgumentException expected) {
        }
        try {
            VectorIndex.open(blobs, IndexConfig.builder(DIMENSION, VectorSimilarityFunction.COSINE).build());
            fail();
        } catch (IllegalArgumentException expected) {
        }

        // runtime settings come from the caller, graph settings from the header
        var runtime = IndexConfig.builder(DIMENSION, VectorSimilarityFunction.EUCLIDEAN)
                .maxDegree(32)
                .defaultEfSearch(77)
                .build();
        try (var index = VectorIndex.open(blobs, runtime)) {
            assertEquals(77, index.getConfig().getDefaultEfSearch());
            assertEquals(config.getMaxDegree(), index.getConfig().getMaxDegree());
        }
    }

    @Test
    public void testMissingVectorMakesIndexReadOnly() throws Exception {
        var blobs = new InMemoryBlobStore();
        var vectors = createRandomVectors(getRandom(), 100, DIMENSION);
        try (var index = VectorIndex.create(blobs, config())) {
            insertAll(index, vectors, 0, 100);
        }
        // lose a live record behind the index's back
        assertTrue(blobs.delete(VectorStore.VECTOR_PREFIX + String.format("%016x", 40L)));

        try (var broken = VectorIndex.open(blobs)) {
            assertTrue(broken.needsRebuild());
            assertTrue(broken.stats().needsRebuild());
            assertEquals(99, broken.size());
            // reads still work
            assertFindsItself(broken, vectors, 41);
            assertFalse(ids(broken.search(vectors.get(40), 10)).contains(40L));
            // writes do not
            try {
                broken.insert(500, randomVector(getRandom(), DIMENSION));
                fail();
            } catch (IndexReadOnlyException e) {
                assertTrue(e.getCause() instanceof InternalInconsistencyException);
            }
            try {
                broken.delete(1);
                fail();
            } catch (IndexReadOnlyException expected) {
            }
            try {
                broken.compact();
                fail();
            } catch (IndexReadOnlyException expected) {
            }
        }
    }

    @Test
    public void testNodeTableConflictFailsOpen() throws Exception {
        var blobs = new InMemoryBlobStore();
        var vectors = createRandomVectors(getRandom(), 50, DIMENSION);
        try (var index = VectorIndex.create(blobs, config())) {
            insertAll(index, vectors, 0, 50);
        }
        // a second vector claims the graph node of vector 5
        byte[] bytes = blobs.read(VectorStore.VECTOR_PREFIX + String.format("%016x", 5L));
        var original = VectorRecord.read(new DataInputStream(new ByteArrayInputStream(bytes)), TestUtil.vts);
        var impostor = new VectorRecord(9999, original.getOrdinal(), original.getVector(), Map.of());
        var out = new ByteArrayOutputStream();
        impostor.write(new DataOutputStream(out), TestUtil.vts);
        blobs.write(VectorStore.VECTOR_PREFIX + String.format("%016x", 9999L), out.toByteArray());

        // the topology itself is untrustworthy, so there is no read-only fallback
        try {
            VectorIndex.open(blobs);
            fail();
        } catch (InternalInconsistencyException expected) {
        }
    }
}
