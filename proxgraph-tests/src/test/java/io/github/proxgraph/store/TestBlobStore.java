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
import io.github.proxgraph.TestUtil;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestBlobStore extends ProxGraphTestCase {
    private Path testDirectory;

    @Before
    public void setup() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
    }

    @After
    public void tearDown() {
        TestUtil.deleteQuietly(testDirectory);
    }

    private static void checkBasicContract(BlobStore store) throws IOException {
        assertNull(store.read("missing"));
        assertFalse(store.delete("missing"));

        store.write("vectors/0001", "one".getBytes(UTF_8));
        store.write("vectors/0002", "two".getBytes(UTF_8));
        store.write("header", "h".getBytes(UTF_8));
        assertArrayEquals("one".getBytes(UTF_8), store.read("vectors/0001"));

        store.write("vectors/0001", "uno".getBytes(UTF_8));
        assertArrayEquals("uno".getBytes(UTF_8), store.read("vectors/0001"));

        assertEquals(List.of("vectors/0001", "vectors/0002"), store.listKeys("vectors/"));
        assertEquals(List.of("header", "vectors/0001", "vectors/0002"), store.listKeys(""));

        assertTrue(store.delete("vectors/0001"));
        assertNull(store.read("vectors/0001"));
        assertEquals(List.of("vectors/0002"), store.listKeys("vectors/"));
    }

    @Test
    public void testInMemory() throws IOException {
        var store = new InMemoryBlobStore();
        checkBasicContract(store);
        assertEquals(2, store.size());
    }

    @Test
    public void testInMemoryCopiesBlobs() {
        var store = new InMemoryBlobStore();
        byte[] bytes = {1, 2, 3};
        store.write("k", bytes);
        bytes[0] = 9;
        store.read("k")[1] = 9;
        assertArrayEquals(new byte[] {1, 2, 3}, store.read("k"));
        assertEquals(3, store.totalBytes());
    }

    @Test
    public void testFile() throws IOException {
        var store = new FileBlobStore(testDirectory.resolve("blobs"));
        checkBasicContract(store);
        assertTrue(Files.exists(store.getRoot().resolve("vectors").resolve("0002")));
    }

    @Test
    public void testFileStoreReopens() throws IOException {
        var first = new FileBlobStore(testDirectory);
        first.write("graph/nodes", new byte[] {4, 5});
        var second = new FileBlobStore(testDirectory);
        assertArrayEquals(new byte[] {4, 5}, second.read("graph/nodes"));
    }

    @Test
    public void testInvalidKeys() throws IOException {
        var stores = List.of(new InMemoryBlobStore(), new FileBlobStore(testDirectory));
        for (var store : stores) {
            for (String key : new String[] {"", "/abs", "trailing/", "a//b", "../escape", "a/./b", "sp ace"}) {
                try {
                    store.write(key, new byte[0]);
                    fail(store + " accepted " + key);
                } catch (IllegalArgumentException expected) {
                }
            }
        }
        BlobStore.checkKey("vectors/00000000000000ff");
        BlobStore.checkKey("a.b-c_d");
    }
}
